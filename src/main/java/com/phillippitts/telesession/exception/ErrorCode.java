package com.phillippitts.telesession.exception;

import java.util.Locale;

/**
 * Stable error codes carried by every {@link TeleSessionException} and sent to clients in
 * {@code error} signal messages.
 */
public enum ErrorCode {
    MALFORMED_MESSAGE,
    CONFLICTING_OFFER,
    SESSION_FULL,
    SESSION_CLOSED,
    SESSION_NOT_FOUND,
    UNKNOWN_PARTICIPANT,
    INVALID_TRANSITION,
    ANALYSIS_TIMEOUT,
    ANALYSIS_FAILURE,
    SOCKET_DROPPED;

    /**
     * Returns the wire form of this code, e.g. {@code session-full}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
