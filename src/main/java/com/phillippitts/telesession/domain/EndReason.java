package com.phillippitts.telesession.domain;

import java.util.Locale;

/**
 * Why a session reached {@link SessionState#ENDED}.
 */
public enum EndReason {
    PARTICIPANT_REQUEST,
    API_REQUEST,
    RECONNECT_GRACE_EXPIRED,
    NEGOTIATION_TIMEOUT;

    /**
     * Form used in {@code end-session} payloads, e.g. {@code reconnect-grace-expired}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
