package com.phillippitts.telesession.domain;

/**
 * Lifecycle states of a call session.
 *
 * <pre>
 * CREATED → OFFERING → ANSWERING → CONNECTED ⇄ RECONNECTING
 *    any non-terminal state → ENDED
 * </pre>
 */
public enum SessionState {
    CREATED,
    OFFERING,
    ANSWERING,
    CONNECTED,
    RECONNECTING,
    ENDED;

    public boolean isTerminal() {
        return this == ENDED;
    }
}
