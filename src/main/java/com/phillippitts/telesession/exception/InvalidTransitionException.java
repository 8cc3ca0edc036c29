package com.phillippitts.telesession.exception;

import com.phillippitts.telesession.domain.SessionState;

/**
 * Thrown when a signal is not legal in the session's current state, e.g. an answer
 * arriving before any offer.
 */
public class InvalidTransitionException extends SessionException {

    private final SessionState from;
    private final String trigger;

    public InvalidTransitionException(String sessionId, SessionState from, String trigger) {
        super(ErrorCode.INVALID_TRANSITION, sessionId, "'" + trigger + "' is not allowed in state " + from);
        this.from = from;
        this.trigger = trigger;
    }

    public SessionState getFrom() {
        return from;
    }

    public String getTrigger() {
        return trigger;
    }
}
