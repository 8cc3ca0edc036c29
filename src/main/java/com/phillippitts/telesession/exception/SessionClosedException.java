package com.phillippitts.telesession.exception;

/**
 * Thrown when a message references a session that has reached the terminal state, or
 * when telemetry is submitted for a session that is not streaming-eligible.
 */
public class SessionClosedException extends SessionException {

    public SessionClosedException(String sessionId) {
        super(ErrorCode.SESSION_CLOSED, sessionId, "Session is closed");
    }
}
