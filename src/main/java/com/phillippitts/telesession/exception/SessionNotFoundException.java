package com.phillippitts.telesession.exception;

/**
 * Thrown when a session id is unknown to the registry (never created, or already evicted).
 */
public class SessionNotFoundException extends SessionException {

    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, sessionId, "Session not found");
    }
}
