package com.phillippitts.telesession.exception;

/**
 * Common parent for rejections tied to a specific session.
 */
public abstract class SessionException extends TeleSessionException {

    private final String sessionId;

    protected SessionException(ErrorCode errorCode, String sessionId, String message) {
        super(errorCode, message + " (session: " + sessionId + ")");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
