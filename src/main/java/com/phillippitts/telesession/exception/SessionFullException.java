package com.phillippitts.telesession.exception;

/**
 * Thrown when a third participant attempts to join a two-party session, or when a session
 * is requested with more than two participants.
 */
public class SessionFullException extends SessionException {

    public SessionFullException(String sessionId, String participantId) {
        super(ErrorCode.SESSION_FULL, sessionId, "Session is full, rejected participant " + participantId);
    }
}
