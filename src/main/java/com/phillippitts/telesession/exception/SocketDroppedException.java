package com.phillippitts.telesession.exception;

/**
 * Raised when a signaling socket cannot be opened or is lost unexpectedly.
 * Triggers reconnection rather than ending the session.
 */
public class SocketDroppedException extends TeleSessionException {

    public SocketDroppedException(String message) {
        super(ErrorCode.SOCKET_DROPPED, message);
    }

    public SocketDroppedException(String message, Throwable cause) {
        super(ErrorCode.SOCKET_DROPPED, message, cause);
    }
}
