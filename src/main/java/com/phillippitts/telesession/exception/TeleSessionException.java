package com.phillippitts.telesession.exception;

/**
 * Base exception for all telesession application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class TeleSessionException extends RuntimeException {

    private final ErrorCode errorCode;

    public TeleSessionException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TeleSessionException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
