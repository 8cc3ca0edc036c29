package com.phillippitts.telesession.exception;

/**
 * Thrown by the signal and telemetry codecs when an inbound message is not valid JSON,
 * carries an unknown {@code type}, or has a payload whose shape does not match its type.
 */
public class MalformedMessageException extends TeleSessionException {

    private final String reason;

    public MalformedMessageException(String reason) {
        super(ErrorCode.MALFORMED_MESSAGE, "Malformed message: " + reason);
        this.reason = reason;
    }

    public MalformedMessageException(String reason, Throwable cause) {
        super(ErrorCode.MALFORMED_MESSAGE, "Malformed message: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
