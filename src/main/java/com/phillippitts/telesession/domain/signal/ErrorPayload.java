package com.phillippitts.telesession.domain.signal;

import java.util.Objects;

/**
 * Payload of {@code error}: a stable code (e.g. {@code session-full}) and a message.
 */
public record ErrorPayload(String code, String message) implements SignalPayload {

    public ErrorPayload {
        Objects.requireNonNull(code, "code must not be null");
        message = message == null ? "" : message;
    }
}
