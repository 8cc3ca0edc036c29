package com.phillippitts.telesession.domain.signal;

/**
 * Optional payload of {@code end-session}.
 */
public record SessionEndPayload(String reason) implements SignalPayload {

    public static SessionEndPayload none() {
        return new SessionEndPayload(null);
    }
}
