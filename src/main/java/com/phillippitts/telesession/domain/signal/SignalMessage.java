package com.phillippitts.telesession.domain.signal;

import com.phillippitts.telesession.exception.ErrorCode;

import java.util.Objects;

/**
 * One message of the signaling protocol.
 *
 * <p>{@code sessionId} is empty only for a {@code start-session} that asks the server to
 * create a new session.
 */
public record SignalMessage(
        SignalType type,
        String sessionId,
        String senderId,
        SignalPayload payload
) {

    /** Sender id used for messages originated by the server. */
    public static final String SERVER_SENDER = "server";

    public SignalMessage {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(senderId, "senderId must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        sessionId = sessionId == null ? "" : sessionId;
    }

    public boolean hasSessionId() {
        return !sessionId.isBlank();
    }

    public static SignalMessage error(String sessionId, ErrorCode code, String message) {
        return new SignalMessage(SignalType.ERROR, sessionId, SERVER_SENDER,
                new ErrorPayload(code.wireName(), message));
    }

    public static SignalMessage endSession(String sessionId, String senderId, String reason) {
        return new SignalMessage(SignalType.END_SESSION, sessionId, senderId, new SessionEndPayload(reason));
    }
}
