package com.phillippitts.telesession.service.signaling.event;

import com.phillippitts.telesession.exception.ErrorCode;

import java.time.Instant;

/**
 * Published when a signaling message is rejected with an {@code error} reply.
 *
 * <p>Carries no payload content; SDP and candidates stay out of events.
 */
public record SignalingErrorEvent(
        String sessionId,
        String channelId,
        ErrorCode code,
        String message,
        Instant at
) {
    public SignalingErrorEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
