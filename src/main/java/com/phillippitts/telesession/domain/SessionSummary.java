package com.phillippitts.telesession.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary returned when a session ends. Repeated end requests return the same summary.
 *
 * @param details per-component statistics contributed while the session was torn down
 *                (relayed messages, accepted frames, average score, ...)
 */
public record SessionSummary(
        String sessionId,
        SessionKind kind,
        List<String> participantIds,
        Instant createdAt,
        Instant endedAt,
        Duration duration,
        EndReason endReason,
        Map<String, Object> details
) {
    public SessionSummary {
        participantIds = participantIds == null ? List.of() : List.copyOf(participantIds);
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
