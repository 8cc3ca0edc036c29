package com.phillippitts.telesession.presentation.controller.dto;

import com.phillippitts.telesession.domain.SessionSummary;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of {@code POST /api/v1/sessions/{id}/end}.
 */
public record SessionSummaryResponse(
        String sessionId,
        String kind,
        List<String> participantIds,
        Instant createdAt,
        Instant endedAt,
        long durationMs,
        String endReason,
        Map<String, Object> details
) {

    public static SessionSummaryResponse from(SessionSummary summary) {
        return new SessionSummaryResponse(
                summary.sessionId(),
                summary.kind().wireName(),
                summary.participantIds(),
                summary.createdAt(),
                summary.endedAt(),
                summary.duration().toMillis(),
                summary.endReason().wireName(),
                summary.details());
    }
}
