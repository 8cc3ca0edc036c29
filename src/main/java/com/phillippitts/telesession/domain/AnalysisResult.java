package com.phillippitts.telesession.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of analysing one pose frame.
 *
 * @param sessionId           owning session
 * @param frameSequenceNumber sequence number of the frame this result answers
 * @param score               movement quality score reported by the analysis collaborator
 * @param feedback            human-readable coaching feedback (may be empty)
 * @param computedAt          when the result arrived
 */
public record AnalysisResult(
        String sessionId,
        long frameSequenceNumber,
        double score,
        String feedback,
        Instant computedAt
) {
    public AnalysisResult {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(computedAt, "computedAt must not be null");
        feedback = feedback == null ? "" : feedback;
    }
}
