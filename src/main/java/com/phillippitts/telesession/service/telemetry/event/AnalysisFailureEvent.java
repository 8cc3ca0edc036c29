package com.phillippitts.telesession.service.telemetry.event;

import com.phillippitts.telesession.exception.ErrorCode;

import java.time.Instant;

/**
 * Published when an analysis call times out or fails and subscribers fall back to the
 * previous result.
 */
public record AnalysisFailureEvent(
        String sessionId,
        long sequenceNumber,
        ErrorCode code,
        String message,
        Instant at
) {
    public AnalysisFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
