package com.phillippitts.telesession.service.telemetry;

import com.phillippitts.telesession.domain.AnalysisResult;
import com.phillippitts.telesession.exception.ErrorCode;

import java.util.Objects;

/**
 * Update pushed to telemetry subscribers.
 *
 * <p>A {@link Kind#FRESH} update carries the result for the latest accepted frame. A
 * {@link Kind#PREVIOUS} update means that analysis timed out or failed: {@code result} is the
 * last good result (possibly {@code null}) and {@code reason} says why.
 *
 * @param sequenceNumber the accepted frame this update answers
 */
public record TelemetryUpdate(
        String sessionId,
        Kind kind,
        long sequenceNumber,
        AnalysisResult result,
        ErrorCode reason
) {

    public enum Kind { FRESH, PREVIOUS }

    public TelemetryUpdate {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.FRESH && result == null) {
            throw new IllegalArgumentException("A fresh update needs a result");
        }
    }

    public static TelemetryUpdate fresh(AnalysisResult result) {
        return new TelemetryUpdate(result.sessionId(), Kind.FRESH, result.frameSequenceNumber(), result, null);
    }

    public static TelemetryUpdate previous(String sessionId, long sequenceNumber, AnalysisResult lastGood,
                                           ErrorCode reason) {
        return new TelemetryUpdate(sessionId, Kind.PREVIOUS, sequenceNumber, lastGood, reason);
    }
}
