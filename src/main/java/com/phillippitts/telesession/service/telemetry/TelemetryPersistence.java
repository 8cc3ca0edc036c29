package com.phillippitts.telesession.service.telemetry;

import com.phillippitts.telesession.domain.AnalysisResult;

/**
 * Hook for storing analysis results. Calls are best-effort: a failure is logged and never
 * reaches the session.
 */
@FunctionalInterface
public interface TelemetryPersistence {

    void persist(AnalysisResult result);
}
