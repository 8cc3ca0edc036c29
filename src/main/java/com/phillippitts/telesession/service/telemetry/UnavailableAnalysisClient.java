package com.phillippitts.telesession.service.telemetry;

import com.phillippitts.telesession.domain.PoseFrame;
import com.phillippitts.telesession.exception.AnalysisFailureException;

/**
 * Used when no analysis endpoint is configured. Every call fails, which the pipeline turns
 * into {@code analysis-pending} updates.
 */
public class UnavailableAnalysisClient implements AnalysisClient {

    @Override
    public Analysis analyze(PoseFrame frame) {
        throw new AnalysisFailureException("No analysis endpoint configured (telemetry.analysis.url)");
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
