package com.phillippitts.telesession.service.telemetry;

import com.phillippitts.telesession.domain.PoseFrame;

/**
 * Narrow contract to the pose analysis collaborator.
 *
 * <p>Implementations are called from the analysis executor and may block; the pipeline
 * applies the timeout.
 */
public interface AnalysisClient {

    /**
     * Analyses one frame.
     *
     * @throws com.phillippitts.telesession.exception.AnalysisFailureException if the
     *         collaborator fails or answers with something unusable
     */
    Analysis analyze(PoseFrame frame);

    /**
     * Whether the collaborator is configured at all.
     */
    default boolean isAvailable() {
        return true;
    }
}
