package com.phillippitts.telesession.service.telemetry;

import com.phillippitts.telesession.domain.AnalysisResult;
import com.phillippitts.telesession.domain.PoseFrame;

import java.util.Optional;

/**
 * Streaming telemetry: throttles incoming pose frames per session, keeps at most one
 * analysis in flight, and fans results out to subscribers.
 */
public interface TelemetryPipeline {

    /**
     * Submits a frame and returns immediately.
     */
    SubmitOutcome submitFrame(String sessionId, PoseFrame frame);

    /**
     * Registers a subscriber for the session's updates. Closing the handle unsubscribes.
     *
     * @throws com.phillippitts.telesession.exception.SessionNotFoundException if the session is unknown
     * @throws com.phillippitts.telesession.exception.SessionClosedException   if the session has ended
     */
    AutoCloseable subscribe(String sessionId, TelemetrySubscriber subscriber);

    /**
     * Last fresh result of the session, if any.
     */
    Optional<AnalysisResult> latestResult(String sessionId);
}
