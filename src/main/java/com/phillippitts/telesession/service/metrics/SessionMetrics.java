package com.phillippitts.telesession.service.metrics;

import com.phillippitts.telesession.service.session.event.SessionEndedEvent;
import com.phillippitts.telesession.service.session.event.SessionStateChangedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the session layer.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Session state transitions and end reasons</li>
 *   <li>Relayed signaling messages by type and outcome</li>
 *   <li>Telemetry frame outcomes and analysis latency/failures</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer under {@code telesession.*}.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SessionMetrics {

    private static final String METRIC_PREFIX = "telesession";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void onStateChanged(SessionStateChangedEvent event) {
        Counter.builder(METRIC_PREFIX + ".session.transitions")
                .description("Session state transitions")
                .tag("from", event.from() == null ? "none" : event.from().name())
                .tag("to", event.to().name())
                .tag("kind", event.kind().wireName())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onSessionEnded(SessionEndedEvent event) {
        Timer.builder(METRIC_PREFIX + ".session.duration")
                .description("Session lifetime from creation to end")
                .tag("reason", event.summary().endReason().name())
                .register(registry)
                .record(event.summary().duration());
    }

    /**
     * Counts a signaling message handled by the relay.
     *
     * @param type    wire type, e.g. {@code offer}
     * @param outcome delivered, held, buffered or dropped
     */
    public void recordRelayed(String type, String outcome) {
        Counter.builder(METRIC_PREFIX + ".signaling.messages")
                .description("Signaling messages handled by the relay")
                .tag("type", type)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Counts a signaling message rejected with an error reply.
     */
    public void recordSignalingError(String errorCode) {
        Counter.builder(METRIC_PREFIX + ".signaling.errors")
                .description("Signaling messages answered with an error")
                .tag("code", errorCode)
                .register(registry)
                .increment();
    }

    /**
     * Counts a submitted telemetry frame by outcome.
     *
     * @param status accepted, throttled or rejected
     * @param reason throttle or rejection reason, {@code none} when accepted
     */
    public void recordFrame(String status, String reason) {
        Counter.builder(METRIC_PREFIX + ".telemetry.frames")
                .description("Telemetry frames by submit outcome")
                .tag("status", status)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records the duration of one analysis call.
     */
    public void recordAnalysisLatency(long durationNanos, String outcome) {
        Timer.builder(METRIC_PREFIX + ".telemetry.analysis.latency")
                .description("Time taken by the analysis collaborator")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts an analysis call that timed out or failed.
     */
    public void incrementAnalysisFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".telemetry.analysis.failure")
                .description("Analysis calls that degraded to the previous result")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
