package com.phillippitts.telesession.service.telemetry;

import com.phillippitts.telesession.config.properties.TelemetryProperties;
import com.phillippitts.telesession.domain.AnalysisResult;
import com.phillippitts.telesession.domain.EndReason;
import com.phillippitts.telesession.domain.PoseFrame;
import com.phillippitts.telesession.domain.Session;
import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.domain.SessionState;
import com.phillippitts.telesession.exception.AnalysisFailureException;
import com.phillippitts.telesession.exception.AnalysisTimeoutException;
import com.phillippitts.telesession.exception.ErrorCode;
import com.phillippitts.telesession.exception.SessionClosedException;
import com.phillippitts.telesession.exception.SessionNotFoundException;
import com.phillippitts.telesession.service.metrics.SessionMetrics;
import com.phillippitts.telesession.service.session.SessionRegistry;
import com.phillippitts.telesession.service.session.SessionTeardownHook;
import com.phillippitts.telesession.service.telemetry.event.AnalysisFailureEvent;
import com.phillippitts.telesession.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link TelemetryPipeline}.
 *
 * <p>Per session a {@link TelemetryStream} tracks the last seen sequence number, the time of
 * the last accepted frame, a {@link SingleFlightGate} and the latest good result. A frame is
 * accepted only if it is newer than every frame seen so far, at least the minimum interval
 * after the previous accepted frame, and no analysis is in flight. Everything else is
 * throttled and dropped; the client keeps showing the previous result.
 *
 * <p>Analysis runs on the {@code analysisExecutor} with a timeout. A completion is used only
 * if it answers the latest accepted frame of a stream that is still open. Timeouts and
 * failures produce {@link TelemetryUpdate.Kind#PREVIOUS} updates and an
 * {@link AnalysisFailureEvent}; they never end the session.
 *
 * <p>As a {@link SessionTeardownHook} the pipeline cancels the in-flight analysis, releases
 * the gate, drops subscribers and reports stream statistics.
 *
 * @since 1.0
 */
@Service
@Order(2)
public class DefaultTelemetryPipeline implements TelemetryPipeline, SessionTeardownHook {

    private static final Logger LOG = LogManager.getLogger(DefaultTelemetryPipeline.class);

    private final Map<String, TelemetryStream> streams = new ConcurrentHashMap<>();

    private final SessionRegistry registry;
    private final AnalysisClient analysisClient;
    private final TelemetryPersistence persistence;
    private final Executor analysisExecutor;
    private final SessionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Duration minInterval;
    private final long analysisTimeoutMs;

    public DefaultTelemetryPipeline(SessionRegistry registry,
                                    AnalysisClient analysisClient,
                                    TelemetryPersistence persistence,
                                    @Qualifier("analysisExecutor") Executor analysisExecutor,
                                    SessionMetrics metrics,
                                    ApplicationEventPublisher publisher,
                                    Clock clock,
                                    TelemetryProperties properties) {
        this.registry = registry;
        this.analysisClient = analysisClient;
        this.persistence = persistence;
        this.analysisExecutor = analysisExecutor;
        this.metrics = metrics;
        this.publisher = publisher;
        this.clock = clock;
        this.minInterval = Duration.ofMillis(properties.getMinIntervalMs());
        this.analysisTimeoutMs = properties.getAnalysisTimeoutMs();
    }

    @Override
    public SubmitOutcome submitFrame(String sessionId, PoseFrame frame) {
        if (!frame.sessionId().equals(sessionId)) {
            throw new IllegalArgumentException("Frame belongs to session " + frame.sessionId() + ", not " + sessionId);
        }
        long seq = frame.sequenceNumber();
        TelemetryStream stream = streams.computeIfAbsent(sessionId, TelemetryStream::new);

        Optional<Session> session = registry.find(sessionId);
        if (session.isEmpty() || !isStreamingEligible(session.get())) {
            if (session.isEmpty() || session.get().state().isTerminal()) {
                streams.remove(sessionId, stream);
            }
            return record(SubmitOutcome.rejected(seq));
        }

        Instant now = clock.instant();
        synchronized (stream) {
            if (stream.closed) {
                return record(SubmitOutcome.rejected(seq));
            }
            if (seq <= stream.lastSeenSequence) {
                stream.throttled++;
                return record(SubmitOutcome.throttled(seq, SubmitOutcome.Reason.STALE_SEQUENCE));
            }
            stream.lastSeenSequence = seq;
            if (TimeUtils.withinWindow(stream.lastAcceptedAt, minInterval, now)) {
                stream.throttled++;
                return record(SubmitOutcome.throttled(seq, SubmitOutcome.Reason.INTERVAL));
            }
            if (!stream.gate.tryAcquire()) {
                stream.throttled++;
                return record(SubmitOutcome.throttled(seq, SubmitOutcome.Reason.IN_FLIGHT));
            }
            stream.lastAcceptedAt = now;
            stream.latestAcceptedSequence = seq;
            stream.accepted++;
        }

        // the gate is held, so no other frame of this stream can start until this call completes
        long startNanos = System.nanoTime();
        CompletableFuture<Analysis> call = startAnalysis(frame);
        synchronized (stream) {
            if (stream.closed) {
                call.cancel(true);
                return record(SubmitOutcome.rejected(seq));
            }
            stream.inFlight = call;
        }
        call.whenComplete((analysis, error) -> complete(stream, call, frame, startNanos, analysis, error));
        return record(SubmitOutcome.accepted(seq));
    }

    @Override
    public AutoCloseable subscribe(String sessionId, TelemetrySubscriber subscriber) {
        TelemetryStream stream = streams.computeIfAbsent(sessionId, TelemetryStream::new);
        Optional<Session> session = registry.find(sessionId);
        if (session.isEmpty()) {
            streams.remove(sessionId, stream);
            throw new SessionNotFoundException(sessionId);
        }
        if (session.get().state().isTerminal()) {
            streams.remove(sessionId, stream);
            throw new SessionClosedException(sessionId);
        }
        synchronized (stream) {
            if (stream.closed) {
                throw new SessionClosedException(sessionId);
            }
            stream.subscribers.add(subscriber);
        }
        LOG.debug("Subscriber added to session {}", sessionId);
        return () -> stream.subscribers.remove(subscriber);
    }

    @Override
    public Optional<AnalysisResult> latestResult(String sessionId) {
        TelemetryStream stream = streams.get(sessionId);
        if (stream == null) {
            return Optional.empty();
        }
        synchronized (stream) {
            return Optional.ofNullable(stream.latestResult);
        }
    }

    @Override
    public void onSessionEnding(String sessionId, EndReason reason, Map<String, Object> details) {
        TelemetryStream stream = streams.remove(sessionId);
        if (stream == null) {
            details.put("telemetry.framesAccepted", 0L);
            return;
        }
        synchronized (stream) {
            stream.closed = true;
            if (stream.inFlight != null) {
                stream.inFlight.cancel(true);
                stream.inFlight = null;
            }
            stream.gate.release();
            stream.subscribers.clear();

            details.put("telemetry.framesAccepted", stream.accepted);
            details.put("telemetry.framesThrottled", stream.throttled);
            details.put("telemetry.resultsDelivered", stream.delivered);
            details.put("telemetry.analysisFailures", stream.failures);
            if (stream.delivered > 0) {
                details.put("telemetry.averageScore", stream.scoreSum / stream.delivered);
            }
        }
        LOG.debug("Closed telemetry stream of session {}", sessionId);
    }

    /**
     * Peer calls stream only while connected; AI calls have no negotiation and stream until
     * they drop or end.
     */
    static boolean isStreamingEligible(Session session) {
        SessionState state = session.state();
        if (session.kind() == SessionKind.PEER_CALL) {
            return state == SessionState.CONNECTED;
        }
        return state != SessionState.RECONNECTING && state != SessionState.ENDED;
    }

    private CompletableFuture<Analysis> startAnalysis(PoseFrame frame) {
        try {
            return CompletableFuture.supplyAsync(() -> analysisClient.analyze(frame), analysisExecutor)
                    .orTimeout(analysisTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(
                    new AnalysisFailureException("Analysis executor rejected frame " + frame.sequenceNumber(), e));
        }
    }

    private void complete(TelemetryStream stream, CompletableFuture<Analysis> call, PoseFrame frame,
                          long startNanos, Analysis analysis, Throwable error) {
        long elapsedNanos = System.nanoTime() - startNanos;
        Throwable cause = unwrap(error);
        TelemetryUpdate update;
        AnalysisResult fresh = null;
        List<TelemetrySubscriber> targets;

        synchronized (stream) {
            if (stream.closed || stream.inFlight != call) {
                LOG.debug("Discarding analysis of frame {} for session {}", frame.sequenceNumber(), stream.sessionId);
                return;
            }
            stream.inFlight = null;
            stream.gate.release();
            if (frame.sequenceNumber() != stream.latestAcceptedSequence) {
                LOG.debug("Discarding analysis of superseded frame {}", frame.sequenceNumber());
                return;
            }
            if (cause == null) {
                fresh = new AnalysisResult(stream.sessionId, frame.sequenceNumber(), analysis.score(),
                        analysis.feedback(), clock.instant());
                stream.latestResult = fresh;
                stream.delivered++;
                stream.scoreSum += analysis.score();
                update = TelemetryUpdate.fresh(fresh);
            } else {
                stream.failures++;
                update = TelemetryUpdate.previous(stream.sessionId, frame.sequenceNumber(), stream.latestResult,
                        failureCode(cause));
            }
            targets = List.copyOf(stream.subscribers);
        }

        if (fresh != null) {
            metrics.recordAnalysisLatency(elapsedNanos, "success");
        } else {
            reportFailure(stream.sessionId, frame.sequenceNumber(), cause, elapsedNanos);
        }
        for (TelemetrySubscriber subscriber : targets) {
            try {
                subscriber.onUpdate(update);
            } catch (RuntimeException e) {
                LOG.warn("Telemetry subscriber failed for session {}: {}", stream.sessionId, e.getMessage());
            }
        }
        if (fresh != null) {
            try {
                persistence.persist(fresh);
            } catch (RuntimeException e) {
                LOG.warn("Persisting result of frame {} for session {} failed: {}",
                        fresh.frameSequenceNumber(), stream.sessionId, e.getMessage());
            }
        }
    }

    private void reportFailure(String sessionId, long seq, Throwable cause, long elapsedNanos) {
        ErrorCode code = failureCode(cause);
        String message = code == ErrorCode.ANALYSIS_TIMEOUT
                ? new AnalysisTimeoutException(sessionId, seq, analysisTimeoutMs).getMessage()
                : String.valueOf(cause.getMessage());
        metrics.recordAnalysisLatency(elapsedNanos, code.wireName());
        metrics.incrementAnalysisFailure(code.wireName());
        LOG.warn("Analysis of frame {} degraded to previous result after {}ms: {}",
                seq, TimeUtils.nanosToMillis(elapsedNanos), message);
        publisher.publishEvent(new AnalysisFailureEvent(sessionId, seq, code, message, clock.instant()));
    }

    private static ErrorCode failureCode(Throwable cause) {
        return cause instanceof TimeoutException || cause instanceof AnalysisTimeoutException
                ? ErrorCode.ANALYSIS_TIMEOUT
                : ErrorCode.ANALYSIS_FAILURE;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private SubmitOutcome record(SubmitOutcome outcome) {
        metrics.recordFrame(outcome.status().name().toLowerCase(Locale.ROOT),
                outcome.reason().name().toLowerCase(Locale.ROOT));
        return outcome;
    }

    /**
     * Telemetry state of one session; guarded by its own monitor.
     */
    static final class TelemetryStream {
        final String sessionId;
        final SingleFlightGate gate = new SingleFlightGate();
        final List<TelemetrySubscriber> subscribers = new CopyOnWriteArrayList<>();

        long lastSeenSequence = -1;
        long latestAcceptedSequence = -1;
        Instant lastAcceptedAt;
        CompletableFuture<Analysis> inFlight;
        AnalysisResult latestResult;
        boolean closed;

        long accepted;
        long throttled;
        long delivered;
        long failures;
        double scoreSum;

        TelemetryStream(String sessionId) {
            this.sessionId = sessionId;
        }
    }
}
