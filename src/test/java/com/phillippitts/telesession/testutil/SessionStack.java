package com.phillippitts.telesession.testutil;

import com.phillippitts.telesession.config.properties.SignalingProperties;
import com.phillippitts.telesession.config.properties.TelemetryProperties;
import com.phillippitts.telesession.domain.Session;
import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.service.metrics.SessionMetrics;
import com.phillippitts.telesession.service.session.SessionLifecycleService;
import com.phillippitts.telesession.service.session.SessionRegistry;
import com.phillippitts.telesession.service.session.SessionStateMachine;
import com.phillippitts.telesession.service.signaling.IceServerCatalog;
import com.phillippitts.telesession.service.signaling.SignalDispatcher;
import com.phillippitts.telesession.service.signaling.SignalingRelay;
import com.phillippitts.telesession.service.signaling.codec.SignalMessageCodec;
import com.phillippitts.telesession.service.telemetry.AnalysisClient;
import com.phillippitts.telesession.service.telemetry.DefaultTelemetryPipeline;
import com.phillippitts.telesession.service.telemetry.TelemetryPersistence;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Wires the session layer by hand, the way the application context does, around a
 * {@link MutableClock} and an {@link EventCapturingPublisher}.
 *
 * <p><b>Public fields:</b> every collaborator is exposed so tests can drive and inspect it.
 */
public class SessionStack {
    public static final String START = "2026-03-02T10:00:00Z";

    public final MutableClock clock = MutableClock.startingAt(START);
    public final EventCapturingPublisher publisher = new EventCapturingPublisher();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final SessionMetrics metrics = new SessionMetrics(meterRegistry);
    public final SignalMessageCodec codec = new SignalMessageCodec();
    public final SignalingProperties signalingProperties;
    public final TelemetryProperties telemetryProperties;
    public final SessionRegistry registry = new SessionRegistry();
    public final SessionStateMachine stateMachine;
    public final SignalingRelay relay;
    public final DefaultTelemetryPipeline pipeline;
    public final SessionLifecycleService lifecycle;
    public final IceServerCatalog iceServers;
    public final SignalDispatcher dispatcher;

    public SessionStack(AnalysisClient analysisClient, Executor analysisExecutor) {
        this(analysisClient, analysisExecutor, result -> { }, new SignalingProperties(), new TelemetryProperties());
    }

    public SessionStack(AnalysisClient analysisClient,
                        Executor analysisExecutor,
                        TelemetryPersistence persistence,
                        SignalingProperties signalingProperties,
                        TelemetryProperties telemetryProperties) {
        this.signalingProperties = signalingProperties;
        this.telemetryProperties = telemetryProperties;
        this.stateMachine = new SessionStateMachine(publisher, clock, signalingProperties);
        this.relay = new SignalingRelay(codec, metrics, signalingProperties);
        this.pipeline = new DefaultTelemetryPipeline(registry, analysisClient, persistence, analysisExecutor,
                metrics, publisher, clock, telemetryProperties);
        this.lifecycle = new SessionLifecycleService(registry, stateMachine, List.of(relay, pipeline),
                publisher, clock, signalingProperties);
        this.iceServers = new IceServerCatalog(signalingProperties);
        this.dispatcher = new SignalDispatcher(codec, registry, stateMachine, lifecycle, relay, iceServers,
                metrics, publisher, clock);
    }

    /**
     * Creates a peer call between {@code a} and {@code b} and drives it to CONNECTED
     * through the state machine, without sockets.
     */
    public Session connectedPeerCall(String a, String b) {
        Session created = lifecycle.startSession(List.of(a, b), SessionKind.PEER_CALL, Map.of());
        registry.withSession(created.id(), entry -> {
            stateMachine.onOffer(entry, a);
            stateMachine.onAnswer(entry, b);
            stateMachine.onAnswerDelivered(entry);
            return null;
        });
        return lifecycle.getSession(created.id());
    }

    public Session aiCall(String participant) {
        return lifecycle.startSession(List.of(participant), SessionKind.AI_CALL, Map.of());
    }
}
