package com.phillippitts.telesession.service.signaling;

import com.phillippitts.telesession.config.logging.LogKeys;
import com.phillippitts.telesession.domain.EndReason;
import com.phillippitts.telesession.domain.Session;
import com.phillippitts.telesession.domain.SessionSummary;
import com.phillippitts.telesession.domain.signal.SessionStartPayload;
import com.phillippitts.telesession.domain.signal.SignalMessage;
import com.phillippitts.telesession.domain.signal.SignalType;
import com.phillippitts.telesession.exception.MalformedMessageException;
import com.phillippitts.telesession.exception.SessionNotFoundException;
import com.phillippitts.telesession.exception.TeleSessionException;
import com.phillippitts.telesession.exception.UnknownParticipantException;
import com.phillippitts.telesession.service.metrics.SessionMetrics;
import com.phillippitts.telesession.service.session.JoinOutcome;
import com.phillippitts.telesession.service.session.SessionLifecycleService;
import com.phillippitts.telesession.service.session.SessionRegistry;
import com.phillippitts.telesession.service.session.SessionStateMachine;
import com.phillippitts.telesession.service.signaling.codec.SignalMessageCodec;
import com.phillippitts.telesession.service.signaling.event.SignalingErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for inbound signaling frames.
 *
 * <p>Decodes each frame, binds the connection to a (session, participant) pair on
 * {@code start-session}, and routes negotiation messages through the state machine and the
 * relay under the session lock. Every rejection is answered with an {@code error} message on
 * the same connection and never affects other sessions.
 *
 * @since 1.0
 */
@Component
public class SignalDispatcher {

    private static final Logger LOG = LogManager.getLogger(SignalDispatcher.class);

    private record Binding(String sessionId, String participantId) {
    }

    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();

    private final SignalMessageCodec codec;
    private final SessionRegistry registry;
    private final SessionStateMachine stateMachine;
    private final SessionLifecycleService lifecycle;
    private final SignalingRelay relay;
    private final IceServerCatalog iceServers;
    private final SessionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public SignalDispatcher(SignalMessageCodec codec,
                            SessionRegistry registry,
                            SessionStateMachine stateMachine,
                            SessionLifecycleService lifecycle,
                            SignalingRelay relay,
                            IceServerCatalog iceServers,
                            SessionMetrics metrics,
                            ApplicationEventPublisher publisher,
                            Clock clock) {
        this.codec = codec;
        this.registry = registry;
        this.stateMachine = stateMachine;
        this.lifecycle = lifecycle;
        this.relay = relay;
        this.iceServers = iceServers;
        this.metrics = metrics;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Handles one inbound text frame.
     */
    public void onMessage(SignalChannel channel, String text) {
        SignalMessage message;
        try {
            message = codec.decode(text);
        } catch (MalformedMessageException e) {
            Binding binding = bindings.get(channel.id());
            reject(channel, binding == null ? "" : binding.sessionId(), e);
            return;
        }

        ThreadContext.put(LogKeys.SESSION_ID, message.sessionId());
        ThreadContext.put(LogKeys.PARTICIPANT_ID, message.senderId());
        try {
            dispatch(channel, message);
        } catch (TeleSessionException e) {
            reject(channel, message.sessionId(), e);
        } finally {
            ThreadContext.remove(LogKeys.SESSION_ID);
            ThreadContext.remove(LogKeys.PARTICIPANT_ID);
        }
    }

    /**
     * Handles the closing of a connection. If it was the participant's active channel the
     * state machine learns about the drop.
     */
    public void onClose(SignalChannel channel) {
        Binding binding = bindings.remove(channel.id());
        if (binding == null) {
            return;
        }
        try {
            registry.withSession(binding.sessionId(), entry -> {
                if (relay.detach(binding.sessionId(), binding.participantId(), channel)) {
                    stateMachine.onDisconnect(entry, binding.participantId());
                }
                return null;
            });
        } catch (SessionNotFoundException e) {
            relay.detach(binding.sessionId(), binding.participantId(), channel);
            LOG.debug("Channel {} closed after session {} was evicted", channel.id(), binding.sessionId());
        }
    }

    /**
     * Returns the session a connection is bound to, if any.
     */
    public Optional<String> boundSession(SignalChannel channel) {
        return Optional.ofNullable(bindings.get(channel.id())).map(Binding::sessionId);
    }

    private void dispatch(SignalChannel channel, SignalMessage message) {
        switch (message.type()) {
            case START_SESSION -> handleStart(channel, message);
            case OFFER, ANSWER, ICE_CANDIDATE -> handleNegotiation(channel, message);
            case END_SESSION -> handleEnd(channel, message);
            case ERROR -> LOG.info("Client {} reported error: {}", message.senderId(), message.payload());
        }
    }

    private void handleStart(SignalChannel channel, SignalMessage message) {
        SessionStartPayload payload = (SessionStartPayload) message.payload();
        String senderId = message.senderId();
        String sessionId = message.sessionId();

        if (!message.hasSessionId()) {
            List<String> participants = new ArrayList<>();
            participants.add(senderId);
            participants.addAll(payload.participantIds());
            sessionId = lifecycle.startSession(participants, payload.kind(), payload.metadata()).id();
            ThreadContext.put(LogKeys.SESSION_ID, sessionId);
        }

        String targetId = sessionId;
        registry.withSession(targetId, entry -> {
            JoinOutcome outcome = stateMachine.admit(entry, senderId);
            Binding previous = bindings.put(channel.id(), new Binding(targetId, senderId));
            if (previous != null && !previous.sessionId().equals(targetId)) {
                relay.detach(previous.sessionId(), previous.participantId(), channel);
            }
            send(channel, startReply(entry.snapshot()));
            SignalingRelay.BindResult bound = relay.bind(entry.snapshot(), senderId, channel);
            if (bound.answerFlushed()) {
                stateMachine.onAnswerDelivered(entry);
            }
            LOG.info("start-session by {}: {} (state {})", senderId, outcome, entry.getState());
            return outcome;
        });
    }

    private void handleNegotiation(SignalChannel channel, SignalMessage message) {
        SignalingRelay.RouteResult result = registry.withSession(message.sessionId(), entry -> {
            stateMachine.requireOpen(entry);
            requireBound(channel, message);
            switch (message.type()) {
                case OFFER -> stateMachine.onOffer(entry, message.senderId());
                case ANSWER -> stateMachine.onAnswer(entry, message.senderId());
                default -> stateMachine.onIceCandidate(entry, message.senderId());
            }
            SignalingRelay.RouteResult routed = relay.relay(entry.snapshot(), message);
            if (message.type() == SignalType.ANSWER && routed == SignalingRelay.RouteResult.DELIVERED) {
                stateMachine.onAnswerDelivered(entry);
            }
            return routed;
        });
        LOG.debug("{} from {}: {}", message.type().wireName(), message.senderId(), result);
    }

    private void handleEnd(SignalChannel channel, SignalMessage message) {
        registry.withSession(message.sessionId(), entry -> {
            boolean alreadyEnded = entry.getState().isTerminal();
            if (!alreadyEnded) {
                requireBound(channel, message);
            }
            SessionSummary summary = lifecycle.endSession(message.sessionId(), message.senderId(),
                    EndReason.PARTICIPANT_REQUEST);
            if (alreadyEnded) {
                // teardown already notified bound channels the first time
                send(channel, SignalMessage.endSession(summary.sessionId(), SignalMessage.SERVER_SENDER,
                        summary.endReason().wireName()));
            }
            return summary;
        });
    }

    private void requireBound(SignalChannel channel, SignalMessage message) {
        Binding binding = bindings.get(channel.id());
        if (binding == null
                || !binding.sessionId().equals(message.sessionId())
                || !binding.participantId().equals(message.senderId())) {
            throw new UnknownParticipantException(message.sessionId(), message.senderId());
        }
    }

    private SignalMessage startReply(Session session) {
        Map<String, String> metadata = new LinkedHashMap<>(session.metadata());
        metadata.put("state", session.state().name());
        SessionStartPayload payload = new SessionStartPayload(
                new ArrayList<>(session.participantIds()), session.kind(), metadata, iceServers.iceServers());
        return new SignalMessage(SignalType.START_SESSION, session.id(), SignalMessage.SERVER_SENDER, payload);
    }

    private void reject(SignalChannel channel, String sessionId, TeleSessionException e) {
        LOG.warn("Rejected signal on channel {}: {}", channel.id(), e.getMessage());
        metrics.recordSignalingError(e.getErrorCode().wireName());
        publisher.publishEvent(new SignalingErrorEvent(sessionId, channel.id(), e.getErrorCode(), e.getMessage(),
                clock.instant()));
        send(channel, SignalMessage.error(sessionId, e.getErrorCode(), e.getMessage()));
    }

    private void send(SignalChannel channel, SignalMessage message) {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.send(codec.encode(message));
        } catch (IOException e) {
            LOG.warn("Failed to send {} on channel {}: {}", message.type().wireName(), channel.id(), e.getMessage());
        }
    }
}
