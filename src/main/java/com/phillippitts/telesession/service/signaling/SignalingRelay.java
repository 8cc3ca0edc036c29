package com.phillippitts.telesession.service.signaling;

import com.phillippitts.telesession.config.properties.SignalingProperties;
import com.phillippitts.telesession.domain.EndReason;
import com.phillippitts.telesession.domain.Session;
import com.phillippitts.telesession.domain.signal.SignalMessage;
import com.phillippitts.telesession.domain.signal.SignalType;
import com.phillippitts.telesession.exception.InvalidTransitionException;
import com.phillippitts.telesession.service.metrics.SessionMetrics;
import com.phillippitts.telesession.service.session.SessionTeardownHook;
import com.phillippitts.telesession.service.signaling.codec.SignalMessageCodec;
import com.phillippitts.telesession.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes offer, answer and ICE messages between the two participants of a session.
 *
 * <p>Each session has a route holding the participants' channels, a bounded pending queue
 * per absent participant and one {@link IceCandidateBuffer} per recipient. A message for a
 * participant without an open channel is held and flushed, in order, when that participant
 * binds again. Delivering an offer or answer to a recipient flushes the candidates held for it.
 *
 * <p>As a {@link SessionTeardownHook} the relay sends {@code end-session} to every bound
 * channel, drops held messages and candidates, and forgets the route.
 *
 * <p>Callers invoke the relay while holding the session lock; the route is additionally
 * synchronized on itself.
 *
 * @since 1.0
 */
@Component
@Order(1)
public class SignalingRelay implements SessionTeardownHook {

    private static final Logger LOG = LogManager.getLogger(SignalingRelay.class);
    private static final int SDP_LOG_PREVIEW = 48;

    /** How a message left the relay. */
    public enum RouteResult { DELIVERED, HELD, BUFFERED }

    /**
     * Result of binding a channel.
     *
     * @param flushed       held messages delivered on bind
     * @param answerFlushed whether one of them was an answer, which completes negotiation
     */
    public record BindResult(int flushed, boolean answerFlushed) {
    }

    private final Map<String, SessionRoute> routes = new ConcurrentHashMap<>();
    private final SignalMessageCodec codec;
    private final SessionMetrics metrics;
    private final int iceBufferCapacity;
    private final int pendingCapacity;

    public SignalingRelay(SignalMessageCodec codec, SessionMetrics metrics, SignalingProperties properties) {
        this.codec = codec;
        this.metrics = metrics;
        this.iceBufferCapacity = properties.getIceBufferCapacity();
        this.pendingCapacity = properties.getPendingMessageCapacity();
    }

    /**
     * Binds a participant's channel and flushes messages held for it.
     */
    public BindResult bind(Session session, String participantId, SignalChannel channel) {
        SessionRoute route = routeFor(session.id());
        synchronized (route) {
            route.channels.put(participantId, channel);
            Deque<SignalMessage> held = route.pending.remove(participantId);
            if (held == null) {
                return new BindResult(0, false);
            }
            int flushed = 0;
            boolean answerFlushed = false;
            SignalMessage next;
            while ((next = held.pollFirst()) != null) {
                if (!deliver(route, participantId, next)) {
                    // channel failed again: next is re-held, keep the rest behind it
                    while ((next = held.pollFirst()) != null) {
                        hold(route, participantId, next);
                    }
                    break;
                }
                flushed++;
                if (isDescription(next)) {
                    route.iceBuffer(participantId).flush();
                    answerFlushed |= next.type() == SignalType.ANSWER;
                }
            }
            LOG.info("Bound {} to session {}, flushed {} held message(s)", participantId, session.id(), flushed);
            return new BindResult(flushed, answerFlushed);
        }
    }

    /**
     * Unbinds {@code channel} if it is still the participant's active channel.
     *
     * @return {@code true} if the channel was the active one
     */
    public boolean detach(String sessionId, String participantId, SignalChannel channel) {
        SessionRoute route = routes.get(sessionId);
        if (route == null) {
            return false;
        }
        synchronized (route) {
            return route.channels.remove(participantId, channel);
        }
    }

    /**
     * Routes an offer, answer or ICE candidate to the sender's peer.
     *
     * @throws InvalidTransitionException if the session has no second participant
     */
    public RouteResult relay(Session session, SignalMessage message) {
        String recipient = null;
        for (String id : session.participantIds()) {
            if (!id.equals(message.senderId())) {
                recipient = id;
            }
        }
        if (recipient == null) {
            throw new InvalidTransitionException(session.id(), session.state(), message.type().wireName());
        }

        SessionRoute route = routeFor(session.id());
        synchronized (route) {
            switch (message.type()) {
                case OFFER, ANSWER -> {
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("Relaying {} {} -> {}: {}", message.type().wireName(), message.senderId(),
                                recipient, LogSanitizer.truncate(String.valueOf(message.payload()), SDP_LOG_PREVIEW));
                    }
                    if (deliver(route, recipient, message)) {
                        route.iceBuffer(recipient).flush();
                        return RouteResult.DELIVERED;
                    }
                    return RouteResult.HELD;
                }
                case ICE_CANDIDATE -> {
                    route.lastDelivered = false;
                    if (!route.iceBuffer(recipient).enqueue(message)) {
                        metrics.recordRelayed(message.type().wireName(), "buffered");
                        return RouteResult.BUFFERED;
                    }
                    return route.lastDelivered ? RouteResult.DELIVERED : RouteResult.HELD;
                }
                default -> throw new IllegalArgumentException("Relay does not route " + message.type().wireName());
            }
        }
    }

    @Override
    public void onSessionEnding(String sessionId, EndReason reason, Map<String, Object> details) {
        SessionRoute route = routes.remove(sessionId);
        if (route == null) {
            details.put("signaling.messagesRelayed", 0L);
            return;
        }
        synchronized (route) {
            String endText = codec.encode(SignalMessage.endSession(sessionId, SignalMessage.SERVER_SENDER,
                    reason.wireName()));
            for (Map.Entry<String, SignalChannel> bound : route.channels.entrySet()) {
                SignalChannel channel = bound.getValue();
                if (!channel.isOpen()) {
                    continue;
                }
                try {
                    channel.send(endText);
                } catch (IOException e) {
                    LOG.debug("Could not notify {} that session {} ended", bound.getKey(), sessionId, e);
                }
            }

            long discarded = route.dropped;
            for (Deque<SignalMessage> held : route.pending.values()) {
                discarded += held.size();
            }
            for (IceCandidateBuffer buffer : route.iceBuffers.values()) {
                discarded += buffer.size() + buffer.droppedCount();
                buffer.discard();
            }
            route.pending.clear();
            route.iceBuffers.clear();
            route.channels.clear();

            details.put("signaling.messagesRelayed", route.relayed);
            details.put("signaling.messagesDiscarded", discarded);
            LOG.debug("Released route of session {}: relayed={}, discarded={}", sessionId, route.relayed, discarded);
        }
    }

    /**
     * Number of messages held for an absent participant.
     */
    public int pendingCount(String sessionId, String participantId) {
        SessionRoute route = routes.get(sessionId);
        if (route == null) {
            return 0;
        }
        synchronized (route) {
            Deque<SignalMessage> held = route.pending.get(participantId);
            return held == null ? 0 : held.size();
        }
    }

    /**
     * Number of ICE candidates buffered for a recipient.
     */
    public int bufferedCandidates(String sessionId, String recipientId) {
        SessionRoute route = routes.get(sessionId);
        if (route == null) {
            return 0;
        }
        synchronized (route) {
            IceCandidateBuffer buffer = route.iceBuffers.get(recipientId);
            return buffer == null ? 0 : buffer.size();
        }
    }

    public boolean hasRoute(String sessionId) {
        return routes.containsKey(sessionId);
    }

    private SessionRoute routeFor(String sessionId) {
        return routes.computeIfAbsent(sessionId, id -> new SessionRoute());
    }

    private boolean deliver(SessionRoute route, String recipient, SignalMessage message) {
        SignalChannel channel = route.channels.get(recipient);
        if (channel != null && channel.isOpen()) {
            try {
                channel.send(codec.encode(message));
                route.relayed++;
                route.lastDelivered = true;
                metrics.recordRelayed(message.type().wireName(), "delivered");
                return true;
            } catch (IOException e) {
                LOG.warn("Send of {} to {} failed, holding it: {}", message.type().wireName(), recipient, e.getMessage());
                route.channels.remove(recipient, channel);
            }
        }
        hold(route, recipient, message);
        return false;
    }

    private void hold(SessionRoute route, String recipient, SignalMessage message) {
        Deque<SignalMessage> held = route.pending.computeIfAbsent(recipient, id -> new ArrayDeque<>());
        if (held.size() == pendingCapacity) {
            SignalMessage droppedMessage = held.pollFirst();
            route.dropped++;
            metrics.recordRelayed(droppedMessage.type().wireName(), "dropped");
            LOG.warn("Pending queue for {} full, dropped oldest {}", recipient, droppedMessage.type().wireName());
        }
        held.addLast(message);
        metrics.recordRelayed(message.type().wireName(), "held");
    }

    private static boolean isDescription(SignalMessage message) {
        return message.type() == SignalType.OFFER || message.type() == SignalType.ANSWER;
    }

    private final class SessionRoute {
        final Map<String, SignalChannel> channels = new HashMap<>();
        final Map<String, Deque<SignalMessage>> pending = new HashMap<>();
        final Map<String, IceCandidateBuffer> iceBuffers = new HashMap<>();
        long relayed;
        long dropped;
        boolean lastDelivered;

        IceCandidateBuffer iceBuffer(String recipient) {
            return iceBuffers.computeIfAbsent(recipient,
                    id -> new IceCandidateBuffer(iceBufferCapacity, candidate -> deliver(this, id, candidate)));
        }
    }
}
