package com.phillippitts.telesession.service.session;

import com.phillippitts.telesession.config.properties.SignalingProperties;
import com.phillippitts.telesession.domain.EndReason;
import com.phillippitts.telesession.domain.Session;
import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.domain.SessionState;
import com.phillippitts.telesession.domain.SessionSummary;
import com.phillippitts.telesession.exception.SessionFullException;
import com.phillippitts.telesession.exception.SessionNotFoundException;
import com.phillippitts.telesession.service.session.event.SessionEndedEvent;
import com.phillippitts.telesession.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Starts, ends and queries sessions, and sweeps them for expired deadlines.
 *
 * <p>Ending a session runs every {@link SessionTeardownHook} under the session lock before
 * the state becomes ENDED, then stores the resulting {@link SessionSummary}. Repeated end
 * requests return the stored summary until the session is evicted.
 *
 * <p>The periodic {@link #sweep()} ends sessions whose reconnect grace window or negotiation
 * timeout expired, and evicts ended sessions after the retention period.
 *
 * @since 1.0
 */
@Service
public class SessionLifecycleService {

    private static final Logger LOG = LogManager.getLogger(SessionLifecycleService.class);

    private final SessionRegistry registry;
    private final SessionStateMachine stateMachine;
    private final List<SessionTeardownHook> teardownHooks;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Duration negotiationTimeout;
    private final Duration endedRetention;

    public SessionLifecycleService(SessionRegistry registry,
                                   SessionStateMachine stateMachine,
                                   List<SessionTeardownHook> teardownHooks,
                                   ApplicationEventPublisher publisher,
                                   Clock clock,
                                   SignalingProperties properties) {
        this.registry = registry;
        this.stateMachine = stateMachine;
        this.teardownHooks = List.copyOf(teardownHooks);
        this.publisher = publisher;
        this.clock = clock;
        this.negotiationTimeout = Duration.ofMillis(properties.getNegotiationTimeoutMs());
        this.endedRetention = Duration.ofMillis(properties.getEndedRetentionMs());
    }

    /**
     * Creates a session in state CREATED.
     *
     * @param participantIds one or two participant ids; duplicates are collapsed
     * @param kind           call kind, {@code null} means peer call
     * @param metadata       opaque key/value pairs, may be {@code null}
     * @throws IllegalArgumentException if no participant is given
     * @throws SessionFullException     if more than two distinct participants are given
     */
    public Session startSession(List<String> participantIds, SessionKind kind, Map<String, String> metadata) {
        Set<String> participants = new LinkedHashSet<>();
        if (participantIds != null) {
            for (String id : participantIds) {
                if (id != null && !id.isBlank()) {
                    participants.add(id.trim());
                }
            }
        }
        if (participants.isEmpty()) {
            throw new IllegalArgumentException("At least one participant is required");
        }
        if (participants.size() > Session.MAX_PARTICIPANTS) {
            String rejected = new ArrayList<>(participants).get(Session.MAX_PARTICIPANTS);
            throw new SessionFullException("new", rejected);
        }

        SessionKind effectiveKind = kind == null ? SessionKind.PEER_CALL : kind;
        SessionEntry entry = registry.create(effectiveKind, new ArrayList<>(participants), metadata, clock.instant());
        return registry.withSession(entry.getId(), locked -> {
            stateMachine.created(locked);
            LOG.info("Started {} session {} for {}", effectiveKind.wireName(), locked.getId(), participants);
            return locked.snapshot();
        });
    }

    /**
     * Ends a session on behalf of the API. Idempotent.
     *
     * @throws SessionNotFoundException if the session is unknown or already evicted
     */
    public SessionSummary endSession(String sessionId, EndReason reason) {
        return registry.withSession(sessionId, entry -> endLocked(entry, reason));
    }

    /**
     * Ends a session on behalf of one of its participants. Idempotent; an ended session
     * returns its stored summary without checking the requester.
     *
     * @throws com.phillippitts.telesession.exception.UnknownParticipantException if the
     *         requester is not a participant of a live session
     */
    public SessionSummary endSession(String sessionId, String participantId, EndReason reason) {
        return registry.withSession(sessionId, entry -> {
            if (!entry.getState().isTerminal()) {
                stateMachine.requireParticipant(entry, participantId);
            }
            return endLocked(entry, reason);
        });
    }

    /**
     * @throws SessionNotFoundException if the session is unknown or already evicted
     */
    public Session getSession(String sessionId) {
        return registry.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Non-ended sessions, oldest first.
     */
    public List<Session> activeSessions() {
        return registry.snapshots().stream()
                .filter(s -> !s.state().isTerminal())
                .sorted(Comparator.comparing(Session::createdAt))
                .toList();
    }

    /**
     * Expires reconnect grace windows and negotiation timeouts, and evicts ended sessions
     * past retention.
     */
    @Scheduled(fixedDelayString = "${signaling.sweep-interval-ms:1000}")
    public void sweep() {
        Instant now = clock.instant();
        for (String id : registry.ids()) {
            try {
                registry.withSession(id, entry -> {
                    sweepOne(entry, now);
                    return null;
                });
            } catch (SessionNotFoundException e) {
                LOG.trace("Session {} evicted during sweep", id);
            } catch (RuntimeException e) {
                LOG.error("Sweep failed for session {}", id, e);
            }
        }
    }

    private void sweepOne(SessionEntry entry, Instant now) {
        SessionState state = entry.getState();
        if (state == SessionState.RECONNECTING) {
            if (TimeUtils.isDue(entry.getReconnectDeadline(), Duration.ZERO, now)) {
                LOG.warn("Reconnect grace expired for session {} (dropped: {})",
                        entry.getId(), entry.getDroppedParticipants());
                endLocked(entry, EndReason.RECONNECT_GRACE_EXPIRED);
            }
        } else if (isNegotiating(entry) && TimeUtils.isDue(entry.getCreatedAt(), negotiationTimeout, now)) {
            LOG.warn("Session {} did not connect within {}ms (state {})",
                    entry.getId(), negotiationTimeout.toMillis(), state);
            endLocked(entry, EndReason.NEGOTIATION_TIMEOUT);
        } else if (state == SessionState.ENDED
                && TimeUtils.isDue(entry.getEndedAt(), endedRetention, now)) {
            registry.evict(entry);
        }
    }

    private static boolean isNegotiating(SessionEntry entry) {
        if (entry.getKind() == SessionKind.AI_CALL) {
            return false;
        }
        SessionState state = entry.getState();
        return state == SessionState.CREATED || state == SessionState.OFFERING || state == SessionState.ANSWERING;
    }

    private SessionSummary endLocked(SessionEntry entry, EndReason reason) {
        if (entry.getState().isTerminal()) {
            return entry.getSummary();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        for (SessionTeardownHook hook : teardownHooks) {
            try {
                hook.onSessionEnding(entry.getId(), reason, details);
            } catch (RuntimeException e) {
                LOG.warn("Teardown hook {} failed for session {}",
                        hook.getClass().getSimpleName(), entry.getId(), e);
            }
        }
        details.values().removeIf(v -> v == null);

        stateMachine.end(entry, reason);
        Instant endedAt = entry.getEndedAt();
        SessionSummary summary = new SessionSummary(
                entry.getId(),
                entry.getKind(),
                new ArrayList<>(entry.getParticipantIds()),
                entry.getCreatedAt(),
                endedAt,
                Duration.between(entry.getCreatedAt(), endedAt),
                reason,
                details);
        entry.setSummary(summary);
        publisher.publishEvent(new SessionEndedEvent(summary));
        LOG.info("Session {} ended ({}) after {}ms", entry.getId(), reason, summary.duration().toMillis());
        return summary;
    }
}
