package com.phillippitts.telesession.service.session;

import com.phillippitts.telesession.config.properties.SignalingProperties;
import com.phillippitts.telesession.domain.EndReason;
import com.phillippitts.telesession.domain.Session;
import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.domain.SessionState;
import com.phillippitts.telesession.exception.ConflictingOfferException;
import com.phillippitts.telesession.exception.InvalidTransitionException;
import com.phillippitts.telesession.exception.SessionClosedException;
import com.phillippitts.telesession.exception.SessionFullException;
import com.phillippitts.telesession.exception.UnknownParticipantException;
import com.phillippitts.telesession.service.session.event.SessionStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal-transition table and transition logic for call sessions.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CREATED      → OFFERING     (first offer; sender becomes the offerer)
 * OFFERING     → ANSWERING    (answer from the non-offerer)
 * ANSWERING    → CONNECTED    (answer delivered to the offerer)
 * CONNECTED    → RECONNECTING (participant socket dropped)
 * RECONNECTING → CONNECTED    (every dropped participant resumed within the grace window)
 * any non-terminal → ENDED
 * </pre>
 *
 * <p><b>Thread Safety:</b> every method must be called while holding the entry's lock, i.e.
 * from inside {@link SessionRegistry#withSession}. The machine itself holds no session state.
 *
 * @since 1.0
 */
@Component
public class SessionStateMachine {

    private static final Logger LOG = LogManager.getLogger(SessionStateMachine.class);

    private static final Map<SessionState, Set<SessionState>> TRANSITIONS = buildTransitions();

    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Duration reconnectGrace;

    public SessionStateMachine(ApplicationEventPublisher publisher, Clock clock, SignalingProperties properties) {
        this.publisher = publisher;
        this.clock = clock;
        this.reconnectGrace = Duration.ofMillis(properties.getReconnectGraceMs());
    }

    private static Map<SessionState, Set<SessionState>> buildTransitions() {
        Map<SessionState, Set<SessionState>> table = new EnumMap<>(SessionState.class);
        table.put(SessionState.CREATED, EnumSet.of(SessionState.OFFERING, SessionState.ENDED));
        table.put(SessionState.OFFERING, EnumSet.of(SessionState.ANSWERING, SessionState.ENDED));
        table.put(SessionState.ANSWERING, EnumSet.of(SessionState.CONNECTED, SessionState.ENDED));
        table.put(SessionState.CONNECTED, EnumSet.of(SessionState.RECONNECTING, SessionState.ENDED));
        table.put(SessionState.RECONNECTING, EnumSet.of(SessionState.CONNECTED, SessionState.ENDED));
        table.put(SessionState.ENDED, EnumSet.noneOf(SessionState.class));
        return Collections.unmodifiableMap(table);
    }

    /**
     * Whether {@code from → to} is in the transition table.
     */
    public static boolean isLegal(SessionState from, SessionState to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * Announces a freshly registered session.
     */
    void created(SessionEntry entry) {
        publisher.publishEvent(new SessionStateChangedEvent(entry.getId(), entry.getKind(), null,
                SessionState.CREATED, "start-session", now()));
    }

    /**
     * Admits {@code participantId} into the session: adds a newcomer, re-binds a known
     * participant, or resumes a dropped one.
     *
     * @throws SessionClosedException if the session has ended
     * @throws SessionFullException   if two other participants are already in the session
     */
    public JoinOutcome admit(SessionEntry entry, String participantId) {
        requireLocked(entry);
        requireOpen(entry);

        if (entry.hasParticipant(participantId)) {
            if (entry.getState() == SessionState.RECONNECTING && entry.getDroppedParticipants().contains(participantId)) {
                entry.markResumed(participantId);
                if (entry.getDroppedParticipants().isEmpty()) {
                    transition(entry, SessionState.CONNECTED, "resume");
                }
                LOG.info("Participant {} resumed session {}", participantId, entry.getId());
                return JoinOutcome.RESUMED;
            }
            return JoinOutcome.ALREADY_JOINED;
        }
        if (entry.getParticipantIds().size() >= Session.MAX_PARTICIPANTS) {
            throw new SessionFullException(entry.getId(), participantId);
        }
        entry.addParticipant(participantId);
        LOG.info("Participant {} joined session {}", participantId, entry.getId());
        return JoinOutcome.JOINED;
    }

    /**
     * Validates an offer and advances {@code CREATED → OFFERING}. A repeated offer from the
     * offerer leaves the state unchanged.
     *
     * @throws ConflictingOfferException if the other participant already made an offer
     */
    public void onOffer(SessionEntry entry, String senderId) {
        requireNegotiable(entry, senderId, "offer");
        String offerer = entry.getOffererId();
        if (offerer == null) {
            if (entry.getState() != SessionState.CREATED) {
                throw new InvalidTransitionException(entry.getId(), entry.getState(), "offer");
            }
            entry.setOffererId(senderId);
            transition(entry, SessionState.OFFERING, "offer");
        } else if (!offerer.equals(senderId)) {
            throw new ConflictingOfferException(entry.getId(), offerer);
        }
    }

    /**
     * Validates an answer and advances {@code OFFERING → ANSWERING}.
     */
    public void onAnswer(SessionEntry entry, String senderId) {
        requireNegotiable(entry, senderId, "answer");
        if (entry.getOffererId() == null || entry.getOffererId().equals(senderId)) {
            throw new InvalidTransitionException(entry.getId(), entry.getState(), "answer");
        }
        if (entry.getState() == SessionState.OFFERING) {
            transition(entry, SessionState.ANSWERING, "answer");
        }
    }

    /**
     * Completes negotiation once the answer has reached the offerer.
     */
    public void onAnswerDelivered(SessionEntry entry) {
        requireLocked(entry);
        if (entry.getState() == SessionState.ANSWERING) {
            transition(entry, SessionState.CONNECTED, "answer-delivered");
        }
    }

    /**
     * Validates a trickled candidate; candidates never change state.
     */
    public void onIceCandidate(SessionEntry entry, String senderId) {
        requireNegotiable(entry, senderId, "ice-candidate");
    }

    /**
     * Records that a participant's socket went away. Only a connected session moves to
     * RECONNECTING; during negotiation the relay holds messages for the absent participant.
     *
     * @return {@code true} if the session entered or stayed in RECONNECTING because of this drop
     */
    public boolean onDisconnect(SessionEntry entry, String participantId) {
        requireLocked(entry);
        if (entry.getState().isTerminal() || !entry.hasParticipant(participantId)) {
            return false;
        }
        SessionState state = entry.getState();
        if (state == SessionState.CONNECTED) {
            entry.markDropped(participantId, now().plus(reconnectGrace));
            transition(entry, SessionState.RECONNECTING, "socket-dropped");
            return true;
        }
        if (state == SessionState.RECONNECTING) {
            entry.markDropped(participantId, now().plus(reconnectGrace));
            return true;
        }
        return false;
    }

    /**
     * Moves the session to ENDED. Calling it on an ended session is a no-op.
     *
     * @return {@code true} if this call ended the session
     */
    public boolean end(SessionEntry entry, EndReason reason) {
        requireLocked(entry);
        if (entry.getState().isTerminal()) {
            return false;
        }
        entry.markEnded(now(), reason);
        transition(entry, SessionState.ENDED, reason.wireName());
        return true;
    }

    /**
     * Throws {@link SessionClosedException} if the session has ended.
     */
    public void requireOpen(SessionEntry entry) {
        if (entry.getState().isTerminal()) {
            throw new SessionClosedException(entry.getId());
        }
    }

    /**
     * Throws {@link UnknownParticipantException} unless {@code participantId} is in the session.
     */
    public void requireParticipant(SessionEntry entry, String participantId) {
        if (!entry.hasParticipant(participantId)) {
            throw new UnknownParticipantException(entry.getId(), participantId);
        }
    }

    private void requireNegotiable(SessionEntry entry, String senderId, String trigger) {
        requireLocked(entry);
        requireOpen(entry);
        requireParticipant(entry, senderId);
        if (entry.getKind() == SessionKind.AI_CALL || entry.peerOf(senderId) == null) {
            throw new InvalidTransitionException(entry.getId(), entry.getState(), trigger);
        }
    }

    private void transition(SessionEntry entry, SessionState to, String trigger) {
        SessionState from = entry.getState();
        if (!isLegal(from, to)) {
            throw new InvalidTransitionException(entry.getId(), from, trigger);
        }
        entry.setState(to);
        LOG.info("Session {} {} -> {} ({})", entry.getId(), from, to, trigger);
        publisher.publishEvent(new SessionStateChangedEvent(entry.getId(), entry.getKind(), from, to, trigger, now()));
    }

    private static void requireLocked(SessionEntry entry) {
        if (!entry.lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session lock not held for " + entry.getId());
        }
    }

    private Instant now() {
        return clock.instant();
    }
}
