package com.phillippitts.telesession.service.session;

import com.phillippitts.telesession.config.properties.SignalingProperties;
import com.phillippitts.telesession.domain.EndReason;
import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.domain.SessionState;
import com.phillippitts.telesession.exception.ConflictingOfferException;
import com.phillippitts.telesession.exception.InvalidTransitionException;
import com.phillippitts.telesession.exception.SessionClosedException;
import com.phillippitts.telesession.exception.SessionFullException;
import com.phillippitts.telesession.exception.UnknownParticipantException;
import com.phillippitts.telesession.service.session.event.SessionStateChangedEvent;
import com.phillippitts.telesession.testutil.EventCapturingPublisher;
import com.phillippitts.telesession.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStateMachineTest {

    private MutableClock clock;
    private EventCapturingPublisher publisher;
    private SessionRegistry registry;
    private SessionStateMachine machine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T10:00:00Z");
        publisher = new EventCapturingPublisher();
        registry = new SessionRegistry();
        machine = new SessionStateMachine(publisher, clock, new SignalingProperties());
    }

    private String peerCall(String... participants) {
        return registry.create(SessionKind.PEER_CALL, List.of(participants), Map.of(), clock.instant()).getId();
    }

    private void locked(String id, Consumer<SessionEntry> action) {
        registry.withSession(id, entry -> {
            action.accept(entry);
            return null;
        });
    }

    private SessionState state(String id) {
        return registry.find(id).orElseThrow().state();
    }

    @Test
    void transitionTableAllowsOnlyDocumentedMoves() {
        assertThat(SessionStateMachine.isLegal(SessionState.CREATED, SessionState.OFFERING)).isTrue();
        assertThat(SessionStateMachine.isLegal(SessionState.RECONNECTING, SessionState.CONNECTED)).isTrue();
        assertThat(SessionStateMachine.isLegal(SessionState.CREATED, SessionState.CONNECTED)).isFalse();
        assertThat(SessionStateMachine.isLegal(SessionState.CONNECTED, SessionState.OFFERING)).isFalse();
        for (SessionState to : SessionState.values()) {
            assertThat(SessionStateMachine.isLegal(SessionState.ENDED, to)).isFalse();
        }
    }

    @Test
    void negotiatesToConnected() {
        String id = peerCall("alice", "bob");

        locked(id, e -> machine.onOffer(e, "alice"));
        assertThat(state(id)).isEqualTo(SessionState.OFFERING);

        locked(id, e -> machine.onAnswer(e, "bob"));
        assertThat(state(id)).isEqualTo(SessionState.ANSWERING);

        locked(id, machine::onAnswerDelivered);
        assertThat(state(id)).isEqualTo(SessionState.CONNECTED);

        List<SessionStateChangedEvent> events = publisher.eventsOfType(SessionStateChangedEvent.class);
        assertThat(events).extracting(SessionStateChangedEvent::to)
                .containsExactly(SessionState.OFFERING, SessionState.ANSWERING, SessionState.CONNECTED);
    }

    @Test
    void repeatedOfferFromOffererKeepsState() {
        String id = peerCall("alice", "bob");
        locked(id, e -> machine.onOffer(e, "alice"));

        locked(id, e -> machine.onOffer(e, "alice"));

        assertThat(state(id)).isEqualTo(SessionState.OFFERING);
    }

    @Test
    void offerFromOtherParticipantConflicts() {
        String id = peerCall("alice", "bob");
        locked(id, e -> machine.onOffer(e, "alice"));

        assertThatThrownBy(() -> locked(id, e -> machine.onOffer(e, "bob")))
                .isInstanceOf(ConflictingOfferException.class)
                .satisfies(ex -> assertThat(((ConflictingOfferException) ex).getOffererId()).isEqualTo("alice"));
        assertThat(state(id)).isEqualTo(SessionState.OFFERING);
    }

    @Test
    void answerBeforeOfferIsInvalid() {
        String id = peerCall("alice", "bob");

        assertThatThrownBy(() -> locked(id, e -> machine.onAnswer(e, "bob")))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void offererCannotAnswerItsOwnOffer() {
        String id = peerCall("alice", "bob");
        locked(id, e -> machine.onOffer(e, "alice"));

        assertThatThrownBy(() -> locked(id, e -> machine.onAnswer(e, "alice")))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void negotiationNeedsASecondParticipant() {
        String id = peerCall("alice");

        assertThatThrownBy(() -> locked(id, e -> machine.onOffer(e, "alice")))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void aiCallsDoNotNegotiate() {
        String id = registry.create(SessionKind.AI_CALL, List.of("alice", "coach"), Map.of(), clock.instant()).getId();

        assertThatThrownBy(() -> locked(id, e -> machine.onOffer(e, "alice")))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void strangersCannotSignal() {
        String id = peerCall("alice", "bob");

        assertThatThrownBy(() -> locked(id, e -> machine.onIceCandidate(e, "mallory")))
                .isInstanceOf(UnknownParticipantException.class);
    }

    @Test
    void admitsSecondParticipantAndRejectsThird() {
        String id = peerCall("alice");

        registry.withSession(id, e -> assertThat(machine.admit(e, "bob")).isEqualTo(JoinOutcome.JOINED));
        registry.withSession(id, e -> assertThat(machine.admit(e, "alice")).isEqualTo(JoinOutcome.ALREADY_JOINED));

        assertThatThrownBy(() -> locked(id, e -> machine.admit(e, "carol")))
                .isInstanceOf(SessionFullException.class);
        assertThat(registry.find(id).orElseThrow().participantIds()).containsExactly("alice", "bob");
    }

    @Test
    void dropWhileConnectedStartsGraceWindowAndResumeReconnects() {
        String id = peerCall("alice", "bob");
        locked(id, e -> {
            machine.onOffer(e, "alice");
            machine.onAnswer(e, "bob");
            machine.onAnswerDelivered(e);
        });

        locked(id, e -> assertThat(machine.onDisconnect(e, "bob")).isTrue());
        registry.withSession(id, e -> {
            assertThat(e.getState()).isEqualTo(SessionState.RECONNECTING);
            assertThat(e.getReconnectDeadline()).isEqualTo(Instant.parse("2026-03-02T10:00:30Z"));
            return null;
        });

        registry.withSession(id, e -> assertThat(machine.admit(e, "bob")).isEqualTo(JoinOutcome.RESUMED));
        assertThat(state(id)).isEqualTo(SessionState.CONNECTED);
        assertThat(registry.find(id).orElseThrow().participantIds()).containsExactly("alice", "bob");
    }

    @Test
    void bothDroppedNeedBothToResume() {
        String id = peerCall("alice", "bob");
        locked(id, e -> {
            machine.onOffer(e, "alice");
            machine.onAnswer(e, "bob");
            machine.onAnswerDelivered(e);
            machine.onDisconnect(e, "alice");
            machine.onDisconnect(e, "bob");
        });

        locked(id, e -> machine.admit(e, "alice"));
        assertThat(state(id)).isEqualTo(SessionState.RECONNECTING);

        locked(id, e -> machine.admit(e, "bob"));
        assertThat(state(id)).isEqualTo(SessionState.CONNECTED);
    }

    @Test
    void dropDuringNegotiationKeepsState() {
        String id = peerCall("alice", "bob");
        locked(id, e -> machine.onOffer(e, "alice"));

        locked(id, e -> assertThat(machine.onDisconnect(e, "bob")).isFalse());

        assertThat(state(id)).isEqualTo(SessionState.OFFERING);
    }

    @Test
    void endIsTerminalAndIdempotent() {
        String id = peerCall("alice", "bob");

        registry.withSession(id, e -> assertThat(machine.end(e, EndReason.API_REQUEST)).isTrue());
        registry.withSession(id, e -> assertThat(machine.end(e, EndReason.API_REQUEST)).isFalse());

        assertThat(state(id)).isEqualTo(SessionState.ENDED);
        assertThatThrownBy(() -> locked(id, e -> machine.admit(e, "alice")))
                .isInstanceOf(SessionClosedException.class);
        assertThatThrownBy(() -> locked(id, e -> machine.onIceCandidate(e, "alice")))
                .isInstanceOf(SessionClosedException.class);
    }

    @Test
    void refusesCallsWithoutTheSessionLock() {
        SessionEntry entry = registry.create(SessionKind.PEER_CALL, List.of("alice", "bob"), Map.of(), clock.instant());

        assertThatThrownBy(() -> machine.onOffer(entry, "alice"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("lock");
    }
}
