package com.phillippitts.telesession.service.signaling;

import com.phillippitts.telesession.domain.SessionState;
import com.phillippitts.telesession.exception.ErrorCode;
import com.phillippitts.telesession.service.signaling.event.SignalingErrorEvent;
import com.phillippitts.telesession.service.telemetry.UnavailableAnalysisClient;
import com.phillippitts.telesession.testutil.RecordingSignalChannel;
import com.phillippitts.telesession.testutil.SessionStack;
import com.phillippitts.telesession.testutil.SyncExecutor;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SignalDispatcherTest {

    private SessionStack stack;
    private SignalDispatcher dispatcher;
    private RecordingSignalChannel alice;
    private RecordingSignalChannel bob;

    @BeforeEach
    void setUp() {
        stack = new SessionStack(new UnavailableAnalysisClient(), new SyncExecutor());
        dispatcher = stack.dispatcher;
        alice = new RecordingSignalChannel("ws-alice");
        bob = new RecordingSignalChannel("ws-bob");
    }

    @Test
    void negotiatesPeerCallAndRejectsThirdParticipant() {
        String sessionId = startAsAlice();
        assertThat(alice.lastOfType("start-session").getJSONObject("payload")
                .getJSONArray("participantIds").toList()).containsExactly("alice", "bob");

        dispatcher.onMessage(bob, join("bob", sessionId));
        assertThat(state(sessionId)).isEqualTo(SessionState.CREATED);

        dispatcher.onMessage(alice, sdp("offer", "alice", sessionId));
        assertThat(state(sessionId)).isEqualTo(SessionState.OFFERING);
        assertThat(bob.lastOfType("offer").getString("senderId")).isEqualTo("alice");

        dispatcher.onMessage(bob, sdp("answer", "bob", sessionId));
        assertThat(state(sessionId)).isEqualTo(SessionState.CONNECTED);
        assertThat(alice.lastOfType("answer").getJSONObject("payload").getString("sdp")).isEqualTo("v=0 answer");

        RecordingSignalChannel carol = new RecordingSignalChannel("ws-carol");
        dispatcher.onMessage(carol, join("carol", sessionId));

        assertThat(errorCode(carol)).isEqualTo("session-full");
        assertThat(state(sessionId)).isEqualTo(SessionState.CONNECTED);
        assertThat(stack.meterRegistry.counter("telesession.signaling.errors", "code", "session-full").count())
                .isEqualTo(1.0);
        assertThat(stack.publisher.eventsOfType(SignalingErrorEvent.class))
                .extracting(SignalingErrorEvent::code)
                .containsExactly(ErrorCode.SESSION_FULL);
    }

    @Test
    void startReplyCarriesStateAndIceServers() {
        String sessionId = startAsAlice();

        JSONObject reply = alice.lastOfType("start-session");
        assertThat(reply.getString("senderId")).isEqualTo("server");
        JSONObject payload = reply.getJSONObject("payload");
        assertThat(payload.getJSONObject("metadata").getString("state")).isEqualTo("CREATED");
        assertThat(payload.getJSONObject("metadata").has("iceServers")).isFalse();
        assertThat(payload.getJSONArray("iceServers").getJSONObject(0).getJSONArray("urls").getString(0))
                .isEqualTo("stun:stun.l.google.com:19302");
        assertThat(dispatcher.boundSession(alice)).contains(sessionId);
    }

    @Test
    void droppedParticipantThatNeverReturnsEndsTheSession() {
        String sessionId = connectedCall();

        dispatcher.onClose(bob);
        assertThat(state(sessionId)).isEqualTo(SessionState.RECONNECTING);

        stack.clock.advance(Duration.ofSeconds(30));
        stack.lifecycle.sweep();

        assertThat(state(sessionId)).isEqualTo(SessionState.ENDED);
        assertThat(alice.lastOfType("end-session").getJSONObject("payload").getString("reason"))
                .isEqualTo("reconnect-grace-expired");

        alice.clear();
        dispatcher.onMessage(alice, ice("alice", sessionId, "candidate:late"));
        assertThat(errorCode(alice)).isEqualTo("session-closed");
    }

    @Test
    void droppedParticipantResumesWithinGraceWindow() {
        String sessionId = connectedCall();
        dispatcher.onClose(bob);

        stack.clock.advance(Duration.ofSeconds(12));
        RecordingSignalChannel bobAgain = new RecordingSignalChannel("ws-bob-2");
        dispatcher.onMessage(bobAgain, join("bob", sessionId));

        assertThat(state(sessionId)).isEqualTo(SessionState.CONNECTED);
        assertThat(bobAgain.lastOfType("start-session").getString("sessionId")).isEqualTo(sessionId);

        dispatcher.onMessage(alice, ice("alice", sessionId, "candidate:after-resume"));
        assertThat(bobAgain.lastOfType("ice-candidate")).isNotNull();
    }

    @Test
    void closingAStaleChannelDoesNotDropTheParticipant() {
        String sessionId = connectedCall();
        RecordingSignalChannel bobAgain = new RecordingSignalChannel("ws-bob-2");
        dispatcher.onMessage(bobAgain, join("bob", sessionId));

        dispatcher.onClose(bob);

        assertThat(state(sessionId)).isEqualTo(SessionState.CONNECTED);
    }

    @Test
    void endSessionIsIdempotent() {
        String sessionId = connectedCall();

        dispatcher.onMessage(alice, end("alice", sessionId));

        assertThat(state(sessionId)).isEqualTo(SessionState.ENDED);
        assertThat(alice.lastOfType("end-session").getJSONObject("payload").getString("reason"))
                .isEqualTo("participant-request");
        assertThat(bob.lastOfType("end-session")).isNotNull();

        alice.clear();
        bob.clear();
        stack.clock.advance(Duration.ofSeconds(3));
        dispatcher.onMessage(bob, end("bob", sessionId));

        assertThat(bob.sentTypes()).containsExactly("end-session");
        assertThat(bob.lastOfType("end-session").getJSONObject("payload").getString("reason"))
                .isEqualTo("participant-request");
        assertThat(alice.sent).isEmpty();
        assertThat(stack.lifecycle.getSession(sessionId).endedAt()).isEqualTo(stack.clock.instant().minusSeconds(3));
    }

    @Test
    void malformedFrameIsAnsweredWithError() {
        dispatcher.onMessage(alice, "{not json");

        assertThat(errorCode(alice)).isEqualTo("malformed-message");
        assertThat(stack.registry.size()).isZero();
    }

    @Test
    void unboundSenderIsRejected() {
        String sessionId = startAsAlice();
        RecordingSignalChannel impostor = new RecordingSignalChannel("ws-impostor");

        dispatcher.onMessage(impostor, sdp("offer", "alice", sessionId));

        assertThat(errorCode(impostor)).isEqualTo("unknown-participant");
        assertThat(state(sessionId)).isEqualTo(SessionState.CREATED);
    }

    @Test
    void unboundChannelCannotEndLiveSession() {
        String sessionId = connectedCall();
        RecordingSignalChannel impostor = new RecordingSignalChannel("ws-impostor");

        dispatcher.onMessage(impostor, end("bob", sessionId));

        assertThat(errorCode(impostor)).isEqualTo("unknown-participant");
        assertThat(state(sessionId)).isEqualTo(SessionState.CONNECTED);
        assertThat(bob.lastOfType("end-session")).isNull();
    }

    @Test
    void endedSessionAnswersRepeatedEndFromAnyParticipantChannel() {
        String sessionId = connectedCall();
        dispatcher.onMessage(alice, end("alice", sessionId));
        RecordingSignalChannel reopened = new RecordingSignalChannel("ws-bob-2");

        dispatcher.onMessage(reopened, end("bob", sessionId));

        assertThat(reopened.sentTypes()).containsExactly("end-session");
        assertThat(reopened.lastOfType("end-session").getJSONObject("payload").getString("reason"))
                .isEqualTo("participant-request");
    }

    @Test
    void unknownSessionIsReported() {
        dispatcher.onMessage(alice, join("alice", "no-such-session"));

        assertThat(errorCode(alice)).isEqualTo("session-not-found");
    }

    @Test
    void competingOfferIsRejected() {
        String sessionId = startAsAlice();
        dispatcher.onMessage(bob, join("bob", sessionId));
        dispatcher.onMessage(alice, sdp("offer", "alice", sessionId));

        dispatcher.onMessage(bob, sdp("offer", "bob", sessionId));

        assertThat(errorCode(bob)).isEqualTo("conflicting-offer");
        assertThat(state(sessionId)).isEqualTo(SessionState.OFFERING);
    }

    @Test
    void candidatesForOffererWaitForTheAnswer() {
        String sessionId = startAsAlice();
        dispatcher.onMessage(bob, join("bob", sessionId));
        dispatcher.onMessage(alice, sdp("offer", "alice", sessionId));

        dispatcher.onMessage(bob, ice("bob", sessionId, "candidate:1"));
        dispatcher.onMessage(bob, ice("bob", sessionId, "candidate:2"));
        assertThat(alice.sentTypes()).doesNotContain("ice-candidate");
        assertThat(stack.relay.bufferedCandidates(sessionId, "alice")).isEqualTo(2);

        dispatcher.onMessage(bob, sdp("answer", "bob", sessionId));

        assertThat(alice.sentTypes()).endsWith("answer", "ice-candidate", "ice-candidate");
        assertThat(alice.lastOfType("ice-candidate").getJSONObject("payload").getString("candidate"))
                .isEqualTo("candidate:2");
    }

    @Test
    void offerForAbsentPeerIsDeliveredWhenItJoins() {
        String sessionId = startAsAlice();
        dispatcher.onMessage(alice, sdp("offer", "alice", sessionId));
        dispatcher.onMessage(alice, ice("alice", sessionId, "candidate:early"));
        assertThat(stack.relay.pendingCount(sessionId, "bob")).isEqualTo(1);

        dispatcher.onMessage(bob, join("bob", sessionId));

        assertThat(bob.sentTypes()).containsExactly("start-session", "offer", "ice-candidate");
        assertThat(stack.relay.pendingCount(sessionId, "bob")).isZero();
    }

    @Test
    void clientErrorMessagesAreIgnored() {
        String sessionId = startAsAlice();
        alice.clear();
        JSONObject error = frame("error", "alice", sessionId)
                .put("payload", new JSONObject().put("code", "camera-denied").put("message", "no camera"));

        dispatcher.onMessage(alice, error.toString());

        assertThat(alice.sent).isEmpty();
        assertThat(state(sessionId)).isEqualTo(SessionState.CREATED);
    }

    @Test
    void clearsLoggingContextAfterEachFrame() {
        String sessionId = startAsAlice();

        dispatcher.onMessage(alice, ice("alice", sessionId, "candidate:x"));

        assertThat(ThreadContext.get("sessionId")).isNull();
        assertThat(ThreadContext.get("participantId")).isNull();
    }

    private String startAsAlice() {
        JSONObject start = new JSONObject()
                .put("type", "start-session")
                .put("senderId", "alice")
                .put("payload", new JSONObject()
                        .put("participantIds", new JSONArray().put("bob"))
                        .put("kind", "peer-call"));
        dispatcher.onMessage(alice, start.toString());
        return alice.lastOfType("start-session").getString("sessionId");
    }

    private String connectedCall() {
        String sessionId = startAsAlice();
        dispatcher.onMessage(bob, join("bob", sessionId));
        dispatcher.onMessage(alice, sdp("offer", "alice", sessionId));
        dispatcher.onMessage(bob, sdp("answer", "bob", sessionId));
        assertThat(state(sessionId)).isEqualTo(SessionState.CONNECTED);
        return sessionId;
    }

    private SessionState state(String sessionId) {
        return stack.lifecycle.getSession(sessionId).state();
    }

    private static String errorCode(RecordingSignalChannel channel) {
        JSONObject error = channel.lastOfType("error");
        assertThat(error).as("error frame on %s", channel.id()).isNotNull();
        return error.getJSONObject("payload").getString("code");
    }

    private static JSONObject frame(String type, String sender, String sessionId) {
        return new JSONObject().put("type", type).put("sessionId", sessionId).put("senderId", sender);
    }

    private static String join(String sender, String sessionId) {
        return frame("start-session", sender, sessionId).put("payload", new JSONObject()).toString();
    }

    private static String sdp(String type, String sender, String sessionId) {
        return frame(type, sender, sessionId)
                .put("payload", new JSONObject().put("type", type).put("sdp", "v=0 " + type))
                .toString();
    }

    private static String ice(String sender, String sessionId, String candidate) {
        return frame("ice-candidate", sender, sessionId)
                .put("payload", new JSONObject().put("candidate", candidate).put("sdpMid", "0").put("sdpMLineIndex", 0))
                .toString();
    }

    private static String end(String sender, String sessionId) {
        return frame("end-session", sender, sessionId).toString();
    }
}
