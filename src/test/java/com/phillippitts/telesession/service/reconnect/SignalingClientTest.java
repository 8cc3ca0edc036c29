package com.phillippitts.telesession.service.reconnect;

import com.phillippitts.telesession.config.properties.ReconnectProperties;
import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.domain.signal.ErrorPayload;
import com.phillippitts.telesession.domain.signal.SdpPayload;
import com.phillippitts.telesession.domain.signal.SessionStartPayload;
import com.phillippitts.telesession.domain.signal.SignalMessage;
import com.phillippitts.telesession.domain.signal.SignalType;
import com.phillippitts.telesession.exception.ErrorCode;
import com.phillippitts.telesession.exception.SocketDroppedException;
import com.phillippitts.telesession.service.signaling.codec.SignalMessageCodec;
import com.phillippitts.telesession.testutil.MutableClock;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.OngoingStubbing;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignalingClientTest {

    private static final URI SIGNALING = URI.create("ws://localhost:8080/ws/signaling");

    private final SignalMessageCodec codec = new SignalMessageCodec();
    private final List<Runnable> scheduled = new ArrayList<>();
    private final List<String> states = new CopyOnWriteArrayList<>();
    private final List<SignalMessage> signals = new CopyOnWriteArrayList<>();
    private WebSocketClient webSocketClient;
    private ReconnectManager reconnectManager;
    private SignalingClient client;

    @BeforeEach
    void setUp() {
        webSocketClient = mock(WebSocketClient.class);
        TaskScheduler scheduler = mock(TaskScheduler.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doAnswer(invocation -> {
            scheduled.add(invocation.getArgument(0));
            return future;
        }).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        reconnectManager = new ReconnectManager(scheduler, MutableClock.startingAt("2026-03-02T10:00:00Z"),
                BackoffPolicy.from(new ReconnectProperties()), () -> 0.5);
        client = new SignalingClient(webSocketClient, SIGNALING, "alice", codec, reconnectManager,
                new SignalingClient.Listener() {
                    @Override
                    public void onSignal(SignalMessage message) {
                        signals.add(message);
                    }

                    @Override
                    public void onStateChanged(SignalingClient.ConnectionState state, String reason) {
                        states.add(state + (reason == null ? "" : ":" + reason));
                    }
                });
    }

    @Test
    void startsSessionAndBecomesConnectedOnReply() throws IOException {
        List<String> frames = new CopyOnWriteArrayList<>();
        givenSockets(socket("sock-1", frames));

        client.start(new SessionStartPayload(List.of("bob"), SessionKind.PEER_CALL, Map.of()));

        JSONObject hello = new JSONObject(frames.get(0));
        assertThat(hello.getString("type")).isEqualTo("start-session");
        assertThat(hello.getString("sessionId")).isEmpty();
        assertThat(hello.getString("senderId")).isEqualTo("alice");
        assertThat(hello.getJSONObject("payload").getJSONArray("participantIds").toList()).containsExactly("bob");
        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.CONNECTING);

        client.onInbound(startReply("s-1"));

        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.CONNECTED);
        assertThat(client.getSessionId()).isEqualTo("s-1");
        assertThat(states).containsExactly("CONNECTING", "CONNECTED");
    }

    @Test
    void sendsNegotiationMessagesForCurrentSession() throws IOException {
        List<String> frames = new CopyOnWriteArrayList<>();
        givenSockets(socket("sock-1", frames));
        client.join("s-1");
        client.onInbound(startReply("s-1"));

        client.send(SignalType.OFFER, new SdpPayload("offer", "v=0"));

        JSONObject offer = new JSONObject(frames.get(1));
        assertThat(offer.getString("type")).isEqualTo("offer");
        assertThat(offer.getString("sessionId")).isEqualTo("s-1");
        assertThatThrownBy(() -> client.send(SignalType.END_SESSION, new SdpPayload("offer", "v=0")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void refusesToSendBeforeConnected() throws IOException {
        givenSockets(socket("sock-1", new ArrayList<>()));
        client.join("s-1");

        assertThatThrownBy(() -> client.send(SignalType.OFFER, new SdpPayload("offer", "v=0")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void passesPeerSignalsToListener() throws Exception {
        WebSocketSession socket = socket("sock-1", new ArrayList<>());
        givenSockets(socket);
        client.join("s-1");
        SignalMessage answer = new SignalMessage(SignalType.ANSWER, "s-1", "bob", new SdpPayload("answer", "v=0"));

        client.handler().handleMessage(socket, new TextMessage(codec.encode(answer)));
        client.handler().handleMessage(socket, new TextMessage("{garbage"));

        assertThat(signals).containsExactly(answer);
    }

    @Test
    void reconnectsWithSameSessionIdAfterDrop() throws IOException {
        List<String> firstFrames = new CopyOnWriteArrayList<>();
        List<String> secondFrames = new CopyOnWriteArrayList<>();
        WebSocketSession first = socket("sock-1", firstFrames);
        WebSocketSession second = socket("sock-2", secondFrames);
        givenSockets(first, second);
        client.start(SessionStartPayload.empty());
        client.onInbound(startReply("s-1"));

        client.onSocketClosed(first, CloseStatus.GOING_AWAY);

        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.RECONNECTING);
        assertThat(scheduled).hasSize(1);

        scheduled.get(0).run();

        JSONObject resume = new JSONObject(secondFrames.get(0));
        assertThat(resume.getString("type")).isEqualTo("start-session");
        assertThat(resume.getString("sessionId")).isEqualTo("s-1");

        client.onInbound(startReply("s-1"));
        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.CONNECTED);
        assertThat(states).containsSubsequence("RECONNECTING:socket-dropped", "CONNECTED");
    }

    @Test
    void retriesAgainWhenReopenedSocketDropsBeforeReply() throws IOException {
        List<String> thirdFrames = new CopyOnWriteArrayList<>();
        WebSocketSession first = socket("sock-1", new ArrayList<>());
        WebSocketSession second = socket("sock-2", new ArrayList<>());
        WebSocketSession third = socket("sock-3", thirdFrames);
        givenSockets(first, second, third);
        client.join("s-1");
        client.onInbound(startReply("s-1"));
        client.onSocketClosed(first, CloseStatus.GOING_AWAY);
        scheduled.get(0).run();

        client.onSocketClosed(second, CloseStatus.GOING_AWAY);

        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.RECONNECTING);
        assertThat(scheduled).hasSize(2);

        scheduled.get(1).run();
        assertThat(new JSONObject(thirdFrames.get(0)).getString("sessionId")).isEqualTo("s-1");
        client.onInbound(startReply("s-1"));

        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.CONNECTED);
        assertThat(states).containsOnlyOnce("RECONNECTING:socket-dropped");
    }

    @Test
    void ignoresCloseOfReplacedSocket() throws IOException {
        WebSocketSession first = socket("sock-1", new ArrayList<>());
        WebSocketSession second = socket("sock-2", new ArrayList<>());
        givenSockets(first, second);
        client.join("s-1");
        client.onInbound(startReply("s-1"));
        client.onSocketClosed(first, CloseStatus.GOING_AWAY);
        scheduled.get(0).run();
        client.onInbound(startReply("s-1"));

        client.onSocketClosed(first, CloseStatus.GOING_AWAY);

        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.CONNECTED);
    }

    @Test
    void endCancelsPendingReconnect() throws IOException {
        WebSocketSession first = socket("sock-1", new ArrayList<>());
        givenSockets(first);
        client.join("s-1");
        client.onInbound(startReply("s-1"));
        client.onSocketClosed(first, CloseStatus.GOING_AWAY);

        client.end("participant-request");
        scheduled.get(0).run();

        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.ENDED);
        assertThat(client.getCancellationToken().isCancelled()).isTrue();
        verify(webSocketClient, times(1)).execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class),
                any(URI.class));
    }

    @Test
    void endNotifiesServerAndClosesSocket() throws IOException {
        List<String> frames = new CopyOnWriteArrayList<>();
        WebSocketSession socket = socket("sock-1", frames);
        givenSockets(socket);
        client.join("s-1");
        client.onInbound(startReply("s-1"));

        client.end("participant-request");
        client.end("participant-request");

        assertThat(frames).hasSize(2);
        assertThat(new JSONObject(frames.get(1)).getString("type")).isEqualTo("end-session");
        verify(socket).close(CloseStatus.NORMAL);
        assertThat(states).containsOnlyOnce("ENDED:participant-request");
    }

    @Test
    void serverEndStopsTheClient() throws IOException {
        givenSockets(socket("sock-1", new ArrayList<>()));
        client.join("s-1");
        client.onInbound(startReply("s-1"));

        client.onInbound(SignalMessage.endSession("s-1", SignalMessage.SERVER_SENDER, "reconnect-grace-expired"));

        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.ENDED);
        assertThat(states).contains("ENDED:reconnect-grace-expired");
        assertThat(client.getCancellationToken().isCancelled()).isTrue();
    }

    @Test
    void closedSessionErrorEndsTheClient() throws IOException {
        List<ErrorPayload> errors = new ArrayList<>();
        client = new SignalingClient(webSocketClient, SIGNALING, "alice", codec, reconnectManager,
                new SignalingClient.Listener() {
                    @Override
                    public void onError(ErrorPayload error) {
                        errors.add(error);
                    }
                });
        givenSockets(socket("sock-1", new ArrayList<>()));
        client.join("s-1");

        client.onInbound(SignalMessage.error("s-1", ErrorCode.SESSION_CLOSED, "Session has ended"));

        assertThat(errors).extracting(ErrorPayload::code).containsExactly("session-closed");
        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.ENDED);
    }

    @Test
    void failedConnectEndsClient() {
        when(webSocketClient.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
                .thenReturn(CompletableFuture.failedFuture(new IOException("connection refused")));

        assertThatThrownBy(() -> client.join("s-1"))
                .isInstanceOf(SocketDroppedException.class);
        assertThat(client.getState()).isEqualTo(SignalingClient.ConnectionState.ENDED);
        assertThatThrownBy(() -> client.join("s-1"))
                .isInstanceOf(IllegalStateException.class);
    }

    private void givenSockets(WebSocketSession... sockets) {
        OngoingStubbing<CompletableFuture<WebSocketSession>> stubbing = when(webSocketClient.execute(
                any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)));
        for (WebSocketSession session : sockets) {
            stubbing = stubbing.thenReturn(CompletableFuture.completedFuture(session));
        }
    }

    private static WebSocketSession socket(String id, List<String> frames) throws IOException {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        doAnswer(invocation -> {
            frames.add(((TextMessage) invocation.getArgument(0)).getPayload());
            return null;
        }).when(session).sendMessage(any());
        return session;
    }

    private static SignalMessage startReply(String sessionId) {
        return new SignalMessage(SignalType.START_SESSION, sessionId, SignalMessage.SERVER_SENDER,
                new SessionStartPayload(List.of("alice", "bob"), SessionKind.PEER_CALL, Map.of("state", "CREATED")));
    }
}
