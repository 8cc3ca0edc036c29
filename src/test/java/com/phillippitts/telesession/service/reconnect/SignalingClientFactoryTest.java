package com.phillippitts.telesession.service.reconnect;

import com.phillippitts.telesession.config.properties.ReconnectProperties;
import com.phillippitts.telesession.service.signaling.codec.SignalMessageCodec;
import com.phillippitts.telesession.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignalingClientFactoryTest {

    private static final URI SIGNALING = URI.create("ws://signal.example.org/ws/signaling");

    private final ReconnectManager reconnectManager = new ReconnectManager(mock(TaskScheduler.class),
            MutableClock.startingAt("2026-03-02T10:00:00Z"), BackoffPolicy.from(new ReconnectProperties()), () -> 0.5);

    @Test
    void createsIdleClientsPerParticipant() {
        SignalingClientFactory factory = new SignalingClientFactory(mock(WebSocketClient.class), SIGNALING,
                new SignalMessageCodec(), reconnectManager);

        SignalingClient alice = factory.create("alice", new SignalingClient.Listener() { });
        SignalingClient bob = factory.create("bob", new SignalingClient.Listener() { });

        assertThat(alice).isNotSameAs(bob);
        assertThat(alice.getParticipantId()).isEqualTo("alice");
        assertThat(alice.getState()).isEqualTo(SignalingClient.ConnectionState.IDLE);
        assertThat(alice.getSessionId()).isNull();
    }

    @Test
    void clientsDialTheConfiguredUrl() {
        WebSocketClient webSocketClient = mock(WebSocketClient.class);
        WebSocketSession socket = mock(WebSocketSession.class);
        when(socket.getId()).thenReturn("sock-1");
        when(socket.isOpen()).thenReturn(true);
        when(webSocketClient.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
                .thenReturn(CompletableFuture.completedFuture(socket));
        SignalingClientFactory factory = new SignalingClientFactory(webSocketClient, SIGNALING,
                new SignalMessageCodec(), reconnectManager);

        factory.create("alice", new SignalingClient.Listener() { }).join("s-1");

        verify(webSocketClient).execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), eq(SIGNALING));
    }
}
