package com.phillippitts.telesession.service.reconnect;

import com.phillippitts.telesession.config.properties.ReconnectProperties;
import com.phillippitts.telesession.service.signaling.codec.SignalMessageCodec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.URI;

/**
 * Creates {@link SignalingClient}s bound to the configured {@code reconnect.signaling-url}.
 */
@Component
public class SignalingClientFactory {

    private final WebSocketClient webSocketClient;
    private final URI signalingUri;
    private final SignalMessageCodec codec;
    private final ReconnectManager reconnectManager;

    @Autowired
    public SignalingClientFactory(ReconnectProperties properties,
                                  SignalMessageCodec codec,
                                  ReconnectManager reconnectManager) {
        this(new StandardWebSocketClient(), URI.create(properties.getSignalingUrl()), codec, reconnectManager);
    }

    SignalingClientFactory(WebSocketClient webSocketClient,
                           URI signalingUri,
                           SignalMessageCodec codec,
                           ReconnectManager reconnectManager) {
        this.webSocketClient = webSocketClient;
        this.signalingUri = signalingUri;
        this.codec = codec;
        this.reconnectManager = reconnectManager;
    }

    public SignalingClient create(String participantId, SignalingClient.Listener listener) {
        return new SignalingClient(webSocketClient, signalingUri, participantId, codec, reconnectManager, listener);
    }
}
