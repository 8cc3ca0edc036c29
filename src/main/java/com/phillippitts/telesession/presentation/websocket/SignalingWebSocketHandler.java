package com.phillippitts.telesession.presentation.websocket;

import com.phillippitts.telesession.service.signaling.SignalDispatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Socket adapter for {@code /ws/signaling}: wraps each connection in a channel and hands
 * frames and closures to the {@link SignalDispatcher}.
 */
@Component
public class SignalingWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(SignalingWebSocketHandler.class);

    private final SignalDispatcher dispatcher;
    private final Map<String, WebSocketSignalChannel> channels = new ConcurrentHashMap<>();

    public SignalingWebSocketHandler(SignalDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        channels.put(session.getId(), new WebSocketSignalChannel(session));
        LOG.debug("Signaling socket {} opened from {}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        dispatcher.onMessage(channelFor(session), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on signaling socket {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSignalChannel channel = channels.remove(session.getId());
        if (channel != null) {
            LOG.debug("Signaling socket {} closed: {}", session.getId(), status);
            dispatcher.onClose(channel);
        }
    }

    int openChannels() {
        return channels.size();
    }

    private WebSocketSignalChannel channelFor(WebSocketSession session) {
        return channels.computeIfAbsent(session.getId(), id -> new WebSocketSignalChannel(session));
    }
}
