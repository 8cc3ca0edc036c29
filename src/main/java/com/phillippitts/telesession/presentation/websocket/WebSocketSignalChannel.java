package com.phillippitts.telesession.presentation.websocket;

import com.phillippitts.telesession.service.signaling.SignalChannel;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link SignalChannel} over a Spring {@link WebSocketSession}.
 *
 * <p>Sends go through a {@link ConcurrentWebSocketSessionDecorator} so that the relay may
 * write from any thread while a slow client is bounded by send time and buffer size.
 */
final class WebSocketSignalChannel implements SignalChannel {

    static final int SEND_TIME_LIMIT_MS = 5_000;
    static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final String id;
    private final WebSocketSession session;

    WebSocketSignalChannel(WebSocketSession session) {
        this.id = session.getId();
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close() throws IOException {
        if (session.isOpen()) {
            session.close(CloseStatus.NORMAL);
        }
    }
}
