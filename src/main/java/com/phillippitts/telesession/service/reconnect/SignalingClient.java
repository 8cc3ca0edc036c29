package com.phillippitts.telesession.service.reconnect;

import com.phillippitts.telesession.domain.signal.ErrorPayload;
import com.phillippitts.telesession.domain.signal.SessionEndPayload;
import com.phillippitts.telesession.domain.signal.SessionStartPayload;
import com.phillippitts.telesession.domain.signal.SignalMessage;
import com.phillippitts.telesession.domain.signal.SignalPayload;
import com.phillippitts.telesession.domain.signal.SignalType;
import com.phillippitts.telesession.exception.ErrorCode;
import com.phillippitts.telesession.exception.MalformedMessageException;
import com.phillippitts.telesession.exception.SocketDroppedException;
import com.phillippitts.telesession.service.signaling.codec.SignalMessageCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Java client of the signaling socket for one participant.
 *
 * <p>The client opens the socket, sends {@code start-session} and remembers the session id
 * from the server's reply. When the socket closes without an {@code end-session}, it moves
 * to {@link ConnectionState#RECONNECTING} and hands a connector to the
 * {@link ReconnectManager}; every retry reopens the socket and re-sends {@code start-session}
 * with the same session id. {@link #end(String)} cancels pending retries.
 *
 * <p><b>Thread Safety:</b> state changes are synchronized on the client; callbacks of the
 * {@link Listener} run on socket or scheduler threads.
 *
 * @since 1.0
 */
public class SignalingClient {

    private static final Logger LOG = LogManager.getLogger(SignalingClient.class);

    static final int SEND_TIME_LIMIT_MS = 5_000;
    static final int SEND_BUFFER_LIMIT_BYTES = 64 * 1024;
    static final long CONNECT_TIMEOUT_MS = 10_000;

    /**
     * Client-side view of the connection.
     */
    public enum ConnectionState {
        IDLE,
        CONNECTING,
        CONNECTED,
        RECONNECTING,
        ENDED
    }

    /**
     * Receives what the server sends and the client's state changes.
     */
    public interface Listener {

        default void onSessionStarted(String sessionId, SessionStartPayload payload) {
        }

        /** offer, answer and ice-candidate messages from the peer. */
        default void onSignal(SignalMessage message) {
        }

        default void onError(ErrorPayload error) {
        }

        default void onStateChanged(ConnectionState state, String reason) {
        }
    }

    private final WebSocketClient webSocketClient;
    private final URI uri;
    private final String participantId;
    private final SignalMessageCodec codec;
    private final ReconnectManager reconnectManager;
    private final Listener listener;
    private final Handler handler = new Handler();

    private final CancellationToken token = new CancellationToken();
    private volatile ConnectionState state = ConnectionState.IDLE;
    private volatile String sessionId;
    private volatile SessionStartPayload startPayload = SessionStartPayload.empty();
    private volatile WebSocketSession socket;
    private boolean reconnectRunning;
    private int reconnectAttempts;

    public SignalingClient(WebSocketClient webSocketClient,
                           URI uri,
                           String participantId,
                           SignalMessageCodec codec,
                           ReconnectManager reconnectManager,
                           Listener listener) {
        this.webSocketClient = Objects.requireNonNull(webSocketClient, "webSocketClient must not be null");
        this.uri = Objects.requireNonNull(uri, "uri must not be null");
        this.participantId = Objects.requireNonNull(participantId, "participantId must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.reconnectManager = Objects.requireNonNull(reconnectManager, "reconnectManager must not be null");
        this.listener = listener == null ? new Listener() { } : listener;
    }

    /**
     * Asks the server to create a session with the given invitees.
     *
     * @throws SocketDroppedException if the socket cannot be opened
     */
    public void start(SessionStartPayload payload) {
        open(null, payload);
    }

    /**
     * Joins (or resumes) an existing session.
     *
     * @throws SocketDroppedException if the socket cannot be opened
     */
    public void join(String existingSessionId) {
        open(Objects.requireNonNull(existingSessionId, "existingSessionId must not be null"),
                SessionStartPayload.empty());
    }

    /**
     * Sends an offer, answer or ICE candidate for the current session.
     *
     * @throws IllegalStateException if the client is not connected to a session
     */
    public void send(SignalType type, SignalPayload payload) {
        if (type == SignalType.START_SESSION || type == SignalType.END_SESSION) {
            throw new IllegalArgumentException("Use start/join/end for " + type.wireName());
        }
        if (state != ConnectionState.CONNECTED || sessionId == null) {
            throw new IllegalStateException("Cannot send " + type.wireName() + " while " + state);
        }
        try {
            write(new SignalMessage(type, sessionId, participantId, payload));
        } catch (IOException e) {
            throw new SocketDroppedException("Send of " + type.wireName() + " failed", e);
        }
    }

    /**
     * Ends the session explicitly. Cancels any pending reconnect; does nothing once ended.
     */
    public void end(String reason) {
        token.cancel();
        WebSocketSession current = socket;
        String id = sessionId;
        if (!markEnded(reason == null ? "participant-request" : reason)) {
            return;
        }
        if (current != null && current.isOpen()) {
            try {
                if (id != null) {
                    write(SignalMessage.endSession(id, participantId, reason));
                }
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                LOG.warn("Closing signaling socket for session {} failed: {}", id, e.getMessage());
            }
        }
    }

    public ConnectionState getState() {
        return state;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getParticipantId() {
        return participantId;
    }

    CancellationToken getCancellationToken() {
        return token;
    }

    TextWebSocketHandler handler() {
        return handler;
    }

    private void open(String existingSessionId, SessionStartPayload payload) {
        synchronized (this) {
            if (state != ConnectionState.IDLE) {
                throw new IllegalStateException("Client already used (state " + state + ")");
            }
            sessionId = existingSessionId;
            startPayload = payload == null ? SessionStartPayload.empty() : payload;
        }
        changeState(ConnectionState.CONNECTING, null);
        try {
            connectAndHandshake();
        } catch (IOException e) {
            markEnded("connect-failed");
            throw new SocketDroppedException("Could not open signaling socket to " + uri, e);
        }
    }

    /**
     * Opens a socket and sends {@code start-session}; the reply moves the client to CONNECTED.
     */
    void connectAndHandshake() throws IOException {
        WebSocketSession raw;
        try {
            raw = webSocketClient.execute(handler, new WebSocketHttpHeaders(), uri)
                    .get(CONNECT_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Handshake with " + uri + " failed", e);
        }
        socket = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        SessionStartPayload payload = sessionId == null ? startPayload : SessionStartPayload.empty();
        write(new SignalMessage(SignalType.START_SESSION, sessionId, participantId, payload));
    }

    private void write(SignalMessage message) throws IOException {
        WebSocketSession current = socket;
        if (current == null || !current.isOpen()) {
            throw new IOException("Signaling socket is not open");
        }
        current.sendMessage(new TextMessage(codec.encode(message)));
    }

    void onInbound(SignalMessage message) {
        switch (message.type()) {
            case START_SESSION -> {
                synchronized (this) {
                    reconnectAttempts = 0;
                }
                sessionId = message.sessionId();
                changeState(ConnectionState.CONNECTED, null);
                listener.onSessionStarted(message.sessionId(), (SessionStartPayload) message.payload());
            }
            case END_SESSION -> {
                token.cancel();
                String reason = ((SessionEndPayload) message.payload()).reason();
                markEnded(reason == null ? "ended-by-server" : reason);
            }
            case ERROR -> {
                ErrorPayload error = (ErrorPayload) message.payload();
                LOG.warn("Server error for session {}: {} {}", sessionId, error.code(), error.message());
                listener.onError(error);
                if (ErrorCode.SESSION_CLOSED.wireName().equals(error.code())
                        || ErrorCode.SESSION_NOT_FOUND.wireName().equals(error.code())) {
                    token.cancel();
                    markEnded(error.code());
                }
            }
            default -> listener.onSignal(message);
        }
    }

    void onSocketClosed(WebSocketSession closed, CloseStatus status) {
        WebSocketSession current = socket;
        if (current != null && current != closed && !isSameSession(current, closed)) {
            return;
        }
        int spent;
        synchronized (this) {
            if (state == ConnectionState.ENDED || (state == ConnectionState.RECONNECTING && reconnectRunning)) {
                return;
            }
            if (state == ConnectionState.RECONNECTING) {
                spent = reconnectAttempts;
            } else if (sessionId == null) {
                spent = -1;
            } else {
                state = ConnectionState.RECONNECTING;
                reconnectAttempts = 0;
                spent = 0;
            }
            reconnectRunning = spent >= 0;
        }
        if (spent < 0) {
            LOG.warn("Signaling socket closed before the session was established: {}", status);
            markEnded("socket-dropped");
            return;
        }
        if (spent == 0) {
            LOG.warn("Signaling socket for session {} dropped ({}), reconnecting", sessionId, status);
            listener.onStateChanged(ConnectionState.RECONNECTING, ErrorCode.SOCKET_DROPPED.wireName());
        } else {
            LOG.warn("Reopened socket for session {} dropped before the resume reply ({}), {} attempt(s) spent",
                    sessionId, status, spent);
        }
        reconnectManager.resume(
                spent,
                this::reconnectOnce,
                () -> state == ConnectionState.RECONNECTING,
                token,
                new ReconnectListener() {
                    @Override
                    public void onReconnected(int attempts) {
                        LOG.info("Signaling socket for session {} reopened after {} attempt(s)", sessionId, attempts);
                    }

                    @Override
                    public void onExhausted(int attempts, Throwable lastFailure) {
                        synchronized (SignalingClient.this) {
                            reconnectRunning = false;
                        }
                        markEnded("reconnect-exhausted");
                    }

                    @Override
                    public void onAbandoned(int attempts) {
                        synchronized (SignalingClient.this) {
                            reconnectRunning = false;
                        }
                    }
                });
    }

    /**
     * One retry of a reconnect run. The run ends once the reopened socket is still open after
     * the handshake was sent; a later drop of that socket, before the server's reply, starts a
     * new run on the remaining budget.
     */
    private void reconnectOnce() throws IOException {
        synchronized (this) {
            reconnectAttempts++;
        }
        connectAndHandshake();
        synchronized (this) {
            WebSocketSession reopened = socket;
            if (reopened == null || !reopened.isOpen()) {
                throw new IOException("Signaling socket closed before the handshake was sent");
            }
            reconnectRunning = false;
        }
    }

    private static boolean isSameSession(WebSocketSession current, WebSocketSession closed) {
        if (current instanceof ConcurrentWebSocketSessionDecorator decorator) {
            return decorator.getDelegate() == closed || decorator.getLastSession() == closed;
        }
        return false;
    }

    private boolean markEnded(String reason) {
        synchronized (this) {
            if (state == ConnectionState.ENDED) {
                return false;
            }
            state = ConnectionState.ENDED;
        }
        LOG.info("Session {} ended on client {}: {}", sessionId, participantId, reason);
        listener.onStateChanged(ConnectionState.ENDED, reason);
        return true;
    }

    private void changeState(ConnectionState next, String reason) {
        synchronized (this) {
            if (state == ConnectionState.ENDED || state == next) {
                return;
            }
            state = next;
        }
        listener.onStateChanged(next, reason);
    }

    private final class Handler extends TextWebSocketHandler {

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            try {
                onInbound(codec.decode(message.getPayload()));
            } catch (MalformedMessageException e) {
                LOG.warn("Dropping malformed frame from server: {}", e.getMessage());
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            onSocketClosed(session, status);
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            LOG.warn("Transport error on signaling socket: {}", exception.getMessage());
        }
    }
}
