package com.phillippitts.telesession.presentation.websocket;

import com.phillippitts.telesession.config.logging.LogKeys;
import com.phillippitts.telesession.domain.PoseFrame;
import com.phillippitts.telesession.domain.Session;
import com.phillippitts.telesession.exception.ErrorCode;
import com.phillippitts.telesession.exception.MalformedMessageException;
import com.phillippitts.telesession.exception.SessionException;
import com.phillippitts.telesession.service.session.SessionRegistry;
import com.phillippitts.telesession.service.telemetry.SubmitOutcome;
import com.phillippitts.telesession.service.telemetry.TelemetryMessageCodec;
import com.phillippitts.telesession.service.telemetry.TelemetryPipeline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Socket adapter for {@code /ws/telemetry?sessionId=..&participantId=..}.
 *
 * <p>Each inbound frame is answered with a {@code frame-ack}; analysis updates for the
 * session are pushed as {@code analysis-result} or {@code analysis-pending}. The socket is
 * closed when the session is unknown, has ended, or the participant does not belong to it.
 */
@Component
public class TelemetryWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(TelemetryWebSocketHandler.class);

    static final String PARAM_SESSION_ID = "sessionId";
    static final String PARAM_PARTICIPANT_ID = "participantId";
    static final int SEND_TIME_LIMIT_MS = 5_000;
    static final int SEND_BUFFER_LIMIT_BYTES = 256 * 1024;

    private record Stream(String sessionId, String participantId, WebSocketSession out, AutoCloseable subscription) {
    }

    private final TelemetryPipeline pipeline;
    private final TelemetryMessageCodec codec;
    private final SessionRegistry registry;
    private final Clock clock;
    private final Map<String, Stream> streams = new ConcurrentHashMap<>();

    public TelemetryWebSocketHandler(TelemetryPipeline pipeline,
                                     TelemetryMessageCodec codec,
                                     SessionRegistry registry,
                                     Clock clock) {
        this.pipeline = pipeline;
        this.codec = codec;
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        MultiValueMap<String, String> params = session.getUri() == null
                ? null
                : UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams();
        String sessionId = params == null ? null : params.getFirst(PARAM_SESSION_ID);
        String participantId = params == null ? null : params.getFirst(PARAM_PARTICIPANT_ID);
        WebSocketSession out = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);

        if (sessionId == null || sessionId.isBlank() || participantId == null || participantId.isBlank()) {
            refuse(out, ErrorCode.MALFORMED_MESSAGE, "sessionId and participantId query parameters are required");
            return;
        }
        Optional<Session> found = registry.find(sessionId);
        if (found.isEmpty()) {
            refuse(out, ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId);
            return;
        }
        if (!found.get().hasParticipant(participantId)) {
            refuse(out, ErrorCode.UNKNOWN_PARTICIPANT, "Participant " + participantId + " is not part of " + sessionId);
            return;
        }

        AutoCloseable subscription;
        try {
            subscription = pipeline.subscribe(sessionId, update -> sendQuietly(out, codec.encodeUpdate(update)));
        } catch (SessionException e) {
            refuse(out, e.getErrorCode(), e.getMessage());
            return;
        }
        streams.put(session.getId(), new Stream(sessionId, participantId, out, subscription));
        LOG.info("Telemetry stream opened for session {} by {}", sessionId, participantId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Stream stream = streams.get(session.getId());
        if (stream == null) {
            return;
        }
        ThreadContext.put(LogKeys.SESSION_ID, stream.sessionId());
        ThreadContext.put(LogKeys.PARTICIPANT_ID, stream.participantId());
        try {
            PoseFrame frame = codec.decodeFrame(stream.sessionId(), message.getPayload(), clock.instant());
            SubmitOutcome outcome = pipeline.submitFrame(stream.sessionId(), frame);
            sendQuietly(stream.out(), codec.encodeAck(outcome));
            if (outcome.status() == SubmitOutcome.Status.REJECTED) {
                LOG.info("Session {} no longer streams, closing telemetry socket", stream.sessionId());
                closeQuietly(stream.out(), CloseStatus.NORMAL);
            }
        } catch (MalformedMessageException e) {
            LOG.warn("Malformed telemetry frame: {}", e.getMessage());
            sendQuietly(stream.out(), codec.encodeError(e.getErrorCode(), e.getMessage()));
        } finally {
            ThreadContext.remove(LogKeys.SESSION_ID);
            ThreadContext.remove(LogKeys.PARTICIPANT_ID);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on telemetry socket {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Stream stream = streams.remove(session.getId());
        if (stream == null) {
            return;
        }
        try {
            stream.subscription().close();
        } catch (Exception e) {
            LOG.warn("Failed to unsubscribe telemetry stream of session {}", stream.sessionId(), e);
        }
        LOG.info("Telemetry stream closed for session {} ({})", stream.sessionId(), status);
    }

    int openStreams() {
        return streams.size();
    }

    private void refuse(WebSocketSession out, ErrorCode code, String message) {
        LOG.warn("Refusing telemetry socket: {}", message);
        sendQuietly(out, codec.encodeError(code, message));
        closeQuietly(out, CloseStatus.POLICY_VIOLATION);
    }

    private static void sendQuietly(WebSocketSession out, String text) {
        if (!out.isOpen()) {
            return;
        }
        try {
            out.sendMessage(new TextMessage(text));
        } catch (IOException e) {
            LOG.warn("Telemetry send on socket {} failed: {}", out.getId(), e.getMessage());
        }
    }

    private static void closeQuietly(WebSocketSession out, CloseStatus status) {
        try {
            out.close(status);
        } catch (IOException e) {
            LOG.debug("Closing telemetry socket {} failed: {}", out.getId(), e.getMessage());
        }
    }
}
