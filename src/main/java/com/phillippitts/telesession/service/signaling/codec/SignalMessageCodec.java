package com.phillippitts.telesession.service.signaling.codec;

import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.domain.signal.ErrorPayload;
import com.phillippitts.telesession.domain.signal.IceCandidate;
import com.phillippitts.telesession.domain.signal.IceServer;
import com.phillippitts.telesession.domain.signal.SdpPayload;
import com.phillippitts.telesession.domain.signal.SessionEndPayload;
import com.phillippitts.telesession.domain.signal.SessionStartPayload;
import com.phillippitts.telesession.domain.signal.SignalMessage;
import com.phillippitts.telesession.domain.signal.SignalPayload;
import com.phillippitts.telesession.domain.signal.SignalType;
import com.phillippitts.telesession.exception.MalformedMessageException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes and decodes {@link SignalMessage} to and from its JSON wire form:
 *
 * <pre>
 * { "type": "offer", "sessionId": "...", "senderId": "...", "payload": { ... } }
 * </pre>
 *
 * <p>The message {@code type} decides the payload shape. Decoding validates that pairing
 * and rejects anything else with {@link MalformedMessageException}, so nothing untyped
 * reaches the state machine.
 *
 * <p>Thread-safe: stateless, no side effects.
 *
 * @since 1.0
 */
@Component
public class SignalMessageCodec {

    /**
     * Maximum accepted message size. SDP blobs stay well below this; anything larger is
     * rejected before parsing.
     */
    static final int MAX_MESSAGE_CHARS = 262_144;

    private static final String TYPE = "type";
    private static final String SESSION_ID = "sessionId";
    private static final String SENDER_ID = "senderId";
    private static final String PAYLOAD = "payload";

    /**
     * Decodes a UTF-8 encoded message.
     *
     * @throws MalformedMessageException if the bytes are not a valid signal message
     */
    public SignalMessage decode(byte[] bytes) {
        if (bytes == null) {
            throw new MalformedMessageException("empty message");
        }
        return decode(new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * Decodes a message from its JSON text.
     *
     * @throws MalformedMessageException if the text is not a valid signal message
     */
    public SignalMessage decode(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedMessageException("empty message");
        }
        if (json.length() > MAX_MESSAGE_CHARS) {
            throw new MalformedMessageException("message exceeds " + MAX_MESSAGE_CHARS + " characters");
        }

        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new MalformedMessageException("invalid JSON", e);
        }

        String typeName = requireString(root, TYPE);
        SignalType type = SignalType.fromWire(typeName)
                .orElseThrow(() -> new MalformedMessageException("unknown type '" + typeName + "'"));

        String sessionId = optString(root, SESSION_ID);
        if (type != SignalType.START_SESSION && (sessionId == null || sessionId.isBlank())) {
            throw new MalformedMessageException("'" + SESSION_ID + "' is required for " + type.wireName());
        }
        String senderId = requireString(root, SENDER_ID);
        if (senderId.isBlank()) {
            throw new MalformedMessageException("'" + SENDER_ID + "' must not be blank");
        }

        JSONObject payload = optObject(root, PAYLOAD);
        return new SignalMessage(type, sessionId, senderId, decodePayload(type, payload));
    }

    /**
     * Encodes a message to its JSON text.
     */
    public String encode(SignalMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        JSONObject root = new JSONObject();
        root.put(TYPE, message.type().wireName());
        root.put(SESSION_ID, message.sessionId());
        root.put(SENDER_ID, message.senderId());
        root.put(PAYLOAD, encodePayload(message.payload()));
        return root.toString();
    }

    /**
     * Encodes a message to UTF-8 bytes.
     */
    public byte[] encodeBytes(SignalMessage message) {
        return encode(message).getBytes(StandardCharsets.UTF_8);
    }

    private SignalPayload decodePayload(SignalType type, JSONObject payload) {
        return switch (type) {
            case START_SESSION -> decodeStart(payload);
            case OFFER, ANSWER -> decodeSdp(type, requirePayload(type, payload));
            case ICE_CANDIDATE -> decodeIce(requirePayload(type, payload));
            case END_SESSION -> new SessionEndPayload(payload == null ? null : optString(payload, "reason"));
            case ERROR -> decodeError(requirePayload(type, payload));
        };
    }

    private static JSONObject requirePayload(SignalType type, JSONObject payload) {
        if (payload == null) {
            throw new MalformedMessageException("'" + PAYLOAD + "' is required for " + type.wireName());
        }
        return payload;
    }

    private SessionStartPayload decodeStart(JSONObject payload) {
        if (payload == null) {
            return SessionStartPayload.empty();
        }
        List<String> participants = new ArrayList<>();
        if (payload.has("participantIds") && !payload.isNull("participantIds")) {
            Object raw = payload.get("participantIds");
            if (!(raw instanceof JSONArray array)) {
                throw new MalformedMessageException("'participantIds' must be an array");
            }
            for (int i = 0; i < array.length(); i++) {
                Object id = array.get(i);
                if (!(id instanceof String s) || s.isBlank()) {
                    throw new MalformedMessageException("'participantIds' must contain non-blank strings");
                }
                participants.add(s);
            }
        }

        SessionKind kind = null;
        String kindName = optString(payload, "kind");
        if (kindName != null) {
            try {
                kind = SessionKind.fromWire(kindName);
            } catch (IllegalArgumentException e) {
                throw new MalformedMessageException("unknown session kind '" + kindName + "'", e);
            }
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        JSONObject rawMetadata = optObject(payload, "metadata");
        if (rawMetadata != null) {
            for (String key : rawMetadata.keySet()) {
                Object value = rawMetadata.get(key);
                if (value instanceof JSONObject || value instanceof JSONArray) {
                    throw new MalformedMessageException("metadata value for '" + key + "' must be a scalar");
                }
                if (!JSONObject.NULL.equals(value)) {
                    metadata.put(key, String.valueOf(value));
                }
            }
        }
        return new SessionStartPayload(participants, kind, metadata, decodeIceServers(payload));
    }

    private List<IceServer> decodeIceServers(JSONObject payload) {
        if (!payload.has("iceServers") || payload.isNull("iceServers")) {
            return List.of();
        }
        if (!(payload.get("iceServers") instanceof JSONArray array)) {
            throw new MalformedMessageException("'iceServers' must be an array");
        }
        List<IceServer> servers = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            if (!(array.get(i) instanceof JSONObject server)) {
                throw new MalformedMessageException("'iceServers' must contain objects");
            }
            List<String> urls = new ArrayList<>();
            Object rawUrls = server.opt("urls");
            if (rawUrls instanceof String url) {
                urls.add(url);
            } else if (rawUrls instanceof JSONArray urlArray) {
                for (int j = 0; j < urlArray.length(); j++) {
                    if (!(urlArray.get(j) instanceof String url)) {
                        throw new MalformedMessageException("ICE server 'urls' must contain strings");
                    }
                    urls.add(url);
                }
            }
            if (urls.isEmpty()) {
                throw new MalformedMessageException("ICE server needs at least one url");
            }
            servers.add(new IceServer(urls, optString(server, "username"), optString(server, "credential")));
        }
        return servers;
    }

    private SdpPayload decodeSdp(SignalType type, JSONObject payload) {
        String sdp = requireString(payload, "sdp");
        if (sdp.isBlank()) {
            throw new MalformedMessageException("'sdp' must not be blank");
        }
        String sdpType = optString(payload, "type");
        if (sdpType != null && !sdpType.equals(type.wireName())) {
            throw new MalformedMessageException(
                    "payload type '" + sdpType + "' does not match message type '" + type.wireName() + "'");
        }
        return new SdpPayload(type.wireName(), sdp);
    }

    private IceCandidate decodeIce(JSONObject payload) {
        String candidate = requireString(payload, "candidate");
        Integer lineIndex = null;
        if (payload.has("sdpMLineIndex") && !payload.isNull("sdpMLineIndex")) {
            Object raw = payload.get("sdpMLineIndex");
            if (!(raw instanceof Number n) || n.intValue() < 0 || n.doubleValue() != n.intValue()) {
                throw new MalformedMessageException("'sdpMLineIndex' must be a non-negative integer");
            }
            lineIndex = n.intValue();
        }
        return new IceCandidate(candidate, optString(payload, "sdpMid"), lineIndex,
                optString(payload, "usernameFragment"));
    }

    private ErrorPayload decodeError(JSONObject payload) {
        String code = requireString(payload, "code");
        return new ErrorPayload(code, optString(payload, "message"));
    }

    private JSONObject encodePayload(SignalPayload payload) {
        JSONObject out = new JSONObject();
        if (payload instanceof SessionStartPayload start) {
            if (!start.participantIds().isEmpty()) {
                out.put("participantIds", new JSONArray(start.participantIds()));
            }
            if (start.kind() != null) {
                out.put("kind", start.kind().wireName());
            }
            if (!start.metadata().isEmpty()) {
                out.put("metadata", new JSONObject(start.metadata()));
            }
            if (!start.iceServers().isEmpty()) {
                JSONArray servers = new JSONArray();
                for (IceServer server : start.iceServers()) {
                    JSONObject entry = new JSONObject().put("urls", new JSONArray(server.urls()));
                    putIfPresent(entry, "username", server.username());
                    putIfPresent(entry, "credential", server.credential());
                    servers.put(entry);
                }
                out.put("iceServers", servers);
            }
        } else if (payload instanceof SdpPayload sdp) {
            out.put("type", sdp.sdpType());
            out.put("sdp", sdp.sdp());
        } else if (payload instanceof IceCandidate ice) {
            out.put("candidate", ice.candidate());
            putIfPresent(out, "sdpMid", ice.sdpMid());
            putIfPresent(out, "sdpMLineIndex", ice.sdpMLineIndex());
            putIfPresent(out, "usernameFragment", ice.usernameFragment());
        } else if (payload instanceof SessionEndPayload end) {
            putIfPresent(out, "reason", end.reason());
        } else if (payload instanceof ErrorPayload error) {
            out.put("code", error.code());
            out.put("message", error.message());
        } else {
            throw new IllegalArgumentException("Unsupported payload: " + payload.getClass().getName());
        }
        return out;
    }

    private static void putIfPresent(JSONObject out, String key, Object value) {
        if (value != null) {
            out.put(key, value);
        }
    }

    private static String requireString(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            throw new MalformedMessageException("'" + key + "' is required");
        }
        Object value = obj.get(key);
        if (!(value instanceof String s)) {
            throw new MalformedMessageException("'" + key + "' must be a string");
        }
        return s;
    }

    private static String optString(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        Object value = obj.get(key);
        if (!(value instanceof String s)) {
            throw new MalformedMessageException("'" + key + "' must be a string");
        }
        return s;
    }

    private static JSONObject optObject(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        Object value = obj.get(key);
        if (!(value instanceof JSONObject o)) {
            throw new MalformedMessageException("'" + key + "' must be an object");
        }
        return o;
    }
}
