package com.phillippitts.telesession.domain.signal;

import com.phillippitts.telesession.domain.SessionKind;

import java.util.List;
import java.util.Map;

/**
 * Payload of {@code start-session}. Clients may leave every field empty when joining or
 * resuming an existing session; the server fills them in its reply.
 *
 * @param participantIds invited participants (the sender is always included)
 * @param kind           call kind, {@code null} defaults to peer call
 * @param metadata       opaque session metadata
 * @param iceServers     STUN/TURN servers; filled only in the server reply
 */
public record SessionStartPayload(
        List<String> participantIds,
        SessionKind kind,
        Map<String, String> metadata,
        List<IceServer> iceServers
) implements SignalPayload {

    public SessionStartPayload {
        participantIds = participantIds == null ? List.of() : List.copyOf(participantIds);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        iceServers = iceServers == null ? List.of() : List.copyOf(iceServers);
    }

    public SessionStartPayload(List<String> participantIds, SessionKind kind, Map<String, String> metadata) {
        this(participantIds, kind, metadata, List.of());
    }

    public static SessionStartPayload empty() {
        return new SessionStartPayload(List.of(), null, Map.of());
    }
}
