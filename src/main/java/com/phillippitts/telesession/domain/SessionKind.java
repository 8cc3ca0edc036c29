package com.phillippitts.telesession.domain;

import java.util.Locale;

/**
 * Kind of call a session carries. A peer call needs WebRTC negotiation between two people;
 * an AI call streams telemetry to the analysis collaborator without a remote peer.
 */
public enum SessionKind {
    PEER_CALL("peer-call"),
    AI_CALL("ai-call");

    private final String wireName;

    SessionKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses the wire form ({@code peer-call}) or the enum name ({@code PEER_CALL}).
     *
     * @throws IllegalArgumentException if the value matches neither
     */
    public static SessionKind fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (SessionKind kind : values()) {
                if (kind.wireName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown session kind: " + value);
    }
}
