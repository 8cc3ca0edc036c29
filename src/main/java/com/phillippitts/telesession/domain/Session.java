package com.phillippitts.telesession.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a session as held by the session registry.
 *
 * @param id             opaque unique session token
 * @param participantIds at most two participant identifiers, in join order
 * @param kind           peer call or AI call
 * @param state          lifecycle state at the time of the snapshot
 * @param createdAt      when the session was created
 * @param endedAt        when the session ended, or {@code null} while it is live
 * @param metadata       opaque key/value pairs supplied at creation
 */
public record Session(
        String id,
        Set<String> participantIds,
        SessionKind kind,
        SessionState state,
        Instant createdAt,
        Instant endedAt,
        Map<String, String> metadata
) {

    public static final int MAX_PARTICIPANTS = 2;

    public Session {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        participantIds = participantIds == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(participantIds));
        if (participantIds.size() > MAX_PARTICIPANTS) {
            throw new IllegalArgumentException(
                    "A session holds at most " + MAX_PARTICIPANTS + " participants, got: " + participantIds.size());
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean hasParticipant(String participantId) {
        return participantIds.contains(participantId);
    }
}
