package com.phillippitts.telesession.service.session;

import com.phillippitts.telesession.domain.EndReason;
import com.phillippitts.telesession.domain.Session;
import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.domain.SessionState;
import com.phillippitts.telesession.domain.SessionSummary;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable registry record of one session, guarded by its own lock.
 *
 * <p>Every read and write happens while {@link #lock} is held, which
 * {@link SessionRegistry#withSession} takes care of. State changes go through
 * {@link SessionStateMachine}; nothing else calls the package-private mutators.
 */
public final class SessionEntry {

    final ReentrantLock lock = new ReentrantLock();

    private final String id;
    private final SessionKind kind;
    private final Instant createdAt;
    private final Map<String, String> metadata;
    private final Set<String> participantIds = new LinkedHashSet<>();
    private final Set<String> droppedParticipants = new LinkedHashSet<>();

    private SessionState state = SessionState.CREATED;
    private String offererId;
    private Instant reconnectDeadline;
    private Instant endedAt;
    private EndReason endReason;
    private SessionSummary summary;

    SessionEntry(String id, SessionKind kind, List<String> participantIds, Map<String, String> metadata,
                 Instant createdAt) {
        this.id = id;
        this.kind = kind;
        this.createdAt = createdAt;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        this.participantIds.addAll(participantIds);
    }

    public String getId() {
        return id;
    }

    public SessionKind getKind() {
        return kind;
    }

    public SessionState getState() {
        return state;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Set<String> getParticipantIds() {
        return Collections.unmodifiableSet(participantIds);
    }

    public boolean hasParticipant(String participantId) {
        return participantIds.contains(participantId);
    }

    /**
     * Returns the other participant of a two-party session, or {@code null} if none has joined.
     */
    public String peerOf(String participantId) {
        for (String candidate : participantIds) {
            if (!candidate.equals(participantId)) {
                return candidate;
            }
        }
        return null;
    }

    public String getOffererId() {
        return offererId;
    }

    public Set<String> getDroppedParticipants() {
        return Collections.unmodifiableSet(droppedParticipants);
    }

    public Instant getReconnectDeadline() {
        return reconnectDeadline;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public EndReason getEndReason() {
        return endReason;
    }

    public SessionSummary getSummary() {
        return summary;
    }

    public Session snapshot() {
        return new Session(id, participantIds, kind, state, createdAt, endedAt, metadata);
    }

    void addParticipant(String participantId) {
        participantIds.add(participantId);
    }

    void setState(SessionState state) {
        this.state = state;
    }

    void setOffererId(String offererId) {
        this.offererId = offererId;
    }

    void markDropped(String participantId, Instant deadline) {
        droppedParticipants.add(participantId);
        if (reconnectDeadline == null) {
            reconnectDeadline = deadline;
        }
    }

    boolean markResumed(String participantId) {
        boolean removed = droppedParticipants.remove(participantId);
        if (droppedParticipants.isEmpty()) {
            reconnectDeadline = null;
        }
        return removed;
    }

    void markEnded(Instant at, EndReason reason) {
        this.endedAt = at;
        this.endReason = reason;
        this.droppedParticipants.clear();
        this.reconnectDeadline = null;
    }

    void setSummary(SessionSummary summary) {
        this.summary = summary;
    }
}
