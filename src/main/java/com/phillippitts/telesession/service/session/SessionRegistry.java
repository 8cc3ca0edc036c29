package com.phillippitts.telesession.service.session;

import com.phillippitts.telesession.domain.Session;
import com.phillippitts.telesession.domain.SessionKind;
import com.phillippitts.telesession.domain.SessionState;
import com.phillippitts.telesession.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Authoritative in-memory store of sessions.
 *
 * <p>There is no registry-wide lock: the map is a {@link ConcurrentHashMap} and each
 * {@link SessionEntry} carries its own {@link java.util.concurrent.locks.ReentrantLock}.
 * Work on one session runs in receipt order under that lock while other sessions proceed
 * in parallel.
 *
 * @since 1.0
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<String, SessionEntry> sessions = new ConcurrentHashMap<>();

    /**
     * Creates and stores a new entry in state {@link SessionState#CREATED}.
     */
    SessionEntry create(SessionKind kind, List<String> participantIds, Map<String, String> metadata,
                        Instant createdAt) {
        while (true) {
            String id = UUID.randomUUID().toString();
            SessionEntry entry = new SessionEntry(id, kind, participantIds, metadata, createdAt);
            if (sessions.putIfAbsent(id, entry) == null) {
                LOG.debug("Registered session {} ({})", id, kind.wireName());
                return entry;
            }
        }
    }

    /**
     * Runs {@code action} while holding the session's lock.
     *
     * @throws SessionNotFoundException if the id is unknown or already evicted
     */
    public <T> T withSession(String sessionId, Function<SessionEntry, T> action) {
        SessionEntry entry = sessionId == null ? null : sessions.get(sessionId);
        if (entry == null) {
            throw new SessionNotFoundException(sessionId);
        }
        entry.lock.lock();
        try {
            // evicted while we waited for the lock
            if (sessions.get(sessionId) != entry) {
                throw new SessionNotFoundException(sessionId);
            }
            return action.apply(entry);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Returns a consistent snapshot of the session, if it is still registered.
     */
    public Optional<Session> find(String sessionId) {
        if (sessionId == null || !sessions.containsKey(sessionId)) {
            return Optional.empty();
        }
        try {
            return Optional.of(withSession(sessionId, SessionEntry::snapshot));
        } catch (SessionNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Snapshots of every registered session, ended ones included until they are evicted.
     */
    public List<Session> snapshots() {
        List<Session> result = new ArrayList<>(sessions.size());
        for (String id : sessions.keySet()) {
            find(id).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Number of registered sessions per state.
     */
    public Map<SessionState, Integer> countByState() {
        Map<SessionState, Integer> counts = new EnumMap<>(SessionState.class);
        for (Session session : snapshots()) {
            counts.merge(session.state(), 1, Integer::sum);
        }
        return counts;
    }

    public int size() {
        return sessions.size();
    }

    Collection<String> ids() {
        return new ArrayList<>(sessions.keySet());
    }

    /**
     * Removes an entry. Caller must hold the entry's lock.
     */
    void evict(SessionEntry entry) {
        if (sessions.remove(entry.getId(), entry)) {
            LOG.debug("Evicted session {}", entry.getId());
        }
    }
}
