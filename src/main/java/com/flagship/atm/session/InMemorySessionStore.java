package com.flagship.atm.session;

import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Process-local session storage backed by a {@link ConcurrentHashMap}.
 *
 * Updates lock a single bin of the map, so validations of different sessions
 * proceed in parallel while two validations of the same session are serialized.
 * Contents are lost on restart.
 */
@Repository
public class InMemorySessionStore implements SessionStore {

    private final Map<UUID, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(Session session) {
        Session previous = sessions.putIfAbsent(session.getId(), session);
        if (previous != null) {
            throw new IllegalStateException("Session id collision: " + session.shortId());
        }
    }

    @Override
    public Optional<Session> findById(UUID sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<Session> computeIfPresent(UUID sessionId, UnaryOperator<Session> remapping) {
        return Optional.ofNullable(sessions.computeIfPresent(sessionId, (id, current) -> remapping.apply(current)));
    }

    @Override
    public int removeIf(Predicate<Session> predicate) {
        AtomicInteger removed = new AtomicInteger();
        sessions.entrySet().removeIf(entry -> {
            boolean matches = predicate.test(entry.getValue());
            if (matches) {
                removed.incrementAndGet();
            }
            return matches;
        });
        return removed.get();
    }

    @Override
    public int size() {
        return sessions.size();
    }
}
