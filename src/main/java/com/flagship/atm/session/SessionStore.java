package com.flagship.atm.session;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Concurrent key-value storage for sessions.
 *
 * Implementations must be safe for concurrent use without external locking and
 * must apply {@link #computeIfPresent} atomically per key.
 */
public interface SessionStore {

    /**
     * Inserts a new session.
     *
     * @throws IllegalStateException if a session with the same id is already stored
     */
    void save(Session session);

    Optional<Session> findById(UUID sessionId);

    /**
     * Atomically replaces the stored session with the result of the remapping function.
     * The function runs at most once and must not touch the store itself.
     *
     * @return the session stored after the call, empty if none was present
     */
    Optional<Session> computeIfPresent(UUID sessionId, UnaryOperator<Session> remapping);

    /**
     * Removes every session matching the predicate.
     *
     * @return number of sessions removed
     */
    int removeIf(Predicate<Session> predicate);

    int size();
}
