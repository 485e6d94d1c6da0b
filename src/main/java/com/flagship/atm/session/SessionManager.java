package com.flagship.atm.session;

import com.flagship.atm.observability.AtmMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Issues, validates and renews sessions.
 *
 * Sessions live in the injected {@link SessionStore} and are never deleted by callers;
 * expired entries stay inert until {@link #evictExpired()} removes them.
 *
 * Validation and renewal read the clock once and run inside a single atomic update of
 * the store entry. The expiry check and the renewal decision therefore see the same
 * instant and the same stored session: a session that is expired at that instant is
 * never extended.
 */
@Service
@Slf4j
public class SessionManager {

    private final SessionStore sessionStore;
    private final Clock clock;
    private final Duration ttl;
    private final Duration renewalThreshold;
    private final AtmMetrics metrics;

    public SessionManager(SessionStore sessionStore, Clock clock,
                          SessionProperties properties, AtmMetrics metrics) {
        if (properties.getTtl() == null || properties.getTtl().isNegative() || properties.getTtl().isZero()) {
            throw new IllegalArgumentException("Session TTL must be positive");
        }
        if (properties.getRenewalThreshold() == null
                || properties.getRenewalThreshold().compareTo(properties.getTtl()) > 0) {
            throw new IllegalArgumentException("Renewal threshold must not exceed the session TTL");
        }
        this.sessionStore = sessionStore;
        this.clock = clock;
        this.ttl = properties.getTtl();
        this.renewalThreshold = properties.getRenewalThreshold();
        this.metrics = metrics;

        metrics.registerActiveSessionsGauge(this::activeSessions);
    }

    /**
     * Opens a session for an account that has already passed the PIN check.
     *
     * @param accountId resolved account
     * @return the stored session, valid for the configured TTL
     */
    public Session createSession(long accountId) {
        Session session = Session.open(accountId, clock.instant(), ttl);
        sessionStore.save(session);
        metrics.incrementSessionsCreated();

        log.info("Session created: session={}, accountId={}, expiresAt={}",
                session.shortId(), accountId, session.getExpiresAt());
        return session;
    }

    /**
     * Classifies a session identifier.
     *
     * A valid session with less than the renewal threshold left is renewed as part of
     * this call; callers never renew explicitly to keep an active session alive.
     *
     * @param sessionId identifier presented by the caller
     * @return VALID with the current session, EXPIRED, or NOT_FOUND
     */
    public SessionValidation validate(UUID sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("Session id cannot be null");
        }

        AtomicReference<SessionValidation> outcome = new AtomicReference<>(SessionValidation.notFound(sessionId));
        AtomicBoolean renewed = new AtomicBoolean();

        sessionStore.computeIfPresent(sessionId, current -> {
            Instant now = clock.instant();
            if (current.isExpiredAt(now)) {
                outcome.set(SessionValidation.expired(current));
                return current;
            }

            Session checked = current;
            if (current.remainingAt(now).compareTo(renewalThreshold) < 0) {
                checked = current.renewedAt(now, ttl);
                renewed.set(true);
            }
            outcome.set(SessionValidation.valid(checked));
            return checked;
        });

        SessionValidation result = outcome.get();
        metrics.recordSessionValidation(result.getStatus().name());

        if (renewed.get()) {
            metrics.incrementSessionsRenewed();
            log.debug("Session auto-renewed: session={}, expiresAt={}",
                    result.getSession().shortId(), result.getSession().getExpiresAt());
        } else if (result.getStatus() != SessionStatus.VALID) {
            log.debug("Session rejected: sessionId={}, status={}",
                    sessionId.toString().substring(0, 8), result.getStatus());
        }
        return result;
    }

    /**
     * Extends a live session to now + TTL regardless of how much time it has left.
     * Repeating the call only moves the expiry forward; id and account never change.
     * An expired session is reported as EXPIRED and left as it is.
     */
    public SessionValidation renew(UUID sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("Session id cannot be null");
        }

        AtomicReference<SessionValidation> outcome = new AtomicReference<>(SessionValidation.notFound(sessionId));

        sessionStore.computeIfPresent(sessionId, current -> {
            Instant now = clock.instant();
            if (current.isExpiredAt(now)) {
                outcome.set(SessionValidation.expired(current));
                return current;
            }
            Session renewedSession = current.renewedAt(now, ttl);
            outcome.set(SessionValidation.valid(renewedSession));
            return renewedSession;
        });

        SessionValidation result = outcome.get();
        if (result.isValid()) {
            metrics.incrementSessionsRenewed();
            log.info("Session renewed: session={}, expiresAt={}",
                    result.getSession().shortId(), result.getSession().getExpiresAt());
        }
        return result;
    }

    /**
     * Drops sessions whose expiry has passed.
     *
     * @return number of sessions removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = sessionStore.removeIf(session -> session.isExpiredAt(now));
        if (removed > 0) {
            log.info("Evicted {} expired sessions", removed);
        }
        return removed;
    }

    public int activeSessions() {
        return sessionStore.size();
    }
}
