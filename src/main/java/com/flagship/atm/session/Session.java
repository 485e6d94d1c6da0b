package com.flagship.atm.session;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A time-bounded proof of a successful PIN check.
 *
 * Instances are immutable. Renewal produces a replacement with the same id,
 * account and creation time and a later expiry; the store swaps it in atomically.
 */
@Value
public class Session {
    UUID id;
    long accountId;
    Instant createdAt;
    Instant expiresAt;

    /**
     * Opens a new session for the account with a fresh random identifier.
     */
    public static Session open(long accountId, Instant now, Duration ttl) {
        return new Session(UUID.randomUUID(), accountId, now, now.plus(ttl));
    }

    /**
     * A session is usable strictly before its expiry instant.
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Duration remainingAt(Instant now) {
        return Duration.between(now, expiresAt);
    }

    public Session renewedAt(Instant now, Duration ttl) {
        return new Session(id, accountId, createdAt, now.plus(ttl));
    }

    /**
     * Shortened identifier for log lines. The full id is a bearer credential.
     */
    public String shortId() {
        return id.toString().substring(0, 8);
    }
}
