package com.flagship.atm.session;

import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of validating or renewing a session identifier.
 *
 * VALID carries the usable (possibly just renewed) session, EXPIRED carries the
 * stale session for diagnostics, NOT_FOUND carries nothing.
 */
@Value
public class SessionValidation {
    UUID sessionId;
    SessionStatus status;
    Session session;

    public static SessionValidation valid(Session session) {
        return new SessionValidation(session.getId(), SessionStatus.VALID, session);
    }

    public static SessionValidation expired(Session session) {
        return new SessionValidation(session.getId(), SessionStatus.EXPIRED, session);
    }

    public static SessionValidation notFound(UUID sessionId) {
        return new SessionValidation(sessionId, SessionStatus.NOT_FOUND, null);
    }

    public boolean isValid() {
        return status == SessionStatus.VALID;
    }

    /**
     * The session, only when it may be used.
     */
    public Optional<Session> usableSession() {
        return isValid() ? Optional.of(session) : Optional.empty();
    }
}
