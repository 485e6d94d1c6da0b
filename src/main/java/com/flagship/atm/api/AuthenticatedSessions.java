package com.flagship.atm.api;

import com.flagship.atm.api.exception.SessionContextMissingException;
import com.flagship.atm.session.Session;

/**
 * Hand-off of the validated session from {@link SessionAuthenticationFilter} to controllers.
 */
public final class AuthenticatedSessions {

    public static final String ATTRIBUTE = "com.flagship.atm.api.AuthenticatedSessions.session";

    private AuthenticatedSessions() {
        // Utility class
    }

    /**
     * Returns the session the filter attached to the request.
     *
     * @throws SessionContextMissingException if the filter did not run for this route
     */
    public static Session require(Session session, String route) {
        if (session == null) {
            throw new SessionContextMissingException(route);
        }
        return session;
    }
}
