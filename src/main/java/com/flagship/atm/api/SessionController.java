package com.flagship.atm.api;

import com.flagship.atm.api.dto.SessionResponse;
import com.flagship.atm.api.exception.SessionRejectedException;
import com.flagship.atm.session.Session;
import com.flagship.atm.session.SessionManager;
import com.flagship.atm.session.SessionValidation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session introspection and explicit renewal.
 * Renewal is optional for clients: every authenticated call already renews a session close to expiry.
 */
@RestController
@RequestMapping("/api/session")
@RequiredArgsConstructor
public class SessionController {

    private final SessionManager sessionManager;

    @GetMapping
    public ResponseEntity<SessionResponse> currentSession(
            @RequestAttribute(name = AuthenticatedSessions.ATTRIBUTE, required = false) Session session) {
        Session current = AuthenticatedSessions.require(session, "/api/session");
        return ResponseEntity.ok(SessionResponse.from(current));
    }

    @PostMapping("/renew")
    public ResponseEntity<SessionResponse> renew(
            @RequestAttribute(name = AuthenticatedSessions.ATTRIBUTE, required = false) Session session) {
        Session current = AuthenticatedSessions.require(session, "/api/session/renew");

        SessionValidation renewed = sessionManager.renew(current.getId());
        Session usable = renewed.usableSession()
            .orElseThrow(() -> new SessionRejectedException(renewed.getStatus()));
        return ResponseEntity.ok(SessionResponse.from(usable));
    }
}
