package com.flagship.atm.api;

import com.flagship.atm.api.dto.SessionResponse;
import com.flagship.atm.api.exception.AuthenticationFailedException;
import com.flagship.atm.ledger.AccountService;
import com.flagship.atm.observability.AtmMetrics;
import com.flagship.atm.session.Session;
import com.flagship.atm.session.SessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * PIN login. The only API route that does not require a session.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    static final String PIN_HEADER = "nip";
    static final String SESSION_ID_HEADER = "SessionID";

    private final AccountService accountService;
    private final SessionManager sessionManager;
    private final AtmMetrics metrics;

    /**
     * Resolves the PIN to an account and opens a session for it.
     *
     * @param pin PIN from the {@code nip} header
     * @return the session id in the SessionID header and in the body
     */
    @PostMapping("/login")
    public ResponseEntity<SessionResponse> login(@RequestHeader(PIN_HEADER) String pin) {
        long accountId = accountService.resolveAccount(pin)
            .orElseThrow(() -> {
                metrics.recordLogin("rejected");
                return new AuthenticationFailedException("invalid nip");
            });

        Session session = sessionManager.createSession(accountId);
        metrics.recordLogin("success");

        return ResponseEntity.ok()
            .header(SESSION_ID_HEADER, session.getId().toString())
            .body(SessionResponse.from(session));
    }
}
