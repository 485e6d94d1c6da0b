package com.flagship.atm.session;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired sessions so the in-memory store does not grow
 * with every login. Expired sessions are already unusable; this only reclaims memory.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "atm.session.sweeper.enabled", havingValue = "true", matchIfMissing = true)
public class SessionSweeper {

    private final SessionManager sessionManager;

    @Scheduled(fixedDelayString = "${atm.session.sweep-interval:PT1M}")
    public void sweep() {
        sessionManager.evictExpired();
    }
}
