package com.flagship.atm.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.atm.session.Session;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Response DTO for login and session queries.
 */
@Value
@Builder
public class SessionResponse {

    @JsonProperty("session_id")
    String sessionId;

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("expires_at")
    Instant expiresAt;

    public static SessionResponse from(Session session) {
        return SessionResponse.builder()
            .sessionId(session.getId().toString())
            .accountId(session.getAccountId())
            .expiresAt(session.getExpiresAt())
            .build();
    }
}
