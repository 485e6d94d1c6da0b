package com.flagship.atm.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.atm.api.exception.ErrorResponse;
import com.flagship.atm.observability.CorrelationContext;
import com.flagship.atm.session.Session;
import com.flagship.atm.session.SessionManager;
import com.flagship.atm.session.SessionValidation;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;

/**
 * Validates the session token on every authenticated route.
 *
 * The token is the session UUID in the Authorization header, either raw or as
 * "Bearer &lt;uuid&gt;". Validation may renew the session as a side effect
 * (see {@link SessionManager#validate}). A usable session is attached to the
 * request under {@link AuthenticatedSessions#ATTRIBUTE}; anything else is
 * rejected here and never reaches a controller.
 *
 * Order: runs after {@code CorrelationIdFilter}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
@Slf4j
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String API_PREFIX = "/api/";
    private static final String LOGIN_PATH = "/api/login";

    private final SessionManager sessionManager;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String authHeader = request.getHeader(AUTHORIZATION_HEADER);
        if (authHeader == null || authHeader.isBlank()) {
            log.warn("Missing auth header: path={}", request.getRequestURI());
            reject(response, HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized");
            return;
        }

        UUID sessionId;
        try {
            sessionId = parseToken(authHeader);
        } catch (IllegalArgumentException e) {
            log.warn("Authorization is not a session id: path={}", request.getRequestURI());
            reject(response, HttpStatus.BAD_REQUEST, "Invalid Authorization", "invalid authorization");
            return;
        }

        SessionValidation validation = sessionManager.validate(sessionId);
        switch (validation.getStatus()) {
            case NOT_FOUND -> {
                log.warn("Session not in store: path={}", request.getRequestURI());
                reject(response, HttpStatus.UNAUTHORIZED, "Unauthorized", "invalid authorization");
            }
            case EXPIRED -> {
                log.warn("Session expired: session={}, expiredAt={}",
                        validation.getSession().shortId(), validation.getSession().getExpiresAt());
                reject(response, HttpStatus.UNAUTHORIZED, "Unauthorized", "session expired");
            }
            case VALID -> {
                Session session = validation.getSession();
                request.setAttribute(AuthenticatedSessions.ATTRIBUTE, session);
                MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(session.getAccountId()));
                MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, session.shortId());
                filterChain.doFilter(request, response);
            }
        }
    }

    private UUID parseToken(String authHeader) {
        String token = authHeader.trim();
        if (token.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            token = token.substring(BEARER_PREFIX.length()).trim();
        }
        // UUID.fromString accepts shortened groups such as "1-1-1-1-1"
        if (token.length() != 36) {
            throw new IllegalArgumentException("Not a session id");
        }
        return UUID.fromString(token);
    }

    private void reject(HttpServletResponse response, HttpStatus status,
                        String error, String message) throws IOException {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !path.startsWith(API_PREFIX) || path.equals(LOGIN_PATH);
    }
}
