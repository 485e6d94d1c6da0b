package com.flagship.atm.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for sessions and ledger operations.
 *
 * Metrics exposed:
 * - atm.login: Counter of login attempts, tagged by result
 * - atm.session.created: Counter of issued sessions
 * - atm.session.validation: Counter of validations, tagged by outcome
 * - atm.session.renewed: Counter of renewals (explicit and automatic)
 * - atm.session.active: Gauge of sessions held in memory
 * - atm.ledger.transactions: Counter of transactions, tagged by type and status
 * - atm.ledger.latency: Timer for ledger operations
 */
@Component
public class AtmMetrics {

    private final MeterRegistry registry;

    private final Counter sessionsCreated;
    private final Counter sessionsRenewed;

    public AtmMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.sessionsCreated = Counter.builder("atm.session.created")
                .description("Number of sessions issued")
                .register(registry);

        this.sessionsRenewed = Counter.builder("atm.session.renewed")
                .description("Number of session renewals")
                .register(registry);
    }

    // ==================== Session Metrics ====================

    public void recordLogin(String result) {
        registry.counter("atm.login", "result", sanitizeTag(result)).increment();
    }

    public void incrementSessionsCreated() {
        sessionsCreated.increment();
    }

    public void incrementSessionsRenewed() {
        sessionsRenewed.increment();
    }

    /**
     * Records a validation outcome. NOT_FOUND and EXPIRED are kept apart for observability
     * even though the caller treats both as "re-authenticate".
     */
    public void recordSessionValidation(String outcome) {
        registry.counter("atm.session.validation", "outcome", sanitizeTag(outcome)).increment();
    }

    public void registerActiveSessionsGauge(Supplier<Number> supplier) {
        Gauge.builder("atm.session.active", supplier)
                .description("Number of sessions held in memory, expired ones included until swept")
                .strongReference(true)
                .register(registry);
    }

    // ==================== Ledger Metrics ====================

    public void recordTransaction(String type, String status) {
        registry.counter("atm.ledger.transactions",
                "type", sanitizeTag(type),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLedgerLatency(String operation, long durationMs) {
        Timer.builder("atm.ledger.latency")
                .tag("operation", sanitizeTag(operation))
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
