package com.flagship.flight_surety.observability;

import com.flagship.flight_surety.common.SuretyError;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for registry operations.
 *
 * Metrics exposed:
 * - surety.airline.admitted: admissions, tagged by path (direct / consensus)
 * - surety.airline.votes: votes cast
 * - surety.airline.funded: membership funds paid
 * - surety.flight.registered: flights registered
 * - surety.insurance.purchased / surety.insurance.premium: purchases and premium volume
 * - surety.payout: payouts by outcome (credited / underfunded), surety.payout.amount
 * - surety.withdrawal: withdrawals and withdrawn volume
 * - surety.oracle.*: registrations, requests, reports and resolutions by status
 * - surety.rejected: rejected calls by operation and error code
 * - surety.operation.latency: latency per operation
 */
@Component
public class SuretyMetrics {

    private final MeterRegistry registry;

    public SuretyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ==================== Airline Admission ====================

    public void recordAirlineAdmitted(String path) {
        registry.counter("surety.airline.admitted", "path", sanitizeTag(path)).increment();
    }

    public void recordVote() {
        registry.counter("surety.airline.votes").increment();
    }

    public void recordAirlineFunded() {
        registry.counter("surety.airline.funded").increment();
    }

    public void recordFlightRegistered() {
        registry.counter("surety.flight.registered").increment();
    }

    // ==================== Insurance ====================

    public void recordInsurancePurchased(long premium) {
        registry.counter("surety.insurance.purchased").increment();
        registry.counter("surety.insurance.premium").increment(premium);
    }

    /**
     * Records a payout attempt with its outcome tag.
     */
    public void recordPayout(String outcome, long amount) {
        registry.counter("surety.payout", "outcome", sanitizeTag(outcome)).increment();
        if (amount > 0) {
            registry.counter("surety.payout.amount").increment(amount);
        }
    }

    public void recordWithdrawal(long amount) {
        registry.counter("surety.withdrawal").increment();
        registry.counter("surety.withdrawal.amount").increment(amount);
    }

    // ==================== Oracles ====================

    public void recordOracleRegistered() {
        registry.counter("surety.oracle.registered").increment();
    }

    public void recordStatusRequested() {
        registry.counter("surety.oracle.requests").increment();
    }

    public void recordOracleReport(String status) {
        registry.counter("surety.oracle.reports", "status", sanitizeTag(status)).increment();
    }

    public void recordStatusResolved(String status) {
        registry.counter("surety.oracle.resolved", "status", sanitizeTag(status)).increment();
    }

    // ==================== Calls ====================

    public void recordRejection(String operation, SuretyError error) {
        registry.counter("surety.rejected",
                "operation", sanitizeTag(operation),
                "code", error.name()
        ).increment();
    }

    public void recordOperationLatency(String operation, Duration duration) {
        Timer.builder("surety.operation.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
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
