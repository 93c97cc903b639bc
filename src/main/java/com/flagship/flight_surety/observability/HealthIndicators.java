package com.flagship.flight_surety.observability;

import com.flagship.flight_surety.access.AccessControl;
import com.flagship.flight_surety.outbox.OutboxService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the registry.
 */
public class HealthIndicators {

    /**
     * Out of service while the owner has the circuit breaker engaged.
     */
    @Component("operationalHealth")
    public static class OperationalHealthIndicator implements HealthIndicator {

        private final AccessControl accessControl;

        public OperationalHealthIndicator(AccessControl accessControl) {
            this.accessControl = accessControl;
        }

        @Override
        public Health health() {
            boolean operational = accessControl.isOperational();
            return (operational ? Health.up() : Health.outOfService())
                    .withDetail("operational", operational)
                    .build();
        }
    }

    /**
     * Unhealthy if too many notifications are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxService outboxService;

        public OutboxHealthIndicator(OutboxService outboxService) {
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            long backlogSize = outboxService.countUnpublished();

            Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }
}
