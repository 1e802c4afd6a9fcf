package com.inboxai.credit_core.observability;

import com.inboxai.credit_core.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Readiness checks beyond the ones Spring Boot ships for the datasource, Redis and Kafka.
 */
public class HealthIndicators {

    /**
     * DOWN once the outbox backlog passes the critical threshold.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1_000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10_000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

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
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * WARNING while any balance is past its reset time by more than the grace period.
     * Reads the gauge cached by {@link CreditMetrics}.
     */
    @Component("creditResetHealth")
    public static class CreditResetHealthIndicator implements HealthIndicator {

        private final CreditMetrics creditMetrics;

        public CreditResetHealthIndicator(CreditMetrics creditMetrics) {
            this.creditMetrics = creditMetrics;
        }

        @Override
        public Health health() {
            long overdue = creditMetrics.overdueResets();
            return (overdue == 0 ? Health.up() : Health.status("WARNING"))
                .withDetail("overdueResets", overdue)
                .build();
        }
    }
}
