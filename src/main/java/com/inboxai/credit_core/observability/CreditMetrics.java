package com.inboxai.credit_core.observability;

import com.inboxai.credit_core.ledger.LedgerStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Credit ledger and action gate metrics.
 *
 * Metrics exposed:
 * - credits.deducted: credits spent, tagged by action
 * - credits.rejected: deductions refused for insufficient balance
 * - credits.granted / credits.reset: credits added by grants and monthly resets
 * - credits.reset.failures: per-tenant reset failures, retried on the next tick
 * - credits.reset.overdue: balances whose reset is more than the grace period late
 * - ledger.write.conflicts: retried lock or serialization conflicts
 * - actions.executed / actions.latency: gated action outcomes and duration
 * - actions.idempotency: Idempotency-Key lookups, tagged hit or miss
 */
@Component
@Slf4j
public class CreditMetrics {

    private final MeterRegistry registry;
    private final LedgerStore ledgerStore;
    private final Clock clock;
    private final Duration overdueGrace;

    private final Counter resetFailures;
    private final Counter writeConflicts;
    private final AtomicLong overdueResets = new AtomicLong(0);

    public CreditMetrics(MeterRegistry registry,
                         LedgerStore ledgerStore,
                         Clock clock,
                         @Value("${credits.reset.overdue-grace:PT24H}") Duration overdueGrace) {
        this.registry = registry;
        this.ledgerStore = ledgerStore;
        this.clock = clock;
        this.overdueGrace = overdueGrace;

        this.resetFailures = Counter.builder("credits.reset.failures")
            .description("Monthly resets that failed and will be retried")
            .register(registry);

        this.writeConflicts = Counter.builder("ledger.write.conflicts")
            .description("Ledger writes retried after a lock or serialization conflict")
            .register(registry);

        Gauge.builder("credits.reset.overdue", overdueResets, AtomicLong::get)
            .description("Balances whose monthly reset is overdue")
            .register(registry);
    }

    public void recordDeducted(String actionType, int credits) {
        DistributionSummary.builder("credits.deducted")
            .tag("action", actionType)
            .baseUnit("credits")
            .register(registry)
            .record(credits);
    }

    public void recordRejected(String actionType) {
        registry.counter("credits.rejected", "action", actionType).increment();
    }

    public void recordGranted(int credits) {
        registry.summary("credits.granted").record(credits);
    }

    public void recordReset(String tier) {
        registry.counter("credits.reset", "tier", tier).increment();
    }

    public void recordResetFailure() {
        resetFailures.increment();
    }

    public void recordWriteConflict() {
        writeConflicts.increment();
    }

    public void recordActionExecuted(String actionType, String status, Duration duration) {
        registry.counter("actions.executed", "action", actionType, "status", status).increment();
        Timer.builder("actions.latency")
            .tag("action", actionType)
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)
            .record(duration);
    }

    public void recordIdempotencyLookup(boolean hit) {
        registry.counter("actions.idempotency", "result", hit ? "hit" : "miss").increment();
    }

    public void refreshOverdueResets() {
        try {
            overdueResets.set(ledgerStore.countResetsOverdueSince(clock.instant().minus(overdueGrace)));
        } catch (Exception e) {
            log.warn("Failed to refresh overdue reset gauge: {}", e.getMessage());
        }
    }

    public long overdueResets() {
        return overdueResets.get();
    }
}
