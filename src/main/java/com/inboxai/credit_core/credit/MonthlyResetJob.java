package com.inboxai.credit_core.credit;

import com.inboxai.credit_core.config.CreditProperties;
import com.inboxai.credit_core.ledger.CreditBalance;
import com.inboxai.credit_core.ledger.LedgerStore;
import com.inboxai.credit_core.observability.CorrelationContext;
import com.inboxai.credit_core.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Resets every balance whose credits_reset_at has passed.
 *
 * Runs hourly rather than only on the 1st: a reset that fails (or a tick that never ran) is
 * picked up again by the next tick. Due balances are read in keyset pages, so rows that keep failing
 * never hide the ones behind them. A balance several months behind is advanced one month per scan
 * until its reset date is in the future.
 */
@Component
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MonthlyResetJob {

    private static final int MAX_PASSES_PER_TICK = 50;

    private final LedgerStore ledgerStore;
    private final CreditAuthority creditAuthority;
    private final CreditMetrics creditMetrics;
    private final CreditProperties creditProperties;
    private final Clock clock;

    @Scheduled(cron = "${scheduler.reset.cron:0 0 * * * *}", zone = "UTC")
    public void resetDueBalances() {
        try (MDC.MDCCloseable ignored = CorrelationContext.openJobScope("reset")) {
            ResetSummary summary = runTick(clock.instant());
            if (summary.getExamined() > 0) {
                log.info("Monthly reset tick: examined={}, reset={}, skipped={}, failed={}",
                    summary.getExamined(), summary.getReset(), summary.getSkipped(), summary.getFailed());
            }
        } catch (Exception e) {
            log.error("Monthly reset tick failed, will retry next tick", e);
        }
    }

    public ResetSummary runTick(Instant now) {
        int batchSize = creditProperties.getReset().getBatchSize();
        ResetSummary total = ResetSummary.empty();
        Instant afterResetAt = null;
        UUID afterId = null;
        int resetThisScan = 0;

        for (int pass = 0; pass < MAX_PASSES_PER_TICK; pass++) {
            List<CreditBalance> due = ledgerStore.findBalancesDueForReset(now, afterResetAt, afterId, batchSize);
            ResetSummary batch = resetBatch(due);
            total = total.plus(batch);
            resetThisScan += batch.getReset();

            if (due.size() == batchSize) {
                // Page past this batch, failed rows included
                CreditBalance last = due.get(due.size() - 1);
                afterResetAt = last.getCreditsResetAt();
                afterId = last.getId();
                continue;
            }

            // End of scan. Rows advanced by one month may still be due, so rescan from the start.
            if (resetThisScan == 0) {
                break;
            }
            afterResetAt = null;
            afterId = null;
            resetThisScan = 0;
        }
        return total;
    }

    private ResetSummary resetBatch(List<CreditBalance> due) {
        int reset = 0;
        int skipped = 0;
        int failed = 0;

        for (CreditBalance balance : due) {
            CorrelationContext.putTenant(balance.getUserId(), balance.getOrgId());
            try {
                if (creditAuthority.resetIfUnchanged(balance, balance.getSubscriptionTier()).isPresent()) {
                    reset++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                failed++;
                creditMetrics.recordResetFailure();
                log.error("Monthly reset failed for balance {}, will retry next tick: {}", balance.getId(), e.getMessage(), e);
            } finally {
                CorrelationContext.clearTenant();
            }
        }
        return new ResetSummary(due.size(), reset, skipped, failed);
    }
}
