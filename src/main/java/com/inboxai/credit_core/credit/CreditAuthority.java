package com.inboxai.credit_core.credit;

import com.inboxai.credit_core.credit.event.CreditEvent;
import com.inboxai.credit_core.credit.event.CreditsDeductedEvent;
import com.inboxai.credit_core.credit.event.CreditsGrantedEvent;
import com.inboxai.credit_core.credit.event.CreditsResetEvent;
import com.inboxai.credit_core.credit.event.TierChangedEvent;
import com.inboxai.credit_core.ledger.CreditBalance;
import com.inboxai.credit_core.ledger.CreditTransaction;
import com.inboxai.credit_core.ledger.LedgerMutation;
import com.inboxai.credit_core.ledger.LedgerReconciliation;
import com.inboxai.credit_core.ledger.LedgerStore;
import com.inboxai.credit_core.ledger.SubscriptionTier;
import com.inboxai.credit_core.observability.CreditMetrics;
import com.inboxai.credit_core.outbox.AggregateType;
import com.inboxai.credit_core.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Single entry point for credit mutations.
 *
 * Every write is one {@link LedgerStore#applyDelta(LedgerMutation)} call plus its outbox event,
 * committed together. Lock and serialization conflicts are retried here and never reach callers
 * unless every attempt fails.
 *
 * Reset dates are computed in UTC: a new balance first resets at the start of next month, and
 * each reset moves the date forward by exactly one calendar month.
 */
@Service
@Slf4j
public class CreditAuthority {

    private static final int MAX_TRANSACTION_PAGE = 500;

    private final LedgerStore ledgerStore;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate ledgerRetryTemplate;
    private final OutboxService outboxService;
    private final CreditMetrics creditMetrics;
    private final Clock clock;

    public CreditAuthority(LedgerStore ledgerStore,
                           TransactionTemplate transactionTemplate,
                           RetryTemplate ledgerRetryTemplate,
                           OutboxService outboxService,
                           CreditMetrics creditMetrics,
                           Clock clock) {
        this.ledgerStore = ledgerStore;
        this.transactionTemplate = transactionTemplate;
        this.ledgerRetryTemplate = ledgerRetryTemplate;
        this.outboxService = outboxService;
        this.creditMetrics = creditMetrics;
        this.clock = clock;
    }

    /**
     * Deducts {@code cost} if and only if the tenant can afford it.
     * A refusal writes nothing, not even a transaction row.
     */
    public CreditDeduction tryDeduct(UUID userId, UUID orgId, int cost, String actionType,
                                     String description, Map<String, Object> metadata) {
        LedgerMutation mutation = LedgerMutation.spend(userId, orgId, cost, actionType, description, metadata);

        Optional<CreditBalance> result = write(mutation,
            balance -> CreditsDeductedEvent.of(balance, actionType, cost, clock.instant()));

        if (result.isPresent()) {
            creditMetrics.recordDeducted(actionType, cost);
            log.debug("Deducted {} credits for {}: available={}", cost, actionType, result.get().getAvailableCredits());
            return CreditDeduction.approved(result.get(), cost);
        }

        int available = ledgerStore.findBalance(userId, orgId)
            .map(CreditBalance::getAvailableCredits)
            .orElse(0);
        creditMetrics.recordRejected(actionType);
        log.info("Insufficient credits for {}: required={}, available={}", actionType, cost, available);
        return CreditDeduction.insufficient(cost, available);
    }

    /**
     * Adds credits. Creates a free-tier balance if the tenant has none.
     */
    public CreditBalance grant(UUID userId, UUID orgId, int amount, String description) {
        LedgerMutation mutation = LedgerMutation.grant(userId, orgId, amount, description,
            SubscriptionTier.FREE, startOfNextMonth(clock.instant()));

        CreditBalance balance = write(mutation,
            granted -> CreditsGrantedEvent.of(granted, amount, description, clock.instant()))
            .orElseThrow(() -> new IllegalStateException("Grant returned no balance"));

        creditMetrics.recordGranted(amount);
        log.info("Granted {} credits: available={}", amount, balance.getAvailableCredits());
        return balance;
    }

    /**
     * Creates the balance for a new membership with the tier's monthly allotment.
     * Returns the existing balance untouched if there already is one.
     */
    public CreditBalance onboard(UUID userId, UUID orgId, SubscriptionTier tier) {
        LedgerMutation mutation = LedgerMutation.opening(userId, orgId, tier, startOfNextMonth(clock.instant()));

        Optional<CreditBalance> created = write(mutation,
            balance -> CreditsGrantedEvent.of(balance, tier.monthlyCredits(), mutation.getDescription(), clock.instant()));

        if (created.isPresent()) {
            creditMetrics.recordGranted(tier.monthlyCredits());
            log.info("Onboarded tenant on {} tier with {} credits", tier.code(), tier.monthlyCredits());
            return created.get();
        }

        log.debug("Onboarding skipped, balance already exists");
        return requireBalance(userId, orgId);
    }

    /**
     * Overwrites the balance with the tier's allotment and moves the reset date one month on.
     * Unused credits do not roll over.
     *
     * @param tier the tier to reset to, or null to keep the balance's current tier
     */
    public CreditBalance resetMonthly(UUID userId, UUID orgId, SubscriptionTier tier) {
        CreditBalance current = requireBalance(userId, orgId);
        return resetIfUnchanged(current, tier != null ? tier : current.getSubscriptionTier())
            .orElseGet(() -> requireBalance(userId, orgId));
    }

    /**
     * Resets a balance read earlier, as long as nobody reset it in between.
     *
     * @return the reset balance, or empty if another reset got there first
     */
    public Optional<CreditBalance> resetIfUnchanged(CreditBalance snapshot, SubscriptionTier tier) {
        Instant nextResetAt = nextResetAfter(snapshot.getCreditsResetAt());
        LedgerMutation mutation = LedgerMutation.reset(snapshot.getUserId(), snapshot.getOrgId(), tier,
            snapshot.getCreditsResetAt(), nextResetAt);

        Optional<CreditBalance> reset = write(mutation, balance -> CreditsResetEvent.of(balance, clock.instant()));

        reset.ifPresent(balance -> {
            creditMetrics.recordReset(tier.code());
            log.info("Monthly reset applied: tier={}, available={}, nextResetAt={}",
                tier.code(), balance.getAvailableCredits(), balance.getCreditsResetAt());
        });
        return reset;
    }

    /**
     * Sets the subscription tier, onboarding the tenant if needed. An existing balance keeps
     * its credits until the next monthly reset applies the new allotment.
     */
    public CreditBalance assignTier(UUID userId, UUID orgId, SubscriptionTier tier) {
        Optional<CreditBalance> existing = ledgerStore.findBalance(userId, orgId);
        if (existing.isEmpty()) {
            return onboard(userId, orgId, tier);
        }
        if (existing.get().getSubscriptionTier() == tier) {
            return existing.get();
        }

        String previousTier = existing.get().getSubscriptionTier().code();
        CreditBalance updated = transactionTemplate.execute(status -> {
            CreditBalance balance = ledgerStore.updateTier(userId, orgId, tier)
                .orElseThrow(() -> new IllegalStateException("Balance disappeared during tier change"));
            TierChangedEvent event = TierChangedEvent.of(balance, previousTier, clock.instant());
            outboxService.saveEvent(AggregateType.CREDIT_BALANCE, balance.getId(), event.getEventType(), event);
            return balance;
        });

        log.info("Tier changed: {} -> {}", previousTier, tier.code());
        return updated;
    }

    public Optional<CreditBalance> getBalance(UUID userId, UUID orgId) {
        return ledgerStore.findBalance(userId, orgId);
    }

    /** Same as {@link #getBalance} but row-locked; must run inside the caller's transaction. */
    public Optional<CreditBalance> lockBalance(UUID userId, UUID orgId) {
        return ledgerStore.lockBalance(userId, orgId);
    }

    public List<CreditTransaction> getTransactions(UUID userId, UUID orgId, int limit) {
        return ledgerStore.findTransactions(userId, orgId, Math.max(1, Math.min(limit, MAX_TRANSACTION_PAGE)));
    }

    public Optional<LedgerReconciliation> reconcile(UUID userId, UUID orgId) {
        Optional<LedgerReconciliation> reconciliation = ledgerStore.reconcile(userId, orgId);
        reconciliation
            .filter(r -> !r.isBalanced())
            .ifPresent(r -> log.error("Ledger out of balance: available={}, expected={}, transactions={}",
                r.getAvailableCredits(), r.expectedAvailableCredits(), r.getTransactionCount()));
        return reconciliation;
    }

    static Instant startOfNextMonth(Instant now) {
        LocalDate firstOfNextMonth = now.atZone(ZoneOffset.UTC).toLocalDate()
            .with(TemporalAdjusters.firstDayOfNextMonth());
        return firstOfNextMonth.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    Instant nextResetAfter(Instant currentResetAt) {
        if (currentResetAt == null) {
            return startOfNextMonth(clock.instant());
        }
        return ZonedDateTime.ofInstant(currentResetAt, ZoneOffset.UTC).plusMonths(1).toInstant();
    }

    private CreditBalance requireBalance(UUID userId, UUID orgId) {
        return ledgerStore.findBalance(userId, orgId)
            .orElseThrow(() -> new IllegalArgumentException(
                "No credit balance for user " + userId + " in org " + orgId));
    }

    private Optional<CreditBalance> write(LedgerMutation mutation, Function<CreditBalance, CreditEvent> eventFactory) {
        return ledgerRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                creditMetrics.recordWriteConflict();
                log.warn("Retrying ledger write after conflict (attempt {}): {}",
                    context.getRetryCount() + 1, context.getLastThrowable().getMessage());
            }
            return transactionTemplate.execute(status -> {
                Optional<CreditBalance> balance = ledgerStore.applyDelta(mutation);
                balance.ifPresent(b -> {
                    CreditEvent event = eventFactory.apply(b);
                    outboxService.saveEvent(AggregateType.CREDIT_BALANCE, b.getId(), event.getEventType(), event);
                });
                return balance;
            });
        });
    }
}
