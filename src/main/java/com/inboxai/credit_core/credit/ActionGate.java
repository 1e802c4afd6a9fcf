package com.inboxai.credit_core.credit;

import com.inboxai.credit_core.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Charges for an action, then runs it.
 *
 * The deduction commits before the action starts, so a crash mid-action never skips billing.
 * A failed action stays charged. Corrections go through an administrative grant.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActionGate {

    private final ActionCostTable costTable;
    private final CreditAuthority creditAuthority;
    private final CreditMetrics creditMetrics;

    public <T> GatedActionResult<T> execute(UUID userId, UUID orgId, ActionType actionType,
                                            String description, Supplier<T> action) {
        return execute(userId, orgId, actionType, description, Map.of(), action);
    }

    /**
     * @throws InsufficientCreditsException if the tenant cannot afford the action; it is not run
     * @throws ActionExecutionException if the action fails after the credits were deducted
     */
    public <T> GatedActionResult<T> execute(UUID userId, UUID orgId, ActionType actionType,
                                            String description, Map<String, Object> metadata,
                                            Supplier<T> action) {
        int cost = costTable.costOf(actionType);
        long startNanos = System.nanoTime();

        CreditDeduction deduction = creditAuthority.tryDeduct(
            userId, orgId, cost, actionType.code(), description, metadata);

        if (!deduction.isApproved()) {
            creditMetrics.recordActionExecuted(actionType.code(), "rejected", elapsedSince(startNanos));
            throw new InsufficientCreditsException(userId, orgId, actionType.code(), cost, deduction.getAvailableCredits());
        }

        T value;
        try {
            value = action.get();
        } catch (RuntimeException e) {
            creditMetrics.recordActionExecuted(actionType.code(), "failed", elapsedSince(startNanos));
            log.warn("Action {} failed after charging {} credits: {}", actionType.code(), cost, e.getMessage());
            throw new ActionExecutionException(actionType, cost, deduction.getAvailableCredits(), e);
        }

        creditMetrics.recordActionExecuted(actionType.code(), "succeeded", elapsedSince(startNanos));
        return new GatedActionResult<>(value, actionType, cost, deduction.getAvailableCredits());
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
