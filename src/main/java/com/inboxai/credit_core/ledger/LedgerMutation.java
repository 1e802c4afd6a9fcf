package com.inboxai.credit_core.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Request for a single atomic change to a tenant's balance.
 * Built through the factory methods, which validate the amount for each entry type.
 */
@Value
public class LedgerMutation {

    public static final String GRANT_ACTION = "credit_added";
    public static final String RESET_ACTION = "monthly_reset";

    UUID userId;
    UUID orgId;
    EntryType entryType;
    int amount;
    String actionType;
    String description;
    Map<String, Object> metadata;

    // GRANT: reset date for a newly created balance. RESET: the next reset date.
    Instant resetAt;

    // GRANT: tier of a newly created balance. RESET: the tier whose allotment is applied.
    SubscriptionTier tier;

    // RESET only
    Instant expectedResetAt;

    // GRANT only: skip the grant when the balance already exists
    boolean createOnly;

    public static LedgerMutation spend(UUID userId, UUID orgId, int cost, String actionType,
                                       String description, Map<String, Object> metadata) {
        requirePositive(cost, "Cost");
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("Action type is required");
        }
        return new LedgerMutation(Objects.requireNonNull(userId), Objects.requireNonNull(orgId),
            EntryType.SPEND, cost, actionType, description, metadata == null ? Map.of() : metadata,
            null, null, null, false);
    }

    public static LedgerMutation grant(UUID userId, UUID orgId, int amount, String description,
                                       SubscriptionTier tierIfCreated, Instant resetAtIfCreated) {
        requirePositive(amount, "Grant amount");
        return new LedgerMutation(Objects.requireNonNull(userId), Objects.requireNonNull(orgId),
            EntryType.GRANT, amount, GRANT_ACTION, description, Map.of(),
            resetAtIfCreated, tierIfCreated == null ? SubscriptionTier.FREE : tierIfCreated, null, false);
    }

    /**
     * First grant for a new membership: creates the balance with the tier's allotment,
     * or does nothing if the tenant already has one.
     */
    public static LedgerMutation opening(UUID userId, UUID orgId, SubscriptionTier tier, Instant firstResetAt) {
        Objects.requireNonNull(tier, "Tier is required");
        return new LedgerMutation(Objects.requireNonNull(userId), Objects.requireNonNull(orgId),
            EntryType.GRANT, tier.monthlyCredits(), GRANT_ACTION,
            "Initial credits (" + tier.code() + ")",
            Map.of("tier", tier.code(), "onboarding", true),
            firstResetAt, tier, null, true);
    }

    public static LedgerMutation reset(UUID userId, UUID orgId, SubscriptionTier tier,
                                       Instant expectedResetAt, Instant nextResetAt) {
        Objects.requireNonNull(tier, "Tier is required");
        Objects.requireNonNull(nextResetAt, "Next reset date is required");
        return new LedgerMutation(Objects.requireNonNull(userId), Objects.requireNonNull(orgId),
            EntryType.RESET, tier.monthlyCredits(), RESET_ACTION,
            "Monthly credit reset (" + tier.code() + ")",
            Map.of("tier", tier.code(), "monthly_credits", tier.monthlyCredits()),
            nextResetAt, tier, expectedResetAt, false);
    }

    private static void requirePositive(int value, String label) {
        if (value <= 0) {
            throw new IllegalArgumentException(label + " must be positive");
        }
    }
}
