package com.inboxai.credit_core.ledger;

import java.util.Locale;

/**
 * Subscription tiers and their static credit policy.
 *
 * Allotments are read at reset and onboarding time only, so changing a value
 * here takes effect at each tenant's next monthly reset.
 */
public enum SubscriptionTier {
    FREE(400, 10),
    PRO(5_000, 100),
    BUSINESS(30_000, 1_000);

    private final int monthlyCredits;
    private final int maxPendingFollowUps;

    SubscriptionTier(int monthlyCredits, int maxPendingFollowUps) {
        this.monthlyCredits = monthlyCredits;
        this.maxPendingFollowUps = maxPendingFollowUps;
    }

    public int monthlyCredits() {
        return monthlyCredits;
    }

    public int maxPendingFollowUps() {
        return maxPendingFollowUps;
    }

    /**
     * Database and API representation ("free", "pro", "business").
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SubscriptionTier fromCode(String code) {
        if (code == null || code.isBlank()) {
            return FREE;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown subscription tier: " + code);
        }
    }
}
