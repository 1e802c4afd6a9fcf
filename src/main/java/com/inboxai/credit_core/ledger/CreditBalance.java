package com.inboxai.credit_core.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Credit balance of one tenant, a (user, organization) pair.
 *
 * Key invariants, enforced by the database as CHECK constraints and
 * by the ledger store's conditional updates:
 * 1. availableCredits == totalCredits - usedCredits
 * 2. availableCredits >= 0
 * 3. exactly one balance per (userId, orgId)
 */
@Value
public class CreditBalance {
    UUID id;
    UUID userId;
    UUID orgId;
    int totalCredits;
    int usedCredits;
    int availableCredits;
    SubscriptionTier subscriptionTier;
    Instant creditsResetAt;

    public boolean canAfford(int cost) {
        return availableCredits >= cost;
    }

    public boolean isConsistent() {
        return availableCredits == totalCredits - usedCredits && availableCredits >= 0;
    }

    public boolean isResetDue(Instant now) {
        return creditsResetAt != null && !creditsResetAt.isAfter(now);
    }
}
