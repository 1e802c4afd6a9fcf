package com.inboxai.credit_core.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Result of comparing a stored balance against its transaction log.
 * The log is the source of truth: available credits must equal the negated
 * sum of all signed credits_used values.
 */
@Value
public class LedgerReconciliation {
    UUID userId;
    UUID orgId;
    int availableCredits;
    int totalCredits;
    int usedCredits;
    long transactionSum;
    long transactionCount;

    public long expectedAvailableCredits() {
        return -transactionSum;
    }

    public boolean isBalanced() {
        return availableCredits == totalCredits - usedCredits
            && availableCredits == expectedAvailableCredits();
    }
}
