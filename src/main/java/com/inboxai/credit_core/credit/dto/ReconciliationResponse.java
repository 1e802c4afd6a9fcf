package com.inboxai.credit_core.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.inboxai.credit_core.ledger.LedgerReconciliation;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("available_credits")
    int availableCredits;

    @JsonProperty("expected_available_credits")
    long expectedAvailableCredits;

    @JsonProperty("transaction_count")
    long transactionCount;

    @JsonProperty("balanced")
    boolean balanced;

    public static ReconciliationResponse from(LedgerReconciliation reconciliation) {
        return ReconciliationResponse.builder()
            .availableCredits(reconciliation.getAvailableCredits())
            .expectedAvailableCredits(reconciliation.expectedAvailableCredits())
            .transactionCount(reconciliation.getTransactionCount())
            .balanced(reconciliation.isBalanced())
            .build();
    }
}
