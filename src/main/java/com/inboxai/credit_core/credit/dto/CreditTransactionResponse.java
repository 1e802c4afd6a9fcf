package com.inboxai.credit_core.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.inboxai.credit_core.ledger.CreditTransaction;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class CreditTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("action_type")
    String actionType;

    /** Positive for spends, negative for grants. */
    @JsonProperty("credits_used")
    int creditsUsed;

    @JsonProperty("description")
    String description;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CreditTransactionResponse from(CreditTransaction transaction) {
        return CreditTransactionResponse.builder()
            .id(transaction.getId())
            .actionType(transaction.getActionType())
            .creditsUsed(transaction.getCreditsUsed())
            .description(transaction.getDescription())
            .metadata(transaction.getMetadata())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
