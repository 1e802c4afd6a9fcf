package com.inboxai.credit_core.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.inboxai.credit_core.ledger.CreditBalance;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CreditBalanceResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("org_id")
    UUID orgId;

    @JsonProperty("total_credits")
    int totalCredits;

    @JsonProperty("used_credits")
    int usedCredits;

    @JsonProperty("available_credits")
    int availableCredits;

    @JsonProperty("subscription_tier")
    String subscriptionTier;

    @JsonProperty("monthly_credits")
    int monthlyCredits;

    @JsonProperty("credits_reset_at")
    Instant creditsResetAt;

    public static CreditBalanceResponse from(CreditBalance balance) {
        return CreditBalanceResponse.builder()
            .userId(balance.getUserId())
            .orgId(balance.getOrgId())
            .totalCredits(balance.getTotalCredits())
            .usedCredits(balance.getUsedCredits())
            .availableCredits(balance.getAvailableCredits())
            .subscriptionTier(balance.getSubscriptionTier().code())
            .monthlyCredits(balance.getSubscriptionTier().monthlyCredits())
            .creditsResetAt(balance.getCreditsResetAt())
            .build();
    }
}
