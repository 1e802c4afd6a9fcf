package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.ledger.SubscriptionTier;
import lombok.Getter;

@Getter
public class TierLimitExceededException extends RuntimeException {

    private final SubscriptionTier tier;
    private final long limit;

    public TierLimitExceededException(SubscriptionTier tier, long limit) {
        super(String.format("The %s tier allows at most %d pending follow-ups", tier.code(), limit));
        this.tier = tier;
        this.limit = limit;
    }
}
