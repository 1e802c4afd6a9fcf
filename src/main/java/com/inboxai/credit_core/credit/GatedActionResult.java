package com.inboxai.credit_core.credit;

import lombok.Value;

@Value
public class GatedActionResult<T> {
    T value;
    ActionType actionType;
    int creditsUsed;
    int availableCredits;
}
