package com.inboxai.credit_core.credit;

import com.inboxai.credit_core.ledger.CreditBalance;
import lombok.Value;

/**
 * Outcome of a try-deduct: either the post-deduction balance, or a refusal that left the
 * ledger untouched.
 */
@Value
public class CreditDeduction {
    boolean approved;
    int cost;
    int availableCredits;
    CreditBalance balance;   // null when refused

    public static CreditDeduction approved(CreditBalance balance, int cost) {
        return new CreditDeduction(true, cost, balance.getAvailableCredits(), balance);
    }

    public static CreditDeduction insufficient(int cost, int availableCredits) {
        return new CreditDeduction(false, cost, availableCredits, null);
    }
}
