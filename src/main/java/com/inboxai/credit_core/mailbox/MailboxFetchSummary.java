package com.inboxai.credit_core.mailbox;

import lombok.Value;

@Value
public class MailboxFetchSummary {
    int mailboxes;
    int classified;
    int failedFetches;
    int deactivated;
    /** Tenants whose fetch stopped because their credits ran out. */
    int tenantsOutOfCredits;
    /** Tenants skipped for the rest of the tick because the ledger could not be charged. */
    int tenantsDeferred;
}
