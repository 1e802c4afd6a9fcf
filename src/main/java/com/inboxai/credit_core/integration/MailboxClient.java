package com.inboxai.credit_core.integration;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Email fetch capability. Credentials and provider protocol stay behind the gateway.
 */
public interface MailboxClient {

    /**
     * Messages received after {@code since} (all of them when null), oldest first.
     */
    List<MailboxMessage> fetchNewMessages(UUID mailboxId, Instant since, int limit);

    /**
     * Fetches the owner's recent mail matching {@code criteriaType} and summarizes it.
     */
    MessageSummary fetchAndSummarize(UUID ownerId, String criteriaType, Instant since);
}
