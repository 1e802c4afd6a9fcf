package com.inboxai.credit_core.mailbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.inboxai.credit_core.config.MailboxProperties;
import com.inboxai.credit_core.credit.ActionExecutionException;
import com.inboxai.credit_core.credit.ActionGate;
import com.inboxai.credit_core.credit.ActionType;
import com.inboxai.credit_core.credit.InsufficientCreditsException;
import com.inboxai.credit_core.integration.ActionExecutor;
import com.inboxai.credit_core.integration.MailboxClient;
import com.inboxai.credit_core.integration.MailboxMessage;
import com.inboxai.credit_core.observability.CorrelationContext;
import com.inboxai.credit_core.observability.SchedulerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Fetch-all-accounts: pulls new mail for every active mailbox and classifies each message
 * through the {@link ActionGate}.
 *
 * When a tenant runs out of credits its remaining mailboxes are skipped for the rest of the tick,
 * and each mailbox resumes after its last classified message on a later tick. A charge that fails
 * for any other reason (ledger contention, lost connection) defers the tenant the same way: the
 * cursor still moves past every message already charged, and the mailbox is not counted as failing.
 */
@Component
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MailboxFetchJob {

    private final MailboxService mailboxService;
    private final MailboxClient mailboxClient;
    private final ActionGate actionGate;
    private final ActionExecutor actionExecutor;
    private final MailboxProperties properties;
    private final SchedulerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Scheduled(fixedRateString = "${mailbox.fetch.poll-interval-ms:300000}",
               initialDelayString = "${mailbox.fetch.initial-delay-ms:60000}")
    public void fetchAllAccounts() {
        try (MDC.MDCCloseable ignored = CorrelationContext.openJobScope("mailbox-fetch")) {
            MailboxFetchSummary summary = runTick(clock.instant());
            if (summary.getMailboxes() > 0) {
                log.info("Mailbox fetch tick: mailboxes={}, classified={}, failedFetches={}, deactivated={}, outOfCredits={}, deferred={}",
                    summary.getMailboxes(), summary.getClassified(), summary.getFailedFetches(),
                    summary.getDeactivated(), summary.getTenantsOutOfCredits(), summary.getTenantsDeferred());
            }
        } catch (Exception e) {
            log.error("Mailbox fetch tick failed, will retry next tick", e);
        }
    }

    public MailboxFetchSummary runTick(Instant now) {
        List<Mailbox> mailboxes = mailboxService.findActive(properties.getBatchSize());
        Set<String> outOfCredits = new HashSet<>();
        Set<String> deferred = new HashSet<>();
        int classified = 0;
        int failedFetches = 0;
        int deactivated = 0;

        for (Mailbox mailbox : mailboxes) {
            String tenant = tenantKey(mailbox.getUserId(), mailbox.getOrgId());
            if (outOfCredits.contains(tenant) || deferred.contains(tenant)) {
                metrics.recordMailboxFetch("skipped");
                continue;
            }

            CorrelationContext.putTenant(mailbox.getUserId(), mailbox.getOrgId());
            try {
                FetchResult result = fetchMailbox(mailbox);
                classified += result.classified;
                if (result.outOfCredits) {
                    outOfCredits.add(tenant);
                }
                if (result.chargeFailed) {
                    deferred.add(tenant);
                }
            } catch (RuntimeException e) {
                failedFetches++;
                if (recordFetchFailure(mailbox, e)) {
                    deactivated++;
                }
            } finally {
                CorrelationContext.clearTenant();
            }
        }
        return new MailboxFetchSummary(mailboxes.size(), classified, failedFetches, deactivated,
            outOfCredits.size(), deferred.size());
    }

    private FetchResult fetchMailbox(Mailbox mailbox) {
        List<MailboxMessage> messages = mailboxClient.fetchNewMessages(
            mailbox.getId(), mailbox.getLastFetchedAt(), properties.getMaxMessagesPerMailbox());

        Instant newestProcessed = null;
        int classified = 0;
        boolean outOfCredits = false;
        boolean chargeFailed = false;

        for (MailboxMessage message : messages) {
            try {
                classify(mailbox, message);
                classified++;
            } catch (InsufficientCreditsException e) {
                log.info("Credits exhausted after {} of {} messages in mailbox {}, resuming next tick",
                    classified, messages.size(), mailbox.getId());
                outOfCredits = true;
                break;
            } catch (ActionExecutionException e) {
                // Charged already; retrying would charge again
                log.warn("Classification failed for message {} in mailbox {}: {}",
                    message.getMessageId(), mailbox.getId(), e.getMessage());
            } catch (RuntimeException e) {
                // Not charged for this message; it is retried next tick
                log.warn("Could not charge for message {} in mailbox {}, deferring tenant: {}",
                    message.getMessageId(), mailbox.getId(), e.getMessage());
                chargeFailed = true;
                break;
            }
            newestProcessed = message.getReceivedAt();
        }

        mailboxService.recordFetched(mailbox.getId(), newestProcessed);
        metrics.recordMailboxFetch(outOfCredits ? "out_of_credits" : chargeFailed ? "deferred" : "success");
        return new FetchResult(classified, outOfCredits, chargeFailed);
    }

    private void classify(Mailbox mailbox, MailboxMessage message) {
        ObjectNode input = objectMapper.createObjectNode();
        input.put("mailbox_id", mailbox.getId().toString());
        input.put("message_id", message.getMessageId());
        input.put("thread_id", message.getThreadId());
        input.put("sender", message.getSender());
        input.put("subject", message.getSubject());
        input.put("snippet", message.getSnippet());

        JsonNode classification = actionGate.execute(mailbox.getUserId(), mailbox.getOrgId(),
            ActionType.EMAIL_CLASSIFICATION, "Classify message " + message.getMessageId(),
            Map.of("mailbox_id", mailbox.getId().toString(), "message_id", message.getMessageId()),
            () -> actionExecutor.execute(ActionType.EMAIL_CLASSIFICATION, mailbox.getUserId(), mailbox.getOrgId(), input))
            .getValue();
        log.debug("Message {} classified: {}", message.getMessageId(), classification);
    }

    /**
     * @return true if this failure deactivated the mailbox
     */
    private boolean recordFetchFailure(Mailbox mailbox, RuntimeException error) {
        metrics.recordMailboxFetch("failure");
        Mailbox updated;
        try {
            updated = mailboxService.recordFailure(mailbox.getId(), error.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not record fetch failure for mailbox {}", mailbox.getId(), e);
            return false;
        }

        if (!updated.isActive()) {
            metrics.recordMailboxDeactivated();
            log.warn("Mailbox {} deactivated after {} consecutive fetch failures: {}",
                mailbox.getId(), updated.getConsecutiveFailures(), error.getMessage());
            return true;
        }
        log.warn("Fetch failed for mailbox {} ({} in a row): {}",
            mailbox.getId(), updated.getConsecutiveFailures(), error.getMessage());
        return false;
    }

    private static final class FetchResult {
        private final int classified;
        private final boolean outOfCredits;
        private final boolean chargeFailed;

        private FetchResult(int classified, boolean outOfCredits, boolean chargeFailed) {
            this.classified = classified;
            this.outOfCredits = outOfCredits;
            this.chargeFailed = chargeFailed;
        }
    }

    private static String tenantKey(UUID userId, UUID orgId) {
        return userId + ":" + orgId;
    }
}
