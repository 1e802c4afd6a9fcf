package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.credit.ActionGate;
import com.inboxai.credit_core.credit.ActionType;
import com.inboxai.credit_core.integration.MailboxClient;
import com.inboxai.credit_core.integration.MessageSender;
import com.inboxai.credit_core.integration.MessageSummary;
import com.inboxai.credit_core.integration.OutboundMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * The work behind a schedule entry. Throws on failure; the dispatcher decides what a
 * failure means for the entry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleTaskRunner {

    static final String DEFAULT_DIGEST_SUBJECT = "Your daily email digest";

    private final MailboxClient mailboxClient;
    private final MessageSender messageSender;
    private final ActionGate actionGate;

    public void run(ScheduleEntry entry) {
        switch (entry.getKind()) {
            case DIGEST -> sendDigest(entry);
            case FOLLOW_UP -> sendFollowUp(entry);
        }
    }

    /**
     * Unmetered. An empty summary sends nothing and still counts as a successful run.
     */
    private void sendDigest(ScheduleEntry entry) {
        MessageSummary summary = mailboxClient.fetchAndSummarize(
            entry.getOwnerId(), entry.getCriteriaType(), entry.getLastRunAt());

        if (summary.isEmpty()) {
            log.info("No {} messages since last digest, nothing to send", entry.getCriteriaType());
            return;
        }

        String subject = summary.getSubject() != null && !summary.getSubject().isBlank()
            ? summary.getSubject()
            : DEFAULT_DIGEST_SUBJECT;
        messageSender.send(OutboundMessage.of(entry.getUserId(), entry.getOrgId(), entry.getRecipient(),
            subject, summary.getBody(), "digest", entry.getId()));
        log.info("Digest of {} messages queued for delivery", summary.getMessageCount());
    }

    /**
     * Charged as {@link ActionType#FOLLOW_UP_SEND}. Insufficient credits fail the dispatch
     * like any other error.
     */
    private void sendFollowUp(ScheduleEntry entry) {
        OutboundMessage message = OutboundMessage.of(entry.getUserId(), entry.getOrgId(), entry.getRecipient(),
            entry.getFollowUpType().defaultSubject(), entry.getTemplateMessage(), "follow_up", entry.getId());

        actionGate.execute(entry.getUserId(), entry.getOrgId(), ActionType.FOLLOW_UP_SEND,
            "Follow-up (" + entry.getFollowUpType().name().toLowerCase() + ")",
            Map.of("schedule_id", entry.getId().toString()),
            () -> {
                messageSender.send(message);
                return message.getId();
            });
        log.info("Follow-up queued for delivery: messageId={}", message.getId());
    }
}
