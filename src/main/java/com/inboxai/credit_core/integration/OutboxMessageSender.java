package com.inboxai.credit_core.integration;

import com.inboxai.credit_core.outbox.AggregateType;
import com.inboxai.credit_core.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands messages to the delivery service by writing an OutboundMessageRequested event.
 * Once the transaction commits, delivery is the downstream consumer's job.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMessageSender implements MessageSender {

    public static final String EVENT_TYPE = "OutboundMessageRequested";

    private final OutboxService outboxService;

    @Override
    @Transactional
    public void send(OutboundMessage message) {
        if (message.getRecipient() == null || message.getRecipient().isBlank()) {
            throw new IntegrationException("Outbound message " + message.getId() + " has no recipient");
        }
        outboxService.saveEvent(AggregateType.OUTBOUND_MESSAGE, message.getId(), EVENT_TYPE, message);
        log.debug("Queued outbound {} message {} for source {}", message.getSource(), message.getId(), message.getSourceId());
    }
}
