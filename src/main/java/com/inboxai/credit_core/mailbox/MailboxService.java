package com.inboxai.credit_core.mailbox;

import com.inboxai.credit_core.config.MailboxProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;

@Service
@RequiredArgsConstructor
@Slf4j
public class MailboxService {

    private final MailboxRepository repository;
    private final MailboxProperties properties;
    private final Clock clock;

    /**
     * Connects a mailbox. Connecting an address again reactivates the existing mailbox.
     */
    @Transactional
    public Mailbox connect(UUID userId, UUID orgId, String emailAddress) {
        Mailbox requested = Mailbox.connect(userId, orgId, emailAddress, clock.instant());
        return repository.findByUserIdAndOrgIdAndEmailAddress(userId, orgId, requested.getEmailAddress())
            .map(existing -> {
                Mailbox reactivated = existing.toDomain().reactivate(clock.instant());
                existing.updateFromDomain(reactivated);
                log.info("Mailbox {} reconnected", existing.getId());
                return repository.save(existing).toDomain();
            })
            .orElseGet(() -> {
                MailboxEntity saved = repository.save(MailboxEntity.fromDomain(requested));
                log.info("Mailbox {} connected", saved.getId());
                return saved.toDomain();
            });
    }

    @Transactional(readOnly = true)
    public List<Mailbox> listForTenant(UUID userId, UUID orgId) {
        return repository.findByUserIdAndOrgIdOrderByCreatedAtAsc(userId, orgId).stream()
            .map(MailboxEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Mailbox> findActive(int limit) {
        return repository.findActive(PageRequest.of(0, limit)).stream()
            .map(MailboxEntity::toDomain)
            .toList();
    }

    @Transactional
    public Mailbox recordFetched(UUID mailboxId, Instant newestProcessed) {
        return update(mailboxId, mailbox -> mailbox.recordFetched(newestProcessed, clock.instant()));
    }

    @Transactional
    public Mailbox recordFailure(UUID mailboxId, String error) {
        return update(mailboxId,
            mailbox -> mailbox.recordFailure(error, properties.getMaxConsecutiveFailures(), clock.instant()));
    }

    private Mailbox update(UUID mailboxId, UnaryOperator<Mailbox> change) {
        MailboxEntity entity = repository.findById(mailboxId)
            .orElseThrow(() -> new IllegalArgumentException("Mailbox not found: " + mailboxId));
        Mailbox updated = change.apply(entity.toDomain());
        entity.updateFromDomain(updated);
        repository.save(entity);
        return updated;
    }
}
