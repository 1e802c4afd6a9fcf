package com.inboxai.credit_core.mailbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "mailboxes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MailboxEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "org_id", nullable = false, updatable = false)
    private UUID orgId;

    @Column(name = "email_address", nullable = false, updatable = false, length = 320)
    private String emailAddress;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "last_fetched_at")
    private Instant lastFetchedAt;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static MailboxEntity fromDomain(Mailbox mailbox) {
        MailboxEntity entity = new MailboxEntity();
        entity.id = mailbox.getId();
        entity.userId = mailbox.getUserId();
        entity.orgId = mailbox.getOrgId();
        entity.emailAddress = mailbox.getEmailAddress();
        entity.createdAt = mailbox.getCreatedAt();
        entity.updateFromDomain(mailbox);
        return entity;
    }

    public Mailbox toDomain() {
        return Mailbox.builder()
            .id(id)
            .userId(userId)
            .orgId(orgId)
            .emailAddress(emailAddress)
            .active(active)
            .lastFetchedAt(lastFetchedAt)
            .consecutiveFailures(consecutiveFailures)
            .lastError(lastError)
            .deactivatedAt(deactivatedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void updateFromDomain(Mailbox mailbox) {
        this.active = mailbox.isActive();
        this.lastFetchedAt = mailbox.getLastFetchedAt();
        this.consecutiveFailures = mailbox.getConsecutiveFailures();
        this.lastError = mailbox.getLastError();
        this.deactivatedAt = mailbox.getDeactivatedAt();
        this.updatedAt = mailbox.getUpdatedAt();
    }
}
