package com.inboxai.credit_core.mailbox;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MailboxRepository extends JpaRepository<MailboxEntity, UUID> {

    /**
     * Least recently fetched first, so a batch limit rotates through every mailbox.
     */
    @Query("SELECT m FROM MailboxEntity m WHERE m.active = true ORDER BY m.lastFetchedAt ASC NULLS FIRST, m.createdAt ASC")
    List<MailboxEntity> findActive(Pageable pageable);

    List<MailboxEntity> findByUserIdAndOrgIdOrderByCreatedAtAsc(UUID userId, UUID orgId);

    Optional<MailboxEntity> findByUserIdAndOrgIdAndEmailAddress(UUID userId, UUID orgId, String emailAddress);
}
