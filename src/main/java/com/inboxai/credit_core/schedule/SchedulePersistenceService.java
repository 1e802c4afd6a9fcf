package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.outbox.AggregateType;
import com.inboxai.credit_core.outbox.OutboxService;
import com.inboxai.credit_core.schedule.event.ScheduleCancelledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Bridges {@link ScheduleEntry} and its table.
 *
 * Every state change locks the row, applies a domain transition to the fresh copy and writes
 * it back, so a concurrent deactivate is never overwritten by a dispatcher writing its result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SchedulePersistenceService {

    private final ScheduleEntryRepository repository;
    private final OutboxService outboxService;

    @Transactional
    public ScheduleEntry save(ScheduleEntry entry) {
        ScheduleEntryEntity saved = repository.save(ScheduleEntryEntity.fromDomain(entry));
        log.debug("Saved {} schedule {}", entry.getKind(), entry.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<ScheduleEntry> findById(UUID id) {
        return repository.findById(id).map(ScheduleEntryEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<ScheduleEntry> findSelectableDigests() {
        return repository.findSelectable(ScheduleKind.DIGEST, ScheduleStatus.PENDING).stream()
            .map(ScheduleEntryEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ScheduleEntry> findDueFollowUps(Instant now, int limit) {
        return repository.findSelectableScheduledBefore(ScheduleKind.FOLLOW_UP, ScheduleStatus.PENDING,
                now, PageRequest.of(0, limit)).stream()
            .map(ScheduleEntryEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ScheduleEntry> findDispatchedBefore(Instant before, int limit) {
        return repository.findDispatchedBefore(ScheduleStatus.DISPATCHED, before, PageRequest.of(0, limit)).stream()
            .map(ScheduleEntryEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ScheduleEntry> findForTenant(UUID userId, UUID orgId, int limit) {
        return repository.findByUserIdAndOrgIdOrderByCreatedAtDesc(userId, orgId, PageRequest.of(0, limit)).stream()
            .map(ScheduleEntryEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countOpenFollowUps(UUID userId, UUID orgId) {
        return repository.countByUserIdAndOrgIdAndKindAndStatusIn(userId, orgId, ScheduleKind.FOLLOW_UP,
            List.of(ScheduleStatus.PENDING, ScheduleStatus.DISPATCHED));
    }

    /**
     * Moves a selectable entry to DISPATCHED, provided it has not run since {@code snapshot}
     * was read.
     *
     * @return the claimed entry, or empty if another dispatcher claimed or ran it first or it
     *         was deactivated, cancelled or completed in the meantime
     */
    @Transactional
    public Optional<ScheduleEntry> claim(ScheduleEntry snapshot, Instant claimedAt) {
        UUID id = snapshot.getId();
        int updated = snapshot.getLastRunAt() == null
            ? repository.claimNeverRun(id, claimedAt, ScheduleStatus.PENDING, ScheduleStatus.DISPATCHED)
            : repository.claimLastRunAt(id, snapshot.getLastRunAt(), claimedAt,
                ScheduleStatus.PENDING, ScheduleStatus.DISPATCHED);
        if (updated == 0) {
            return Optional.empty();
        }
        return repository.findById(id).map(ScheduleEntryEntity::toDomain);
    }

    @Transactional
    public ScheduleEntry recordSuccess(UUID id, Instant now, Instant nextRunAt) {
        return transition(id, entry -> entry.recordSuccess(now, nextRunAt));
    }

    /**
     * Records a failed dispatch. When this failure exhausts the retries, the cancellation is
     * published as a {@link ScheduleCancelledEvent} in the same transaction.
     */
    @Transactional
    public ScheduleEntry recordFailure(UUID id, String error, Instant now) {
        ScheduleEntry updated = transition(id, entry -> entry.recordFailure(error, now));
        if (updated.getStatus() == ScheduleStatus.CANCELLED) {
            publishCancelled(updated, true);
        }
        return updated;
    }

    @Transactional
    public ScheduleEntry cancel(UUID id, String reason, Instant now) {
        ScheduleEntry cancelled = transition(id, entry -> entry.cancel(reason, now));
        publishCancelled(cancelled, false);
        return cancelled;
    }

    @Transactional
    public ScheduleEntry update(UUID id, UnaryOperator<ScheduleEntry> change) {
        return transition(id, change);
    }

    private ScheduleEntry transition(UUID id, UnaryOperator<ScheduleEntry> change) {
        ScheduleEntryEntity entity = repository.findByIdForUpdate(id)
            .orElseThrow(() -> new IllegalArgumentException("Schedule not found: " + id));
        ScheduleEntry updated = change.apply(entity.toDomain());
        entity.updateFromDomain(updated);
        repository.save(entity);
        return updated;
    }

    private void publishCancelled(ScheduleEntry entry, boolean retriesExhausted) {
        ScheduleCancelledEvent event = ScheduleCancelledEvent.of(entry, retriesExhausted);
        outboxService.saveEvent(AggregateType.SCHEDULE_ENTRY, entry.getId(), event.getEventType(), event);
    }
}
