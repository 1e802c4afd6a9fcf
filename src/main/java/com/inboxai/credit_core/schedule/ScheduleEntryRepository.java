package com.inboxai.credit_core.schedule;

import org.springframework.data.domain.Pageable;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ScheduleEntryRepository extends JpaRepository<ScheduleEntryEntity, UUID> {

    /**
     * Selectable digests. Timing is checked in Java, per entry timezone.
     */
    @Query("""
        SELECT e FROM ScheduleEntryEntity e
        WHERE e.kind = :kind AND e.status = :status AND e.active = true
        ORDER BY e.createdAt ASC
        """)
    List<ScheduleEntryEntity> findSelectable(@Param("kind") ScheduleKind kind,
                                             @Param("status") ScheduleStatus status);

    @Query("""
        SELECT e FROM ScheduleEntryEntity e
        WHERE e.kind = :kind AND e.status = :status AND e.active = true AND e.scheduledAt <= :now
        ORDER BY e.scheduledAt ASC
        """)
    List<ScheduleEntryEntity> findSelectableScheduledBefore(@Param("kind") ScheduleKind kind,
                                                            @Param("status") ScheduleStatus status,
                                                            @Param("now") Instant now,
                                                            Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM ScheduleEntryEntity e WHERE e.id = :id")
    Optional<ScheduleEntryEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Compare-and-swap claim of an entry that has never run: succeeds for exactly one caller
     * while the entry is still selectable.
     *
     * @return 1 if this caller claimed the entry, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ScheduleEntryEntity e
        SET e.status = :dispatched, e.dispatchedAt = :now, e.updatedAt = :now
        WHERE e.id = :id AND e.status = :pending AND e.active = true AND e.lastRunAt IS NULL
        """)
    int claimNeverRun(@Param("id") UUID id,
                      @Param("now") Instant now,
                      @Param("pending") ScheduleStatus pending,
                      @Param("dispatched") ScheduleStatus dispatched);

    /**
     * Same as {@link #claimNeverRun}, for an entry whose last run is still {@code lastRunAt}.
     * A dispatcher holding an older snapshot loses the claim once the entry has run again.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ScheduleEntryEntity e
        SET e.status = :dispatched, e.dispatchedAt = :now, e.updatedAt = :now
        WHERE e.id = :id AND e.status = :pending AND e.active = true AND e.lastRunAt = :lastRunAt
        """)
    int claimLastRunAt(@Param("id") UUID id,
                       @Param("lastRunAt") Instant lastRunAt,
                       @Param("now") Instant now,
                       @Param("pending") ScheduleStatus pending,
                       @Param("dispatched") ScheduleStatus dispatched);

    @Query("""
        SELECT e FROM ScheduleEntryEntity e
        WHERE e.status = :status AND e.dispatchedAt < :before
        ORDER BY e.dispatchedAt ASC
        """)
    List<ScheduleEntryEntity> findDispatchedBefore(@Param("status") ScheduleStatus status,
                                                   @Param("before") Instant before,
                                                   Pageable pageable);

    long countByUserIdAndOrgIdAndKindAndStatusIn(UUID userId, UUID orgId, ScheduleKind kind,
                                                 Collection<ScheduleStatus> statuses);

    List<ScheduleEntryEntity> findByUserIdAndOrgIdOrderByCreatedAtDesc(UUID userId, UUID orgId, Pageable pageable);
}
