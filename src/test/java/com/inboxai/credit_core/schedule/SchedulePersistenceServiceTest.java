package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchedulePersistenceServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-10T09:02:00Z");
    private static final Instant LAST_RUN = Instant.parse("2026-06-09T09:01:00Z");

    @Mock
    private ScheduleEntryRepository repository;

    @Mock
    private OutboxService outboxService;

    private SchedulePersistenceService persistence;

    @BeforeEach
    void setUp() {
        persistence = new SchedulePersistenceService(repository, outboxService);
    }

    @Test
    @DisplayName("An entry that has run is claimed only while its last run is unchanged")
    void claimMatchesLastRun() {
        ScheduleEntry snapshot = digest().toBuilder().lastRunAt(LAST_RUN).build();
        when(repository.claimLastRunAt(snapshot.getId(), LAST_RUN, NOW, ScheduleStatus.PENDING, ScheduleStatus.DISPATCHED))
            .thenReturn(0);

        assertTrue(persistence.claim(snapshot, NOW).isEmpty());
        verify(repository, never()).claimNeverRun(any(), any(), any(), any());
        verify(repository, never()).findById(any());
    }

    @Test
    @DisplayName("An entry that never ran is claimed only while it still has no last run")
    void claimNeverRun() {
        ScheduleEntry snapshot = digest();
        ScheduleEntry claimed = snapshot.markDispatched(NOW);
        when(repository.claimNeverRun(snapshot.getId(), NOW, ScheduleStatus.PENDING, ScheduleStatus.DISPATCHED))
            .thenReturn(1);
        when(repository.findById(snapshot.getId())).thenReturn(Optional.of(ScheduleEntryEntity.fromDomain(claimed)));

        Optional<ScheduleEntry> result = persistence.claim(snapshot, NOW);

        assertTrue(result.isPresent());
        assertEquals(ScheduleStatus.DISPATCHED, result.get().getStatus());
        assertEquals(NOW, result.get().getDispatchedAt());
        verify(repository, never()).claimLastRunAt(any(), any(), any(), any(), any());
    }

    private static ScheduleEntry digest() {
        return ScheduleEntry.digest(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            LocalTime.of(9, 0), "UTC", "owner@example.com", "all", 3, NOW.minusSeconds(86_400));
    }
}
