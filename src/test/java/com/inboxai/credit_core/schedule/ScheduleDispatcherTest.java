package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.config.SchedulerProperties;
import com.inboxai.credit_core.integration.IntegrationException;
import com.inboxai.credit_core.observability.SchedulerMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-06-10T09:02:00Z");

    @Mock
    private SchedulePersistenceService persistence;

    @Mock
    private ScheduleTaskRunner taskRunner;

    @Mock
    private SchedulerMetrics metrics;

    private ExecutorService executor;
    private SchedulerProperties properties;
    private DueWindowPolicy policy;
    private ScheduleDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        properties = new SchedulerProperties();
        properties.setDispatchTimeout(Duration.ofMillis(200));
        policy = new DueWindowPolicy(Duration.ofMinutes(5), Duration.ofHours(23));
        dispatcher = new ScheduleDispatcher(persistence, taskRunner, executor, policy, properties, metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("A claimed digest runs and records success with its next occurrence")
    void dispatchSucceeds() {
        ScheduleEntry entry = digest();
        when(persistence.claim(entry, NOW)).thenReturn(Optional.of(entry.markDispatched(NOW)));

        DispatchOutcome outcome = dispatcher.dispatch(entry);

        assertEquals(DispatchOutcome.SUCCEEDED, outcome);
        verify(taskRunner).run(any());
        verify(persistence).recordSuccess(entry.getId(), NOW, Instant.parse("2026-06-11T09:00:00Z"));
        verify(metrics).recordDispatched("DIGEST", "succeeded");
    }

    @Test
    @DisplayName("An entry claimed elsewhere is skipped without running")
    void claimLost() {
        ScheduleEntry entry = digest();
        when(persistence.claim(entry, NOW)).thenReturn(Optional.empty());

        DispatchOutcome outcome = dispatcher.dispatch(entry);

        assertEquals(DispatchOutcome.SKIPPED, outcome);
        verify(taskRunner, never()).run(any());
        verify(persistence, never()).recordSuccess(any(), any(), any());
    }

    @Test
    @DisplayName("A failing task is recorded as a retryable failure")
    void dispatchFails() {
        ScheduleEntry entry = digest();
        ScheduleEntry dispatched = entry.markDispatched(NOW);
        when(persistence.claim(entry, NOW)).thenReturn(Optional.of(dispatched));
        doThrow(new IntegrationException("mailbox gateway down")).when(taskRunner).run(any());
        when(persistence.recordFailure(entry.getId(), "mailbox gateway down", NOW))
            .thenReturn(dispatched.recordFailure("mailbox gateway down", NOW));

        DispatchOutcome outcome = dispatcher.dispatch(entry);

        assertEquals(DispatchOutcome.FAILED, outcome);
        verify(metrics).recordDispatched("DIGEST", "failed");
        verify(persistence, never()).recordSuccess(any(), any(), any());
    }

    @Test
    @DisplayName("The failure that exhausts retries cancels the entry")
    void retriesExhausted() {
        ScheduleEntry entry = followUp().toBuilder().retryCount(3).build();
        ScheduleEntry dispatched = entry.markDispatched(NOW);
        when(persistence.claim(entry, NOW)).thenReturn(Optional.of(dispatched));
        doThrow(new IntegrationException("smtp rejected")).when(taskRunner).run(any());
        when(persistence.recordFailure(entry.getId(), "smtp rejected", NOW))
            .thenReturn(dispatched.recordFailure("smtp rejected", NOW));

        DispatchOutcome outcome = dispatcher.dispatch(entry);

        assertEquals(DispatchOutcome.CANCELLED, outcome);
        verify(metrics).recordCancelled("FOLLOW_UP");
    }

    @Test
    @DisplayName("A task that outlives the dispatch timeout is abandoned and counted as failed")
    void dispatchTimesOut() {
        ScheduleEntry entry = digest();
        ScheduleEntry dispatched = entry.markDispatched(NOW);
        when(persistence.claim(entry, NOW)).thenReturn(Optional.of(dispatched));
        doAnswer(invocation -> {
            Thread.sleep(5_000);
            return null;
        }).when(taskRunner).run(any());
        when(persistence.recordFailure(eq(entry.getId()), contains("timed out"), eq(NOW)))
            .thenReturn(dispatched.recordFailure("timed out", NOW));

        long start = System.nanoTime();
        DispatchOutcome outcome = dispatcher.dispatch(entry);

        assertEquals(DispatchOutcome.FAILED, outcome);
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(4)) < 0);
    }

    @Test
    @DisplayName("The claim is stamped with the time it happens, not the tick's start")
    void claimUsesWallClock() {
        Instant claimedAt = NOW.plus(Duration.ofMinutes(25));
        ScheduleDispatcher lateDispatcher = new ScheduleDispatcher(persistence, taskRunner, executor, policy,
            properties, metrics, Clock.fixed(claimedAt, ZoneOffset.UTC));
        ScheduleEntry entry = followUp();
        ScheduleEntry dispatched = entry.markDispatched(claimedAt);
        when(persistence.claim(entry, claimedAt)).thenReturn(Optional.of(dispatched));

        assertEquals(DispatchOutcome.SUCCEEDED, lateDispatcher.dispatch(entry));

        verify(persistence).claim(entry, claimedAt);
        verify(persistence).recordSuccess(entry.getId(), claimedAt, null);
        Instant staleCutoff = claimedAt.minus(properties.effectiveStaleAfter());
        assertFalse(dispatched.getDispatchedAt().isBefore(staleCutoff));
    }

    @Test
    @DisplayName("Entries stuck in DISPATCHED are recovered as failed dispatches")
    void recoversStaleEntries() {
        ScheduleEntry stale = digest().markDispatched(NOW.minus(Duration.ofHours(1)));
        when(persistence.findDispatchedBefore(NOW.minus(properties.effectiveStaleAfter()), properties.getBatchSize()))
            .thenReturn(List.of(stale));
        when(persistence.recordFailure(eq(stale.getId()), contains("abandoned"), eq(NOW)))
            .thenReturn(stale.recordFailure("abandoned", NOW));

        int recovered = dispatcher.recoverStale(NOW);

        assertEquals(1, recovered);
        verify(metrics).recordRecovered(1);
    }

    @Test
    @DisplayName("An entry that changed state during recovery is skipped")
    void recoverySkipsChangedEntries() {
        ScheduleEntry stale = digest().markDispatched(NOW.minus(Duration.ofHours(1)));
        when(persistence.findDispatchedBefore(any(), eq(properties.getBatchSize()))).thenReturn(List.of(stale));
        when(persistence.recordFailure(eq(stale.getId()), any(), eq(NOW)))
            .thenThrow(new IllegalStateException("Only DISPATCHED entries can"));

        assertEquals(0, dispatcher.recoverStale(NOW));
        verify(metrics, never()).recordRecovered(1);
    }

    private static ScheduleEntry digest() {
        return ScheduleEntry.digest(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            LocalTime.of(9, 0), "UTC", "owner@example.com", "all", 3, NOW.minusSeconds(86_400));
    }

    private static ScheduleEntry followUp() {
        return ScheduleEntry.followUp(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            NOW.minusSeconds(60), "bob@example.com", FollowUpType.REMINDER, "Any update?", 3, NOW.minusSeconds(86_400));
    }
}
