package com.inboxai.credit_core.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DueWindowPolicyTest {

    private final DueWindowPolicy policy = new DueWindowPolicy(Duration.ofMinutes(5), Duration.ofHours(23));

    @Nested
    @DisplayName("Digests")
    class Digests {

        @Test
        @DisplayName("Due two minutes after the scheduled time when never run")
        void dueInsideWindow() {
            ScheduleEntry entry = digest("09:00", "UTC", null);

            assertTrue(policy.isDue(entry, Instant.parse("2026-06-10T09:02:00Z")));
        }

        @Test
        @DisplayName("Not due before the scheduled time")
        void notDueBeforeTarget() {
            ScheduleEntry entry = digest("09:00", "UTC", null);

            assertFalse(policy.isDue(entry, Instant.parse("2026-06-10T08:58:00Z")));
        }

        @Test
        @DisplayName("Window bounds are inclusive")
        void windowInclusive() {
            ScheduleEntry entry = digest("09:00", "UTC", null);

            assertTrue(policy.isDue(entry, Instant.parse("2026-06-10T09:00:00Z")));
            assertTrue(policy.isDue(entry, Instant.parse("2026-06-10T09:05:00Z")));
            assertFalse(policy.isDue(entry, Instant.parse("2026-06-10T09:05:01Z")));
        }

        @Test
        @DisplayName("Not due again one hour after the last run")
        void cooldownBlocksRerun() {
            ScheduleEntry entry = digest("09:00", "UTC", Instant.parse("2026-06-10T08:02:00Z"));

            assertFalse(policy.isDue(entry, Instant.parse("2026-06-10T09:02:00Z")));
        }

        @Test
        @DisplayName("Due again the next day once the cooldown has passed")
        void dueAfterCooldown() {
            ScheduleEntry entry = digest("09:00", "UTC", Instant.parse("2026-06-09T09:01:00Z"));

            assertTrue(policy.isDue(entry, Instant.parse("2026-06-10T09:01:00Z")));
        }

        @Test
        @DisplayName("Cooldown must be strictly exceeded")
        void cooldownStrict() {
            Instant lastRun = Instant.parse("2026-06-09T10:00:00Z");
            ScheduleEntry entry = digest("09:00", "UTC", lastRun);

            assertFalse(policy.isCooledDown(entry, lastRun.plus(Duration.ofHours(23))));
            assertTrue(policy.isCooledDown(entry, lastRun.plus(Duration.ofHours(23)).plusSeconds(1)));
        }

        @Test
        @DisplayName("Time of day is evaluated in the entry's timezone")
        void honoursTimezone() {
            // 09:00 in New York is 13:00 UTC during daylight saving time
            ScheduleEntry entry = digest("09:00", "America/New_York", null);

            assertTrue(policy.isDue(entry, Instant.parse("2026-06-10T13:03:00Z")));
            assertFalse(policy.isDue(entry, Instant.parse("2026-06-10T09:03:00Z")));
        }

        @Test
        @DisplayName("A window that crosses local midnight is still found")
        void windowAcrossMidnight() {
            ScheduleEntry entry = digest("23:58", "UTC", null);

            assertTrue(policy.isDue(entry, Instant.parse("2026-06-11T00:01:00Z")));
        }

        @Test
        @DisplayName("Inactive entries are never due")
        void inactiveNeverDue() {
            ScheduleEntry entry = digest("09:00", "UTC", null).deactivate(Instant.parse("2026-06-10T08:00:00Z"));

            assertFalse(policy.isDue(entry, Instant.parse("2026-06-10T09:02:00Z")));
        }

        @Test
        @DisplayName("Next occurrence is the first one strictly after the given instant")
        void nextOccurrence() {
            ScheduleEntry entry = digest("09:00", "UTC", null);

            assertEquals(Instant.parse("2026-06-11T09:00:00Z"),
                policy.nextOccurrence(entry, Instant.parse("2026-06-10T09:00:00Z")));
            assertEquals(Instant.parse("2026-06-10T09:00:00Z"),
                policy.nextOccurrence(entry, Instant.parse("2026-06-10T08:59:59Z")));
        }
    }

    @Nested
    @DisplayName("Follow-ups")
    class FollowUps {

        @Test
        @DisplayName("Due once the scheduled time has passed")
        void dueAfterScheduledTime() {
            Instant scheduledAt = Instant.parse("2026-06-10T12:00:00Z");
            ScheduleEntry entry = ScheduleEntry.followUp(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                scheduledAt, "bob@example.com", FollowUpType.REMINDER, "Any news?", 3, scheduledAt.minusSeconds(3600));

            assertFalse(policy.isDue(entry, scheduledAt.minusSeconds(1)));
            assertTrue(policy.isDue(entry, scheduledAt));
            assertTrue(policy.isDue(entry, scheduledAt.plusSeconds(7200)));
            assertNull(policy.nextOccurrence(entry, scheduledAt));
        }
    }

    @Test
    @DisplayName("A zero due window is rejected")
    void rejectsZeroWindow() {
        assertThrows(IllegalArgumentException.class, () -> new DueWindowPolicy(Duration.ZERO, Duration.ofHours(23)));
    }

    private static ScheduleEntry digest(String time, String timezone, Instant lastRunAt) {
        ScheduleEntry entry = ScheduleEntry.digest(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            LocalTime.parse(time), timezone, "owner@example.com", "all", 3, Instant.parse("2026-06-01T00:00:00Z"));
        return entry.toBuilder().lastRunAt(lastRunAt).build();
    }
}
