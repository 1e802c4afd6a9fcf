package com.inboxai.credit_core.schedule;

import java.util.UUID;

/**
 * Unknown schedule, or one that belongs to another tenant.
 */
public class ScheduleNotFoundException extends RuntimeException {

    public ScheduleNotFoundException(UUID scheduleId) {
        super("Schedule not found: " + scheduleId);
    }
}
