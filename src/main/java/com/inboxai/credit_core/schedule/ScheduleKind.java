package com.inboxai.credit_core.schedule;

public enum ScheduleKind {
    /** Recurring daily summary at a time of day in the entry's timezone. */
    DIGEST,
    /** One-shot message at an absolute time. */
    FOLLOW_UP
}
