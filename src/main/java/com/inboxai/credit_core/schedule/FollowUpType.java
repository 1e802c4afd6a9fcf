package com.inboxai.credit_core.schedule;

import java.util.Locale;

public enum FollowUpType {
    REMINDER("Reminder"),
    CHECK_IN("Checking in"),
    CLOSING("Closing the loop"),
    CUSTOM("Following up");

    private final String defaultSubject;

    FollowUpType(String defaultSubject) {
        this.defaultSubject = defaultSubject;
    }

    public String defaultSubject() {
        return defaultSubject;
    }

    public static FollowUpType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return CUSTOM;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown follow-up type: " + code);
        }
    }
}
