package com.inboxai.credit_core.credit;

import lombok.Value;

@Value
public class ResetSummary {
    int examined;
    int reset;
    int skipped;
    int failed;

    public static ResetSummary empty() {
        return new ResetSummary(0, 0, 0, 0);
    }

    public ResetSummary plus(ResetSummary other) {
        return new ResetSummary(examined + other.examined, reset + other.reset,
            skipped + other.skipped, failed + other.failed);
    }
}
