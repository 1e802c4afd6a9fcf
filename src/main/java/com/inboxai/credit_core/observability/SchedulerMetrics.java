package com.inboxai.credit_core.observability;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SchedulerMetrics {

    private final MeterRegistry registry;

    public void recordDispatched(String kind, String status) {
        registry.counter("schedules.dispatched", "kind", kind, "status", status).increment();
    }

    public void recordCancelled(String kind) {
        registry.counter("schedules.cancelled", "kind", kind).increment();
    }

    public void recordRecovered(int count) {
        registry.counter("schedules.recovered").increment(count);
    }

    public void recordMailboxFetch(String status) {
        registry.counter("mailbox.fetch", "status", status).increment();
    }

    public void recordMailboxDeactivated() {
        registry.counter("mailbox.deactivated").increment();
    }
}
