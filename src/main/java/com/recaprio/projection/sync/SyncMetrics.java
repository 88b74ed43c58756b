package com.recaprio.projection.sync;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class SyncMetrics {

    private final Counter applied;
    private final Counter skipped;
    private final Counter superseded;
    private final Counter failed;
    private final Counter retries;
    private final Counter orderingViolations;

    public SyncMetrics(MeterRegistry registry) {
        this.applied = registry.counter("projection.sync.applied");
        this.skipped = registry.counter("projection.sync.skipped");
        this.superseded = registry.counter("projection.sync.superseded");
        this.failed = registry.counter("projection.sync.failed");
        this.retries = registry.counter("projection.sync.retries");
        this.orderingViolations = registry.counter("projection.sync.ordering_violations");
    }

    public void recordApplied() {
        applied.increment();
    }

    public void recordSkipped() {
        skipped.increment();
    }

    public void recordSuperseded() {
        superseded.increment();
    }

    public void recordFailed() {
        failed.increment();
    }

    public void recordRetry() {
        retries.increment();
    }

    public void recordOrderingViolation() {
        orderingViolations.increment();
    }

    public long getApplied() {
        return (long) applied.count();
    }

    public long getFailed() {
        return (long) failed.count();
    }

    public long getRetries() {
        return (long) retries.count();
    }

    public long getOrderingViolations() {
        return (long) orderingViolations.count();
    }
}
