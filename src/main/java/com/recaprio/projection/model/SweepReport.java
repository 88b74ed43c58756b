package com.recaprio.projection.model;

import java.time.Instant;
import java.util.List;

/**
 * Result of one consistency sweep.
 */
public record SweepReport(
        KeyRange range,
        int checked,
        int skippedInFlight,
        int healed,
        List<DriftRecord> drift,
        Instant startedAt,
        Instant finishedAt
) {

    public boolean isClean() {
        return drift.isEmpty();
    }
}
