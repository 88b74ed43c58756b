package com.recaprio.projection.model;

import java.time.Instant;

/**
 * Point-in-time view of the synchronizer's bookkeeping for one key.
 */
public record KeyStatus(
        Long key,
        SyncState state,
        long latestSequence,
        long appliedSequence,
        int attempts,
        String lastError,
        Instant updatedAt
) { }
