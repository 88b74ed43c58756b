package com.recaprio.projection.model;

/**
 * Per-key synchronization state.
 */
public enum SyncState {
    ABSENT,
    CONSISTENT,
    PENDING,
    FAILED
}
