package com.recaprio.projection.model;

public enum DriftReason {
    /** Stored value differs from re-derivation. */
    MISMATCH,
    /** Base row exists but no projection row does. */
    MISSING,
    /** Projection row exists for a key absent from the base relation. */
    ORPHANED,
    /** Synchronization gave up on the key, the stored value is stale. */
    SYNC_FAILED
}
