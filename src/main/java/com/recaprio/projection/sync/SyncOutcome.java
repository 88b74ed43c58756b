package com.recaprio.projection.sync;

public enum SyncOutcome {
    /** Derived values written. */
    APPLIED,
    /** Update did not touch the rule's inputs; nothing derived or written. */
    UNCHANGED,
    /** Projection row removed. */
    REMOVED,
    /** A newer sequence already holds the key. */
    SUPERSEDED,
    /** Repeated delivery of the sequence last processed. */
    DUPLICATE,
    /** Attempt failed, another one is scheduled. */
    RETRY_SCHEDULED,
    /** Retries exhausted. */
    FAILED,
    /** Arrived out of order; not applied. */
    REJECTED,
    /** The base write it came from rolled back. */
    DISCARDED
}
