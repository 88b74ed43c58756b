package com.recaprio.projection.sync;

import com.recaprio.projection.model.MutationEvent;

/**
 * One unit of synchronizer work.
 *
 * @param event   the mutation to project
 * @param origin  where the work came from
 * @param attempt 1 for the first try, incremented on every retry
 */
record SyncTask(MutationEvent event, Origin origin, int attempt) {

    enum Origin {
        /** Live mutation feed. */
        FEED,
        /** Backoff retry of an earlier failed attempt. */
        RETRY,
        /** Outbox relay of a mutation that was never confirmed. */
        REPLAY,
        /** Re-derivation requested by the consistency monitor or an operator. */
        HEAL
    }

    static SyncTask of(MutationEvent event, Origin origin) {
        return new SyncTask(event, origin, 1);
    }

    SyncTask retry() {
        return new SyncTask(event, Origin.RETRY, attempt + 1);
    }

    /** Whether the event has a mutation outbox entry to settle. */
    boolean tracksOutbox() {
        return origin != Origin.HEAL;
    }
}
