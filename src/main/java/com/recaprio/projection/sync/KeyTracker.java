package com.recaprio.projection.sync;

import com.recaprio.projection.model.KeyStatus;
import com.recaprio.projection.model.SyncState;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key state machine bookkeeping. Only ever held for the bookkeeping itself,
 * never across a store write.
 */
class KeyTracker {

    enum Decision {
        ACCEPTED,
        DUPLICATE,
        OUT_OF_ORDER,
        SUPERSEDED
    }

    /**
     * @param previousState state of the key before this admission
     * @param lastSequence  highest sequence seen for the key before this admission
     */
    record Admission(Decision decision, SyncState previousState, long lastSequence) { }

    private static final class Entry {
        SyncState state = SyncState.ABSENT;
        long latestSequence;
        long lastFeedSequence;
        long appliedSequence;
        int attempts;
        String lastError;
        Instant updatedAt;
    }

    private final Map<Long, Entry> entries = new ConcurrentHashMap<>();

    synchronized Admission admit(SyncTask task, Instant now) {
        Admission admission = evaluate(task);
        if (admission.decision() == Decision.ACCEPTED) {
            record(task, now);
        }
        return admission;
    }

    /**
     * Decides what {@link #admit} would decide without changing anything.
     */
    synchronized Admission evaluate(SyncTask task) {
        long sequence = task.event().sequence();
        Entry entry = entries.get(task.event().key());
        if (entry == null) {
            return new Admission(Decision.ACCEPTED, SyncState.ABSENT, 0);
        }
        if (task.origin() == SyncTask.Origin.FEED) {
            if (sequence == entry.lastFeedSequence) {
                return new Admission(Decision.DUPLICATE, entry.state, entry.latestSequence);
            }
            if (sequence < entry.lastFeedSequence) {
                return new Admission(Decision.OUT_OF_ORDER, entry.state, entry.lastFeedSequence);
            }
        }
        if (sequence < entry.latestSequence) {
            return new Admission(Decision.SUPERSEDED, entry.state, entry.latestSequence);
        }
        return new Admission(Decision.ACCEPTED, entry.state, entry.latestSequence);
    }

    /**
     * Records an accepted task. A sequence older than one recorded since it was evaluated
     * only advances the feed position.
     */
    synchronized void record(SyncTask task, Instant now) {
        long sequence = task.event().sequence();
        Entry entry = entries.computeIfAbsent(task.event().key(), k -> new Entry());
        if (sequence >= entry.latestSequence) {
            entry.latestSequence = sequence;
            entry.state = SyncState.PENDING;
        }
        if (task.origin() == SyncTask.Origin.FEED || task.origin() == SyncTask.Origin.REPLAY) {
            entry.lastFeedSequence = Math.max(entry.lastFeedSequence, sequence);
        }
        entry.updatedAt = now;
    }

    synchronized boolean isSuperseded(Long key, long sequence) {
        Entry entry = entries.get(key);
        return entry != null && sequence < entry.latestSequence;
    }

    /**
     * Records a finished write. The key only settles into {@code settled} when no newer
     * sequence has been admitted in the meantime.
     */
    synchronized void markSettled(Long key, long sequence, SyncState settled, Instant now) {
        Entry entry = entries.computeIfAbsent(key, k -> new Entry());
        entry.appliedSequence = Math.max(entry.appliedSequence, sequence);
        if (sequence >= entry.latestSequence) {
            entry.latestSequence = sequence;
            entry.state = settled;
            entry.attempts = 0;
            entry.lastError = null;
        }
        entry.updatedAt = now;
    }

    synchronized void markFailed(Long key, long sequence, int attempt, String error, Instant now) {
        Entry entry = entries.computeIfAbsent(key, k -> new Entry());
        if (sequence >= entry.latestSequence) {
            entry.latestSequence = sequence;
            entry.state = SyncState.FAILED;
            entry.attempts = attempt;
            entry.lastError = error;
        }
        entry.updatedAt = now;
    }

    synchronized SyncState state(Long key) {
        Entry entry = entries.get(key);
        return entry == null ? SyncState.ABSENT : entry.state;
    }

    synchronized boolean isTracked(Long key) {
        return entries.containsKey(key);
    }

    synchronized KeyStatus status(Long key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return new KeyStatus(key, SyncState.ABSENT, 0, 0, 0, null, null);
        }
        return new KeyStatus(key, entry.state, entry.latestSequence, entry.appliedSequence,
                entry.attempts, entry.lastError, entry.updatedAt);
    }

    synchronized Map<SyncState, Long> stateCounts() {
        Map<SyncState, Long> counts = new EnumMap<>(SyncState.class);
        for (SyncState state : SyncState.values()) {
            counts.put(state, 0L);
        }
        for (Entry entry : entries.values()) {
            counts.merge(entry.state, 1L, Long::sum);
        }
        return counts;
    }

    /**
     * Forgets settled keys idle since before {@code cutoff}. Pending and failed keys
     * are kept.
     */
    synchronized int evictSettledBefore(Instant cutoff) {
        int evicted = 0;
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            Entry entry = it.next();
            boolean settled = entry.state == SyncState.CONSISTENT || entry.state == SyncState.ABSENT;
            if (settled && entry.updatedAt != null && entry.updatedAt.isBefore(cutoff)) {
                it.remove();
                evicted++;
            }
        }
        return evicted;
    }
}
