package com.recaprio.projection.sync;

import com.recaprio.projection.config.SyncProperties;
import com.recaprio.projection.exception.DomainException;
import com.recaprio.projection.exception.OrderingViolationException;
import com.recaprio.projection.exception.StoreUnavailableException;
import com.recaprio.projection.exception.SyncFailedException;
import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DerivedRow;
import com.recaprio.projection.model.DriftReason;
import com.recaprio.projection.model.DriftRecord;
import com.recaprio.projection.model.KeyStatus;
import com.recaprio.projection.model.MutationEvent;
import com.recaprio.projection.model.MutationType;
import com.recaprio.projection.model.SyncState;
import com.recaprio.projection.monitor.DriftLedger;
import com.recaprio.projection.outbox.MutationOutboxService;
import com.recaprio.projection.rule.DerivationRule;
import com.recaprio.projection.store.ProjectionStore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Keeps the projection store in step with base mutations.
 *
 * <p>Each key moves through {@link SyncState}: an insert or a relevant update makes it
 * PENDING, a successful write CONSISTENT, a delete ABSENT, and a failed attempt FAILED
 * until a retry succeeds or the retry budget runs out. Work for a key is serialized on
 * one stripe of the worker pool; every write carries the mutation's commit sequence so
 * the store never regresses to an older value.
 */
@Slf4j
@Service
public class Synchronizer {

    private final DerivationRule rule;
    private final ProjectionStore store;
    private final KeyedExecutor workers;
    private final ScheduledExecutorService retryScheduler;
    private final ExecutorService storeWriter;
    private final TimeLimiter upsertTimeLimiter;
    private final IntervalFunction backoff;
    private final SyncProperties properties;
    private final MutationOutboxService outbox;
    private final DriftLedger driftLedger;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final KeyTracker tracker = new KeyTracker();

    public Synchronizer(DerivationRule rule,
                        ProjectionStore store,
                        KeyedExecutor workers,
                        @Qualifier("syncRetryScheduler") ScheduledExecutorService retryScheduler,
                        @Qualifier("projectionWriteExecutor") ExecutorService storeWriter,
                        TimeLimiter upsertTimeLimiter,
                        SyncProperties properties,
                        MutationOutboxService outbox,
                        DriftLedger driftLedger,
                        SyncMetrics metrics,
                        Clock clock) {
        this.rule = rule;
        this.store = store;
        this.workers = workers;
        this.retryScheduler = retryScheduler;
        this.storeWriter = storeWriter;
        this.upsertTimeLimiter = upsertTimeLimiter;
        this.backoff = IntervalFunction.ofExponentialBackoff(
                properties.getInitialBackoff(), properties.getBackoffMultiplier(), properties.getMaxBackoff());
        this.properties = properties;
        this.outbox = outbox;
        this.driftLedger = driftLedger;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Queues a live mutation on its key's stripe.
     */
    public CompletableFuture<SyncOutcome> submit(MutationEvent event) {
        return enqueue(SyncTask.of(event, SyncTask.Origin.FEED));
    }

    /**
     * Queues a live mutation on its key's stripe while the caller's transaction still
     * holds the base row lock, so stripe order follows commit order. The queued work
     * waits for the transaction to finish and is dropped if it rolls back.
     */
    public CompletableFuture<SyncOutcome> submitOnCommit(MutationEvent event) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return submit(event);
        }
        CompletableFuture<Boolean> committed = new CompletableFuture<>();
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                committed.complete(true);
            }

            @Override
            public void afterCompletion(int status) {
                committed.complete(status == STATUS_COMMITTED);
            }
        });
        SyncTask task = SyncTask.of(event, SyncTask.Origin.FEED);
        try {
            return workers.submit(event.key(), () -> processOnceCommitted(task, committed));
        } catch (RejectedExecutionException ex) {
            log.warn("[SYNC] Worker pool rejected key {} sequence {}: {}",
                    event.key(), event.sequence(), ex.getMessage());
            return CompletableFuture.failedFuture(ex);
        }
    }

    /**
     * Applies a live mutation on the calling thread, inside the caller's transaction.
     * A store failure propagates so the caller's base write rolls back with it; a
     * domain failure is retried in the background once the caller commits. Key state
     * only changes once the caller commits.
     */
    public SyncOutcome applyInTransaction(MutationEvent event) {
        return process(SyncTask.of(event, SyncTask.Origin.FEED), true);
    }

    /**
     * Re-runs a mutation the outbox never saw confirmed.
     */
    public CompletableFuture<SyncOutcome> replay(MutationEvent event) {
        return enqueue(SyncTask.of(event, SyncTask.Origin.REPLAY));
    }

    /**
     * Re-derives a key from its current base row, regardless of what changed.
     */
    public CompletableFuture<SyncOutcome> resync(BaseRow current) {
        MutationEvent event = new MutationEvent(MutationType.UPDATE, current.key(), null, current,
                current.version(), clock.instant());
        log.info("[SYNC] Resync requested for key {} at version {}", current.key(), current.version());
        return enqueue(SyncTask.of(event, SyncTask.Origin.HEAL));
    }

    /**
     * Removes the projection of a key that no longer exists in the base relation.
     *
     * @param version the version the removal must cover, usually the stored row's
     */
    public CompletableFuture<SyncOutcome> resyncAbsent(Long key, long version) {
        MutationEvent event = MutationEvent.delete(key, null, version, clock.instant());
        log.info("[SYNC] Removal requested for absent key {} at version {}", key, version);
        return enqueue(SyncTask.of(event, SyncTask.Origin.HEAL));
    }

    public KeyStatus status(Long key) {
        return tracker.status(key);
    }

    public Map<SyncState, Long> stateCounts() {
        return tracker.stateCounts();
    }

    /**
     * Drops bookkeeping for settled keys idle since before {@code cutoff}.
     */
    public int evictIdle(Instant cutoff) {
        return tracker.evictSettledBefore(cutoff);
    }

    private CompletableFuture<SyncOutcome> enqueue(SyncTask task) {
        try {
            return workers.submit(task.event().key(), () -> process(task, false));
        } catch (RejectedExecutionException ex) {
            log.warn("[SYNC] Worker pool rejected key {} sequence {}: {}",
                    task.event().key(), task.event().sequence(), ex.getMessage());
            return CompletableFuture.failedFuture(ex);
        }
    }

    private SyncOutcome processOnceCommitted(SyncTask task, CompletableFuture<Boolean> committed) {
        MutationEvent event = task.event();
        boolean commit;
        try {
            commit = committed.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("[SYNC] Interrupted waiting for the commit of key {} seq {}", event.key(), event.sequence());
            return SyncOutcome.DISCARDED;
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Commit outcome of sequence " + event.sequence() + " unavailable", ex);
        }
        if (!commit) {
            log.debug("[SYNC] Base write of key {} seq {} rolled back, nothing to project", event.key(), event.sequence());
            return SyncOutcome.DISCARDED;
        }
        return process(task, false);
    }

    SyncOutcome process(SyncTask task, boolean inTransaction) {
        MutationEvent event = task.event();
        Long key = event.key();
        long sequence = event.sequence();
        boolean deferred = inTransaction && TransactionSynchronizationManager.isSynchronizationActive();

        KeyTracker.Admission admission = deferred ? tracker.evaluate(task) : tracker.admit(task, clock.instant());
        switch (admission.decision()) {
            case DUPLICATE -> {
                log.debug("[SYNC] Duplicate delivery of sequence {} for key {}, skipped", sequence, key);
                metrics.recordSkipped();
                return SyncOutcome.DUPLICATE;
            }
            case OUT_OF_ORDER -> {
                OrderingViolationException violation =
                        new OrderingViolationException(key, sequence, admission.lastSequence());
                log.error("[SYNC] Ordering violation: {}", violation.getMessage(), violation);
                metrics.recordOrderingViolation();
                return SyncOutcome.REJECTED;
            }
            case SUPERSEDED -> {
                log.debug("[SYNC] Sequence {} for key {} superseded by {}", sequence, key, admission.lastSequence());
                metrics.recordSuperseded();
                settleOutbox(task, true);
                return SyncOutcome.SUPERSEDED;
            }
            case ACCEPTED -> {
                if (deferred) {
                    track(true, () -> tracker.record(task, clock.instant()));
                }
                log.debug("[SYNC] Key {} {} -> PENDING ({} seq {}, attempt {})",
                        key, admission.previousState(), event.type(), sequence, task.attempt());
            }
        }

        try {
            if (event.type() == MutationType.DELETE) {
                return applyRemove(task, inTransaction);
            }
            if (isIrrelevantUpdate(task, admission)) {
                track(inTransaction, () -> tracker.markSettled(key, sequence, SyncState.CONSISTENT, clock.instant()));
                metrics.recordSkipped();
                settleOutbox(task, false);
                log.debug("[SYNC] Key {} seq {} touched none of {}, derivation skipped",
                        key, sequence, rule.inputColumns());
                return SyncOutcome.UNCHANGED;
            }
            DerivedAttributes derived = rule.derive(event.after());
            return applyUpsert(task, derived, inTransaction);
        } catch (DomainException ex) {
            return handleFailure(task, ex, inTransaction);
        } catch (StoreUnavailableException ex) {
            if (inTransaction) {
                track(true, () -> tracker.markFailed(key, sequence, task.attempt(), ex.getMessage(), clock.instant()));
                metrics.recordFailed();
                log.error("[SYNC] Projection write for key {} seq {} failed inside the base transaction: {}",
                        key, sequence, ex.getMessage());
                throw ex;
            }
            return handleFailure(task, ex, false);
        }
    }

    private SyncOutcome applyUpsert(SyncTask task, DerivedAttributes derived, boolean inTransaction) {
        Long key = task.event().key();
        long sequence = task.event().sequence();
        boolean written = write(key, () -> store.upsert(key, derived, sequence), inTransaction);
        if (!written) {
            track(inTransaction, () -> tracker.markSettled(key, sequence, SyncState.CONSISTENT, clock.instant()));
            metrics.recordSuperseded();
            settleOutbox(task, true);
            log.debug("[SYNC] Store already holds a newer version for key {}, seq {} dropped", key, sequence);
            return SyncOutcome.SUPERSEDED;
        }
        track(inTransaction, () -> tracker.markSettled(key, sequence, SyncState.CONSISTENT, clock.instant()));
        metrics.recordApplied();
        driftLedger.resolveOpen(key);
        settleOutbox(task, false);
        log.debug("[SYNC] Key {} -> CONSISTENT at seq {}: {}", key, sequence, derived.values());
        return SyncOutcome.APPLIED;
    }

    private SyncOutcome applyRemove(SyncTask task, boolean inTransaction) {
        Long key = task.event().key();
        long sequence = task.event().sequence();
        boolean removed = write(key, () -> store.remove(key, sequence), inTransaction);
        if (!removed) {
            track(inTransaction, () -> tracker.markSettled(key, sequence, SyncState.CONSISTENT, clock.instant()));
            metrics.recordSuperseded();
            settleOutbox(task, true);
            return SyncOutcome.SUPERSEDED;
        }
        track(inTransaction, () -> tracker.markSettled(key, sequence, SyncState.ABSENT, clock.instant()));
        metrics.recordApplied();
        driftLedger.resolveOpen(key);
        settleOutbox(task, false);
        log.debug("[SYNC] Key {} -> ABSENT at seq {}", key, sequence);
        return SyncOutcome.REMOVED;
    }

    /**
     * An update that touches none of the rule's inputs can be skipped when the stored
     * value is known to be current: the key was CONSISTENT, or (when it is not tracked)
     * the store holds a value at least as new as the update's previous row.
     */
    private boolean isIrrelevantUpdate(SyncTask task, KeyTracker.Admission admission) {
        MutationEvent event = task.event();
        if (event.type() != MutationType.UPDATE || event.before() == null) {
            return false;
        }
        if (task.origin() != SyncTask.Origin.FEED && task.origin() != SyncTask.Origin.REPLAY) {
            return false;
        }
        if (rule.isAffectedBy(event.changedColumns())) {
            return false;
        }
        if (admission.previousState() == SyncState.CONSISTENT) {
            return true;
        }
        if (admission.lastSequence() > 0) {
            return false;
        }
        Optional<DerivedRow> stored = read(event.key());
        return stored.isPresent() && stored.get().sourceVersion() >= event.before().version();
    }

    private SyncOutcome handleFailure(SyncTask task, RuntimeException cause, boolean inTransaction) {
        Long key = task.event().key();
        long sequence = task.event().sequence();
        track(inTransaction, () -> tracker.markFailed(key, sequence, task.attempt(), cause.getMessage(), clock.instant()));

        if (task.attempt() <= properties.getRetryLimit()) {
            long delayMs = backoff.apply(task.attempt());
            log.warn("[SYNC] Key {} -> FAILED (seq {}, attempt {}): {}. Retrying in {} ms",
                    key, sequence, task.attempt(), cause.getMessage(), delayMs);
            metrics.recordRetry();
            if (task.tracksOutbox()) {
                guardOutbox(() -> outbox.recordAttempt(sequence, cause.getMessage()), sequence);
            }
            SyncTask next = task.retry();
            if (inTransaction && TransactionSynchronizationManager.isSynchronizationActive()) {
                TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                    @Override
                    public void afterCommit() {
                        scheduleRetry(next, delayMs);
                    }
                });
            } else {
                scheduleRetry(next, delayMs);
            }
            return SyncOutcome.RETRY_SCHEDULED;
        }

        SyncFailedException failure = new SyncFailedException(key, sequence, task.attempt(), cause);
        log.error("[SYNC] {}", failure.getMessage());
        metrics.recordFailed();
        DerivedAttributes actual = read(key).map(DerivedRow::attributes).orElse(null);
        try {
            driftLedger.report(new DriftRecord(key, null, actual, clock.instant(),
                    DriftReason.SYNC_FAILED, failure.getMessage()));
        } catch (DataAccessException ex) {
            log.error("[SYNC] Could not record SYNC_FAILED drift for key {}: {}", key, ex.getMessage());
        }
        if (task.tracksOutbox()) {
            guardOutbox(() -> outbox.markFailed(sequence, failure.getMessage()), sequence);
        }
        return SyncOutcome.FAILED;
    }

    /**
     * Applies a tracker change now, or after commit when running inside the base
     * transaction. A rolled back transaction leaves the tracker untouched.
     */
    private void track(boolean inTransaction, Runnable change) {
        if (inTransaction && TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    change.run();
                }
            });
        } else {
            change.run();
        }
    }

    private void scheduleRetry(SyncTask next, long delayMs) {
        Long key = next.event().key();
        try {
            retryScheduler.schedule(() -> {
                if (tracker.isSuperseded(key, next.event().sequence())) {
                    log.debug("[SYNC] Retry of seq {} for key {} dropped, superseded", next.event().sequence(), key);
                    metrics.recordSuperseded();
                    settleOutbox(next, true);
                    return;
                }
                enqueue(next);
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            log.warn("[SYNC] Retry for key {} not scheduled, shutting down: {}", key, ex.getMessage());
        }
    }

    /**
     * Runs a store write. Inside a transaction it runs on the calling thread; otherwise it
     * runs on the write executor and is abandoned when it exceeds the upsert deadline.
     */
    private boolean write(Long key, Supplier<Boolean> storeCall, boolean inTransaction) {
        Supplier<Boolean> translated = () -> {
            try {
                return storeCall.get();
            } catch (DataAccessException | TransactionException ex) {
                throw new StoreUnavailableException("Projection store write failed for key " + key
                        + ": " + ex.getMessage(), ex);
            }
        };
        if (inTransaction) {
            return translated.get();
        }
        try {
            return upsertTimeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(translated, storeWriter));
        } catch (TimeoutException ex) {
            throw new StoreUnavailableException("Projection store write for key " + key + " exceeded "
                    + properties.getUpsertTimeout().toMillis() + " ms", ex);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new StoreUnavailableException("Projection store write failed for key " + key
                    + ": " + ex.getMessage(), ex);
        }
    }

    private Optional<DerivedRow> read(Long key) {
        try {
            return store.get(key);
        } catch (DataAccessException ex) {
            log.warn("[SYNC] Could not read projection for key {}: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    private void settleOutbox(SyncTask task, boolean superseded) {
        if (!task.tracksOutbox()) {
            return;
        }
        long sequence = task.event().sequence();
        if (superseded) {
            guardOutbox(() -> outbox.markSuperseded(sequence), sequence);
        } else {
            guardOutbox(() -> outbox.markApplied(sequence), sequence);
        }
    }

    // the relay replays an entry whose status update is lost, and replays are idempotent
    private void guardOutbox(Runnable update, long sequence) {
        try {
            update.run();
        } catch (DataAccessException ex) {
            log.warn("[OUTBOX] Could not update entry {}: {}", sequence, ex.getMessage());
        }
    }
}
