package com.recaprio.projection.sync;

import com.recaprio.projection.config.SyncProperties;
import com.recaprio.projection.model.MutationEvent;
import com.recaprio.projection.model.ProjectionMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes base mutations to the synchronizer.
 *
 * <p>With a zero staleness window, inline and indexed-view projections are written in
 * the base write's own transaction; summary-table projections are queued on the key's
 * stripe before the commit and written right after it while the writer waits, up to the
 * upsert timeout. With a non-zero window every mode is queued that way and the writer
 * does not wait.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MutationEventDispatcher {

    private final Synchronizer synchronizer;
    private final SyncProperties properties;

    @EventListener
    public void onMutation(MutationEvent event) {
        if (appliesInTransaction()) {
            synchronizer.applyInTransaction(event);
            return;
        }
        CompletableFuture<SyncOutcome> outcome = synchronizer.submitOnCommit(event);
        if (!properties.isSynchronous()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    await(event, outcome);
                }
            });
        } else {
            await(event, outcome);
        }
    }

    boolean appliesInTransaction() {
        return properties.isSynchronous() && properties.getMode() != ProjectionMode.SUMMARY_TABLE;
    }

    private void await(MutationEvent event, CompletableFuture<SyncOutcome> outcome) {
        long timeoutMs = properties.getUpsertTimeout().toMillis();
        try {
            SyncOutcome result = outcome.get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("[SYNC] Key {} seq {} settled as {}", event.key(), event.sequence(), result);
        } catch (TimeoutException ex) {
            log.warn("[SYNC] Key {} seq {} not projected within {} ms, continuing in the background",
                    event.key(), event.sequence(), timeoutMs);
        } catch (ExecutionException ex) {
            log.error("[SYNC] Projection of key {} seq {} failed: {}",
                    event.key(), event.sequence(), ex.getCause().getMessage(), ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("[SYNC] Interrupted while waiting on key {} seq {}", event.key(), event.sequence());
        }
    }
}
