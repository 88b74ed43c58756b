package com.recaprio.projection.jobs;

import com.recaprio.projection.config.SyncProperties;
import com.recaprio.projection.model.ProjectionMode;
import com.recaprio.projection.monitor.DriftLedger;
import com.recaprio.projection.outbox.MutationOutboxService;
import com.recaprio.projection.store.ProjectionStore;
import com.recaprio.projection.sync.Synchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionJob {

    private final ProjectionStore store;
    private final MutationOutboxService outbox;
    private final DriftLedger driftLedger;
    private final Synchronizer synchronizer;
    private final SyncProperties properties;
    private final Clock clock;

    /**
     * Runs daily at 2 AM by default.
     */
    @Scheduled(cron = "${app.sync.retention.cron:0 0 2 * * *}")
    public void run() {
        log.info("Starting retention cleanup");
        Instant now = clock.instant();
        SyncProperties.Retention retention = properties.getRetention();
        try {
            Duration removedRowRetention = store.mode() == ProjectionMode.SUMMARY_TABLE
                    ? retention.getSummarySoftDeleted()
                    : retention.getViewTombstone();
            int rows = store.purgeRemovedBefore(now.minus(removedRowRetention));
            int entries = outbox.purgeFinishedBefore(now.minus(retention.getOutboxApplied()));
            int drift = driftLedger.purgeResolvedBefore(now.minus(retention.getResolvedDrift()));
            int keys = synchronizer.evictIdle(now.minus(retention.getIdleKeyState()));
            log.info("Retention cleanup done: {} removed projection rows, {} outbox entries, "
                    + "{} resolved drift entries, {} idle key states", rows, entries, drift, keys);
        } catch (Exception ex) {
            log.error("Retention cleanup failed: {}", ex.getMessage(), ex);
        }
    }
}
