package com.recaprio.projection.jobs;

import com.recaprio.projection.domain.MutationOutboxEntry;
import com.recaprio.projection.model.SyncState;
import com.recaprio.projection.outbox.MutationOutboxService;
import com.recaprio.projection.sync.SyncMetrics;
import com.recaprio.projection.sync.Synchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SyncStatisticsJob {

    private static final int PENDING_ALERT_THRESHOLD = 100;
    private static final int FAILED_ALERT_THRESHOLD = 50;

    private final MutationOutboxService outbox;
    private final Synchronizer synchronizer;
    private final SyncMetrics metrics;

    /**
     * Log sync statistics for monitoring
     * Runs every 5 minutes
     */
    @Scheduled(fixedRate = 300000)
    public void logStatistics() {
        try {
            Map<MutationOutboxEntry.Status, Integer> outboxCounts = outbox.countsByStatus();
            Map<SyncState, Long> keyStates = synchronizer.stateCounts();
            int pending = outboxCounts.getOrDefault(MutationOutboxEntry.Status.PENDING, 0);
            int failed = outboxCounts.getOrDefault(MutationOutboxEntry.Status.FAILED, 0);

            log.info("=== SYNC STATISTICS ===");
            log.info("Outbox - Pending: {}, Applied: {}, Superseded: {}, Failed: {}", pending,
                    outboxCounts.get(MutationOutboxEntry.Status.APPLIED),
                    outboxCounts.get(MutationOutboxEntry.Status.SUPERSEDED), failed);
            log.info("Keys - Consistent: {}, Pending: {}, Failed: {}, Absent: {}",
                    keyStates.get(SyncState.CONSISTENT), keyStates.get(SyncState.PENDING),
                    keyStates.get(SyncState.FAILED), keyStates.get(SyncState.ABSENT));
            log.info("Totals - Applied: {}, Retries: {}, Failed: {}, Ordering violations: {}",
                    metrics.getApplied(), metrics.getRetries(), metrics.getFailed(), metrics.getOrderingViolations());
            log.info("=======================");

            if (pending > PENDING_ALERT_THRESHOLD) {
                log.warn("HIGH ALERT: {} pending mutations detected - projection store may be down", pending);
            }
            if (failed > FAILED_ALERT_THRESHOLD) {
                log.warn("HIGH ALERT: {} failed mutations detected - check derivation inputs", failed);
            }
        } catch (Exception ex) {
            log.error("Failed to log sync statistics: {}", ex.getMessage(), ex);
        }
    }
}
