package com.recaprio.projection.jobs;

import com.recaprio.projection.config.SyncProperties;
import com.recaprio.projection.domain.MutationOutboxEntry;
import com.recaprio.projection.outbox.MutationOutboxService;
import com.recaprio.projection.sync.Synchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Replays mutations whose projection was never confirmed, e.g. after a crash between
 * the base commit and the asynchronous projection write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxRelayJob {

    private final MutationOutboxService outbox;
    private final Synchronizer synchronizer;
    private final SyncProperties properties;

    @Scheduled(fixedDelayString = "${app.sync.outbox.relay-interval-ms:30000}")
    public void relay() {
        try {
            List<MutationOutboxEntry> stale = outbox.findStalePending(
                    properties.getOutbox().getRelayGrace(), properties.getOutbox().getRelayBatchSize());
            if (stale.isEmpty()) {
                return;
            }
            log.info("[OUTBOX] Replaying {} unconfirmed mutations", stale.size());
            for (MutationOutboxEntry entry : stale) {
                synchronizer.replay(entry.toEvent());
            }
        } catch (Exception ex) {
            log.error("[OUTBOX] Relay failed: {}", ex.getMessage(), ex);
        }
    }
}
