package com.recaprio.projection.jobs;

import com.recaprio.projection.config.SyncProperties;
import com.recaprio.projection.model.KeyRange;
import com.recaprio.projection.model.SweepReport;
import com.recaprio.projection.monitor.ConsistencyMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConsistencySweepJob {

    private final ConsistencyMonitor monitor;
    private final SyncProperties properties;

    @Scheduled(cron = "${app.sync.monitor.cron:0 */15 * * * *}")
    public void run() {
        if (!properties.getMonitor().isEnabled()) {
            return;
        }
        try {
            SweepReport report = monitor.sweep(KeyRange.all());
            log.info("[MONITOR] Scheduled sweep finished: {} checked, {} drifted, {} heal requests",
                    report.checked(), report.drift().size(), report.healed());
        } catch (Exception ex) {
            log.error("[MONITOR] Scheduled sweep failed: {}", ex.getMessage(), ex);
        }
    }
}
