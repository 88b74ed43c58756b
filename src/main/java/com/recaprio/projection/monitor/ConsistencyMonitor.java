package com.recaprio.projection.monitor;

import com.recaprio.projection.config.SyncProperties;
import com.recaprio.projection.exception.DomainException;
import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DerivedRow;
import com.recaprio.projection.model.DriftReason;
import com.recaprio.projection.model.DriftRecord;
import com.recaprio.projection.model.KeyRange;
import com.recaprio.projection.model.SweepReport;
import com.recaprio.projection.model.SyncState;
import com.recaprio.projection.rule.DerivationRule;
import com.recaprio.projection.service.BaseRelationService;
import com.recaprio.projection.store.ProjectionScan;
import com.recaprio.projection.store.ProjectionStore;
import com.recaprio.projection.sync.Synchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compares the projection store with a fresh derivation of the base relation.
 *
 * <p>The first pass walks base rows in key order and reports MISMATCH, MISSING or
 * SYNC_FAILED; the second walks the store and reports rows whose base key is gone as
 * ORPHANED. Rows changed within the staleness window, or still pending in the
 * synchronizer, are counted as in flight and not judged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsistencyMonitor {

    private final BaseRelationService baseRelationService;
    private final ProjectionStore store;
    private final DerivationRule rule;
    private final Synchronizer synchronizer;
    private final DriftLedger driftLedger;
    private final SyncProperties properties;
    private final Clock clock;

    public SweepReport sweep(KeyRange range) {
        return sweep(range, properties.getMonitor().getBatchSize());
    }

    public SweepReport sweep(KeyRange range, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, was " + batchSize);
        }
        Instant startedAt = clock.instant();
        Duration window = properties.getStalenessWindow();
        Instant freshAfter = startedAt.minus(window);
        boolean selfHeal = properties.isSelfHeal();
        List<DriftRecord> drift = new ArrayList<>();
        int checked = 0;
        int inFlight = 0;
        int healed = 0;

        log.info("[MONITOR] Sweep of {} started (mode={}, selfHeal={})", range, store.mode(), selfHeal);

        KeyRange remaining = range;
        while (!remaining.isEmpty()) {
            List<BaseRow> batch = baseRelationService.page(remaining, batchSize);
            for (BaseRow row : batch) {
                if (isInFlight(row, window, freshAfter)) {
                    inFlight++;
                    continue;
                }
                checked++;
                Optional<DriftRecord> found = check(row);
                if (found.isPresent()) {
                    drift.add(found.get());
                    driftLedger.report(found.get());
                    if (selfHeal && heal(found.get(), row)) {
                        healed++;
                    }
                }
            }
            if (batch.size() < batchSize) {
                break;
            }
            remaining = remaining.resumeAfter(batch.get(batch.size() - 1).key());
        }

        ProjectionScan scan = store.scan(range, batchSize);
        List<DerivedRow> chunk = new ArrayList<>(batchSize);
        while (scan.hasNext()) {
            chunk.add(scan.next());
            if (chunk.size() == batchSize || !scan.hasNext()) {
                healed += checkOrphans(chunk, drift, selfHeal);
                chunk.clear();
            }
        }

        Instant finishedAt = clock.instant();
        SweepReport report = new SweepReport(range, checked, inFlight, healed, List.copyOf(drift), startedAt, finishedAt);
        if (report.isClean()) {
            log.info("[MONITOR] Sweep of {} clean: {} checked, {} in flight", range, checked, inFlight);
        } else {
            log.warn("[MONITOR] Sweep of {} found {} drifted keys ({} checked, {} in flight, {} heal requests)",
                    range, drift.size(), checked, inFlight, healed);
        }
        return report;
    }

    private boolean isInFlight(BaseRow row, Duration window, Instant freshAfter) {
        if (!window.isZero() && row.updatedAt() != null && row.updatedAt().isAfter(freshAfter)) {
            return true;
        }
        return synchronizer.status(row.key()).state() == SyncState.PENDING;
    }

    private Optional<DriftRecord> check(BaseRow row) {
        Instant now = clock.instant();
        Optional<DerivedRow> stored = store.get(row.key());
        DerivedAttributes actual = stored.map(DerivedRow::attributes).orElse(null);
        DerivedAttributes expected;
        try {
            expected = rule.derive(row);
        } catch (DomainException ex) {
            return Optional.of(new DriftRecord(row.key(), null, actual, now, DriftReason.SYNC_FAILED, ex.getMessage()));
        }
        if (stored.isEmpty()) {
            return Optional.of(new DriftRecord(row.key(), expected, null, now, DriftReason.MISSING, null));
        }
        if (!expected.matches(actual)) {
            return Optional.of(new DriftRecord(row.key(), expected, actual, now, DriftReason.MISMATCH,
                    "stored at version " + stored.get().sourceVersion() + ", base at " + row.version()));
        }
        return Optional.empty();
    }

    private int checkOrphans(List<DerivedRow> chunk, List<DriftRecord> drift, boolean selfHeal) {
        Set<Long> existing = baseRelationService.existingKeys(chunk.stream().map(DerivedRow::key).toList());
        int healed = 0;
        for (DerivedRow row : chunk) {
            if (existing.contains(row.key())) {
                continue;
            }
            DriftRecord orphan = new DriftRecord(row.key(), null, row.attributes(), clock.instant(),
                    DriftReason.ORPHANED, "no base row");
            drift.add(orphan);
            driftLedger.report(orphan);
            if (selfHeal) {
                synchronizer.resyncAbsent(row.key(), row.sourceVersion());
                healed++;
            }
        }
        return healed;
    }

    private boolean heal(DriftRecord record, BaseRow row) {
        if (record.reason() == DriftReason.MISMATCH || record.reason() == DriftReason.MISSING) {
            synchronizer.resync(row);
            return true;
        }
        return false;
    }
}
