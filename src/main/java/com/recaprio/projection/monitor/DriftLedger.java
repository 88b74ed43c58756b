package com.recaprio.projection.monitor;

import com.recaprio.projection.domain.DriftRecordEntity;
import com.recaprio.projection.model.DriftRecord;
import com.recaprio.projection.repository.DriftRecordRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persistent record of open drift. One open entry per (key, reason); repeated
 * detections bump it instead of adding rows, and only the first one reaches the
 * {@link DriftReportSink}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DriftLedger {

    private final DriftRecordRepository repository;
    private final DriftReportSink sink;
    private final Clock clock;

    // keys with open entries, so that resolving on every successful sync stays cheap
    private final Set<Long> openKeys = ConcurrentHashMap.newKeySet();

    @PostConstruct
    void loadOpenKeys() {
        openKeys.addAll(repository.findOpenKeys());
        if (!openKeys.isEmpty()) {
            log.info("[MONITOR] {} keys have open drift entries", openKeys.size());
        }
    }

    /**
     * @return true when this is a new open entry
     */
    @Transactional
    public boolean report(DriftRecord record) {
        Optional<DriftRecordEntity> open =
                repository.findFirstByRowKeyAndReasonAndResolvedFalse(record.key(), record.reason());
        if (open.isPresent()) {
            open.get().seenAgain(record);
            log.debug("[MONITOR] Drift {} on key {} still open ({} detections)",
                    record.reason(), record.key(), open.get().getOccurrences());
            return false;
        }
        repository.save(new DriftRecordEntity(record));
        afterCommit(() -> openKeys.add(record.key()));
        sink.report(record);
        return true;
    }

    /**
     * Closes every open entry for {@code key}.
     *
     * @return number of entries resolved
     */
    @Transactional
    public int resolveOpen(Long key) {
        if (!openKeys.contains(key)) {
            return 0;
        }
        List<DriftRecordEntity> open = repository.findByRowKeyAndResolvedFalse(key);
        Instant now = clock.instant();
        for (DriftRecordEntity entry : open) {
            entry.setResolved(true);
            entry.setResolvedAt(now);
        }
        afterCommit(() -> openKeys.remove(key));
        if (!open.isEmpty()) {
            log.info("[MONITOR] Resolved {} drift entries for key {}", open.size(), key);
        }
        return open.size();
    }

    @Transactional(readOnly = true)
    public List<DriftRecord> openRecords() {
        return repository.findByResolvedFalseOrderByDetectedAtDesc().stream()
                .map(DriftRecordEntity::toRecord)
                .toList();
    }

    public boolean hasOpenDrift(Long key) {
        return openKeys.contains(key);
    }

    @Transactional
    public int purgeResolvedBefore(Instant cutoff) {
        return repository.purgeResolvedBefore(cutoff);
    }

    // openKeys mirrors committed ledger rows only
    private static void afterCommit(Runnable change) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            change.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                change.run();
            }
        });
    }
}
