package com.recaprio.projection.controller;

import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.DriftRecord;
import com.recaprio.projection.model.KeyRange;
import com.recaprio.projection.model.KeyStatus;
import com.recaprio.projection.model.SweepReport;
import com.recaprio.projection.monitor.ConsistencyMonitor;
import com.recaprio.projection.monitor.DriftLedger;
import com.recaprio.projection.service.BaseRelationService;
import com.recaprio.projection.store.ProjectionStore;
import com.recaprio.projection.sync.Synchronizer;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Operator endpoints: consistency sweeps, open drift, per-key sync status and resync.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SyncAdminController {

    private final ConsistencyMonitor monitor;
    private final DriftLedger driftLedger;
    private final Synchronizer synchronizer;
    private final BaseRelationService baseRelationService;
    private final ProjectionStore store;

    @PostMapping("/monitor/sweep")
    public SweepReport sweep(@RequestParam(required = false) Long from,
                             @RequestParam(required = false) Long to,
                             @RequestParam(required = false) Integer batchSize) {
        KeyRange range = KeyRange.of(from, to);
        return batchSize == null ? monitor.sweep(range) : monitor.sweep(range, batchSize);
    }

    @GetMapping("/monitor/drift")
    public List<DriftRecord> openDrift() {
        return driftLedger.openRecords();
    }

    @GetMapping("/sync/{key}")
    public KeyStatus status(@PathVariable Long key) {
        return synchronizer.status(key);
    }

    /**
     * Re-derives the key from its current base row, or removes its projection when
     * the base row is gone.
     */
    @PostMapping("/sync/{key}/resync")
    public ResponseEntity<KeyStatus> resync(@PathVariable Long key) {
        Optional<BaseRow> current = baseRelationService.find(key);
        if (current.isPresent()) {
            synchronizer.resync(current.get());
        } else {
            long storedVersion = store.get(key)
                    .orElseThrow(() -> new NoSuchElementException("No base row or projection for key " + key))
                    .sourceVersion();
            synchronizer.resyncAbsent(key, storedVersion);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(synchronizer.status(key));
    }
}
