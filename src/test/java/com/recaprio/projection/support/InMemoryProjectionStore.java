package com.recaprio.projection.support;

import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DerivedRow;
import com.recaprio.projection.model.KeyRange;
import com.recaprio.projection.model.ProjectionMode;
import com.recaprio.projection.store.ProjectionStore;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed store with the same versioning rules as the table stores, plus knobs for
 * failing or slowing down writes.
 */
public class InMemoryProjectionStore implements ProjectionStore {

    private record Slot(DerivedRow row, boolean deleted) { }

    private final ConcurrentSkipListMap<Long, Slot> rows = new ConcurrentSkipListMap<>();
    private final AtomicInteger failingWrites = new AtomicInteger();
    private final AtomicLong slowWriteMillis = new AtomicLong();
    private final AtomicInteger slowWrites = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public ProjectionMode mode() {
        return ProjectionMode.SUMMARY_TABLE;
    }

    @Override
    public Optional<DerivedRow> get(Long key) {
        Slot slot = rows.get(key);
        return slot == null || slot.deleted() ? Optional.empty() : Optional.of(slot.row());
    }

    @Override
    public boolean upsert(Long key, DerivedAttributes attributes, long version) {
        beforeWrite();
        synchronized (this) {
            Slot slot = rows.get(key);
            if (slot != null) {
                long stored = slot.row().sourceVersion();
                if (slot.deleted() ? stored >= version : stored > version) {
                    return false;
                }
            }
            rows.put(key, new Slot(new DerivedRow(key, attributes, Instant.now(), version), false));
            return true;
        }
    }

    @Override
    public boolean remove(Long key, long version) {
        beforeWrite();
        synchronized (this) {
            Slot slot = rows.get(key);
            if (slot != null && !slot.deleted() && slot.row().sourceVersion() > version) {
                return false;
            }
            long tombstoneVersion = slot == null ? version : Math.max(version, slot.row().sourceVersion());
            rows.put(key, new Slot(new DerivedRow(key, new DerivedAttributes(Map.of()), Instant.now(), tombstoneVersion), true));
            return true;
        }
    }

    @Override
    public List<DerivedRow> page(KeyRange range, int limit) {
        List<DerivedRow> page = new ArrayList<>();
        if (range.isEmpty()) {
            return page;
        }
        for (Slot slot : rows.subMap(range.lowerBound(), true, range.upperBound(), true).values()) {
            if (!slot.deleted()) {
                page.add(slot.row());
                if (page.size() == limit) {
                    break;
                }
            }
        }
        return page;
    }

    @Override
    public int purgeRemovedBefore(Instant cutoff) {
        int before = rows.size();
        rows.values().removeIf(Slot::deleted);
        return before - rows.size();
    }

    /** Makes the next {@code count} writes throw a data access failure. */
    public void failNextWrites(int count) {
        failingWrites.set(count);
    }

    /** Makes the next {@code count} writes take {@code millis} before running. */
    public void slowDownNextWrites(int count, long millis) {
        slowWrites.set(count);
        slowWriteMillis.set(millis);
    }

    public int writeCount() {
        return writes.get();
    }

    private void beforeWrite() {
        writes.incrementAndGet();
        if (slowWrites.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            try {
                Thread.sleep(slowWriteMillis.get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        if (failingWrites.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new DataAccessResourceFailureException("projection store unavailable");
        }
    }
}
