package com.recaprio.projection.store;

import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DerivedRow;
import com.recaprio.projection.model.KeyRange;
import com.recaprio.projection.model.ProjectionMode;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Holds the derived rows in one of the physical shapes of {@link ProjectionMode}.
 *
 * <p>Writes are versioned point writes: {@code version} is the commit sequence of the
 * base mutation the values were derived from, and a write never replaces a row
 * stored for a newer sequence. Replaying a write is harmless.
 */
public interface ProjectionStore {

    int DEFAULT_PAGE_SIZE = 500;

    ProjectionMode mode();

    /**
     * Point lookup. Removed rows are never returned.
     */
    Optional<DerivedRow> get(Long key);

    /**
     * Stores {@code attributes} for {@code key} unless a newer version already holds it.
     *
     * @return false when the write was superseded by a newer version or removal
     */
    boolean upsert(Long key, DerivedAttributes attributes, long version);

    /**
     * Removes the row for {@code key} unless a newer version is stored.
     *
     * @return false when a newer live row was kept
     */
    boolean remove(Long key, long version);

    /**
     * Up to {@code limit} live rows of {@code range} in ascending key order.
     */
    List<DerivedRow> page(KeyRange range, int limit);

    default ProjectionScan scan(KeyRange range) {
        return scan(range, DEFAULT_PAGE_SIZE);
    }

    default ProjectionScan scan(KeyRange range, int pageSize) {
        return new ProjectionScan(this, range, pageSize);
    }

    /**
     * Physically drops removed rows older than {@code cutoff}.
     *
     * @return number of rows purged
     */
    int purgeRemovedBefore(Instant cutoff);
}
