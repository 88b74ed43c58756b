package com.recaprio.projection.store;

import com.recaprio.projection.domain.ProjectionRowEntity;
import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DerivedRow;
import com.recaprio.projection.model.KeyRange;
import com.recaprio.projection.repository.ProjectionRowRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Projection kept in its own table. Removal leaves a tombstone holding the version of
 * the delete so that a write for an older version cannot bring the row back.
 */
public abstract class AbstractTableProjectionStore<E extends ProjectionRowEntity> implements ProjectionStore {

    private final ProjectionRowRepository<E> repository;
    protected final Clock clock;

    protected AbstractTableProjectionStore(ProjectionRowRepository<E> repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    protected abstract E newRow(Long key);

    @Override
    @Transactional(readOnly = true)
    public Optional<DerivedRow> get(Long key) {
        return repository.findById(key)
                .filter(row -> !row.isDeleted())
                .map(ProjectionRowEntity::toDerivedRow);
    }

    @Override
    @Transactional
    public boolean upsert(Long key, DerivedAttributes attributes, long version) {
        E row = repository.findById(key).orElse(null);
        if (row == null) {
            row = newRow(key);
        } else if (row.isDeleted() ? row.getSourceVersion() >= version : row.getSourceVersion() > version) {
            return false;
        } else if (!row.isDeleted() && row.getSourceVersion() == version
                && attributes.matches(new DerivedAttributes(row.getDerivedAttributes()))) {
            return true;
        }
        row.setDerivedAttributes(attributes.values());
        row.setSourceVersion(version);
        row.setLastSyncedAt(clock.instant());
        row.setDeleted(false);
        row.setDeletedAt(null);
        repository.save(row);
        return true;
    }

    @Override
    @Transactional
    public boolean remove(Long key, long version) {
        E row = repository.findById(key).orElse(null);
        if (row == null) {
            row = newRow(key);
        } else if (row.isDeleted()) {
            if (row.getSourceVersion() < version) {
                row.setSourceVersion(version);
                repository.save(row);
            }
            return true;
        } else if (row.getSourceVersion() > version) {
            return false;
        }
        row.setSourceVersion(version);
        row.setDeleted(true);
        row.setDeletedAt(clock.instant());
        repository.save(row);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DerivedRow> page(KeyRange range, int limit) {
        if (range.isEmpty()) {
            return List.of();
        }
        return repository.findByRowKeyBetweenAndDeletedFalseOrderByRowKeyAsc(
                        range.lowerBound(), range.upperBound(), PageRequest.of(0, limit))
                .stream()
                .map(ProjectionRowEntity::toDerivedRow)
                .toList();
    }

    @Override
    @Transactional
    public int purgeRemovedBefore(Instant cutoff) {
        return repository.purgeDeletedBefore(cutoff);
    }
}
