package com.recaprio.projection.store;

import com.recaprio.projection.domain.BaseRowEntity;
import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DerivedRow;
import com.recaprio.projection.model.KeyRange;
import com.recaprio.projection.model.ProjectionMode;
import com.recaprio.projection.repository.BaseRowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Derived values kept in columns of the base row itself. A projection write is a
 * single row update; deleting the base row deletes the projection with it.
 */
@Slf4j
@RequiredArgsConstructor
public class InlineProjectionStore implements ProjectionStore {

    private final BaseRowRepository baseRowRepository;
    private final Clock clock;

    @Override
    public ProjectionMode mode() {
        return ProjectionMode.INLINE;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DerivedRow> get(Long key) {
        return baseRowRepository.findById(key)
                .filter(BaseRowEntity::hasProjection)
                .map(BaseRowEntity::toDerivedRow);
    }

    @Override
    @Transactional
    public boolean upsert(Long key, DerivedAttributes attributes, long version) {
        Optional<BaseRowEntity> found = baseRowRepository.findForUpdate(key);
        if (found.isEmpty()) {
            log.debug("[SYNC] Inline upsert for key {} v{} skipped, base row is gone", key, version);
            return false;
        }
        BaseRowEntity row = found.get();
        if (row.getDerivedVersion() != null && row.getDerivedVersion() > version) {
            return false;
        }
        if (row.getDerivedVersion() != null && row.getDerivedVersion() == version
                && attributes.matches(new DerivedAttributes(row.getDerivedAttributes()))) {
            return true;
        }
        row.setDerivedAttributes(attributes.values());
        row.setDerivedVersion(version);
        row.setLastSyncedAt(clock.instant());
        baseRowRepository.save(row);
        return true;
    }

    @Override
    @Transactional
    public boolean remove(Long key, long version) {
        Optional<BaseRowEntity> found = baseRowRepository.findForUpdate(key);
        if (found.isEmpty()) {
            return true;
        }
        BaseRowEntity row = found.get();
        if (row.getVersion() > version || (row.getDerivedVersion() != null && row.getDerivedVersion() > version)) {
            return false;
        }
        if (row.hasProjection()) {
            row.clearProjection();
            baseRowRepository.save(row);
        }
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DerivedRow> page(KeyRange range, int limit) {
        if (range.isEmpty()) {
            return List.of();
        }
        return baseRowRepository.findByRowKeyBetweenAndDerivedVersionNotNullOrderByRowKeyAsc(
                        range.lowerBound(), range.upperBound(), PageRequest.of(0, limit))
                .stream()
                .map(BaseRowEntity::toDerivedRow)
                .toList();
    }

    /**
     * Nothing to purge: inline projections disappear with their base row.
     */
    @Override
    public int purgeRemovedBefore(Instant cutoff) {
        return 0;
    }
}
