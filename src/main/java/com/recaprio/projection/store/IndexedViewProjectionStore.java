package com.recaprio.projection.store;

import com.recaprio.projection.domain.IndexedViewRow;
import com.recaprio.projection.model.ProjectionMode;
import com.recaprio.projection.repository.IndexedViewRepository;

import java.time.Clock;

/**
 * Separate table keyed and ordered by the base key. With a zero staleness window its
 * writes join the base write's transaction, so base and view commit together.
 */
public class IndexedViewProjectionStore extends AbstractTableProjectionStore<IndexedViewRow> {

    public IndexedViewProjectionStore(IndexedViewRepository repository, Clock clock) {
        super(repository, clock);
    }

    @Override
    public ProjectionMode mode() {
        return ProjectionMode.INDEXED_VIEW;
    }

    @Override
    protected IndexedViewRow newRow(Long key) {
        IndexedViewRow row = new IndexedViewRow();
        row.setRowKey(key);
        return row;
    }
}
