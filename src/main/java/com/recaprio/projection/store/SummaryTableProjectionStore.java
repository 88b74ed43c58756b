package com.recaprio.projection.store;

import com.recaprio.projection.domain.SummaryRow;
import com.recaprio.projection.model.ProjectionMode;
import com.recaprio.projection.repository.SummaryRowRepository;

import java.time.Clock;

/**
 * Separate summary table, always written after the base commit. Deleted rows are
 * soft-deleted and kept for the audit retention period.
 */
public class SummaryTableProjectionStore extends AbstractTableProjectionStore<SummaryRow> {

    public SummaryTableProjectionStore(SummaryRowRepository repository, Clock clock) {
        super(repository, clock);
    }

    @Override
    public ProjectionMode mode() {
        return ProjectionMode.SUMMARY_TABLE;
    }

    @Override
    protected SummaryRow newRow(Long key) {
        SummaryRow row = new SummaryRow();
        row.setRowKey(key);
        return row;
    }
}
