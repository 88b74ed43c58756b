package com.recaprio.projection.repository;

import com.recaprio.projection.domain.SummaryRow;

public interface SummaryRowRepository extends ProjectionRowRepository<SummaryRow> {
}
