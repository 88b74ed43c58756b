package com.recaprio.projection.repository;

import com.recaprio.projection.domain.IndexedViewRow;

public interface IndexedViewRepository extends ProjectionRowRepository<IndexedViewRow> {
}
