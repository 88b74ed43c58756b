package com.recaprio.projection.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Summary table row. Deletes are soft and kept for audit until the retention job
 * purges them.
 */
@Entity
@Table(name = "projection_summary", indexes = {
        @Index(name = "idx_projection_summary_live", columnList = "deleted, row_key"),
        @Index(name = "idx_projection_summary_deleted_at", columnList = "deleted_at")
})
public class SummaryRow extends ProjectionRowEntity {
}
