package com.recaprio.projection.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(name = "projection_view", indexes = {
        @Index(name = "idx_projection_view_live", columnList = "deleted, row_key")
})
public class IndexedViewRow extends ProjectionRowEntity {
}
