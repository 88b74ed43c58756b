package com.recaprio.projection.domain;

import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DerivedRow;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Map;

/**
 * Columns shared by the projection tables that live apart from the base relation.
 * A removed row stays behind as a tombstone ({@code deleted = true}) carrying the
 * sequence of the delete, so a late write for an older sequence cannot resurrect it.
 */
@Getter
@Setter
@MappedSuperclass
public abstract class ProjectionRowEntity {

    @Id
    @Column(name = "row_key")
    private Long rowKey;

    @Convert(converter = AttributeMapConverter.class)
    @Column(name = "derived_attributes", length = 2000)
    private Map<String, Object> derivedAttributes;

    @Column(name = "source_version", nullable = false)
    private long sourceVersion;

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public DerivedRow toDerivedRow() {
        return new DerivedRow(rowKey, new DerivedAttributes(derivedAttributes), lastSyncedAt, sourceVersion);
    }
}
