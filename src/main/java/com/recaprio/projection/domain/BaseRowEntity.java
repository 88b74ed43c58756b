package com.recaprio.projection.domain;

import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DerivedRow;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A row of the base relation: the latest stat sample of one cluster.
 *
 * <p>The {@code derived_*} columns and {@code last_synced_at} belong to the inline
 * projection and are only written by it. Dynamic updates keep a base write and an
 * inline projection write from overwriting each other's columns.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@DynamicUpdate
@Table(name = "base_rows")
public class BaseRowEntity {

    @Id
    @Column(name = "row_key")
    private Long rowKey;

    @Convert(converter = AttributeMapConverter.class)
    @Column(name = "attributes", length = 4000, nullable = false)
    private Map<String, Object> attributes = new LinkedHashMap<>();

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Convert(converter = AttributeMapConverter.class)
    @Column(name = "derived_attributes", length = 2000)
    private Map<String, Object> derivedAttributes;

    @Column(name = "derived_version")
    private Long derivedVersion;

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    public BaseRowEntity(Long rowKey, Map<String, Object> attributes, long version, Instant updatedAt) {
        this.rowKey = rowKey;
        this.attributes = new LinkedHashMap<>(attributes);
        this.version = version;
        this.updatedAt = updatedAt;
    }

    public BaseRow toBaseRow() {
        return new BaseRow(rowKey, attributes, version, updatedAt);
    }

    public boolean hasProjection() {
        return derivedVersion != null;
    }

    public DerivedRow toDerivedRow() {
        return new DerivedRow(rowKey, new DerivedAttributes(derivedAttributes), lastSyncedAt, derivedVersion);
    }

    public void clearProjection() {
        this.derivedAttributes = null;
        this.derivedVersion = null;
        this.lastSyncedAt = null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BaseRowEntity that = (BaseRowEntity) o;
        return Objects.equals(rowKey, that.rowKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowKey);
    }

    @Override
    public String toString() {
        return "BaseRowEntity{" +
                "rowKey=" + rowKey +
                ", version=" + version +
                ", attributes=" + attributes +
                ", derivedVersion=" + derivedVersion +
                '}';
    }
}
