package com.recaprio.projection.domain;

import com.recaprio.projection.model.DerivedAttributes;
import com.recaprio.projection.model.DriftReason;
import com.recaprio.projection.model.DriftRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "drift_records", indexes = {
        @Index(name = "idx_drift_records_open", columnList = "resolved, row_key")
})
public class DriftRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "row_key", nullable = false)
    private Long rowKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DriftReason reason;

    @Convert(converter = AttributeMapConverter.class)
    @Column(length = 2000)
    private Map<String, Object> expected;

    @Convert(converter = AttributeMapConverter.class)
    @Column(length = 2000)
    private Map<String, Object> actual;

    @Column(length = 1024)
    private String detail;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @Column(nullable = false)
    private int occurrences = 1;

    @Column(nullable = false)
    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    public DriftRecordEntity(DriftRecord record) {
        this.rowKey = record.key();
        this.reason = record.reason();
        this.expected = record.expected() == null ? null : record.expected().values();
        this.actual = record.actual() == null ? null : record.actual().values();
        this.detail = truncate(record.detail());
        this.detectedAt = record.detectedAt();
        this.lastSeenAt = record.detectedAt();
    }

    public void seenAgain(DriftRecord record) {
        this.expected = record.expected() == null ? null : record.expected().values();
        this.actual = record.actual() == null ? null : record.actual().values();
        this.detail = truncate(record.detail());
        this.lastSeenAt = record.detectedAt();
        this.occurrences++;
    }

    public DriftRecord toRecord() {
        return new DriftRecord(rowKey,
                expected == null ? null : new DerivedAttributes(expected),
                actual == null ? null : new DerivedAttributes(actual),
                detectedAt, reason, detail);
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= 1024) {
            return detail;
        }
        return detail.substring(0, 1024);
    }
}
