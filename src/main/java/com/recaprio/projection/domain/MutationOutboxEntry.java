package com.recaprio.projection.domain;

import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.MutationEvent;
import com.recaprio.projection.model.MutationType;
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

import java.time.Instant;
import java.util.Map;

/**
 * Durable record of one base mutation. The generated id is the mutation's commit
 * sequence.
 */
@Entity
@Table(name = "mutation_outbox", indexes = {
        @Index(name = "idx_mutation_outbox_status", columnList = "status, last_attempt")
})
public class MutationOutboxEntry {

    public enum Status {
        PENDING, APPLIED, SUPERSEDED, FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "row_key", nullable = false)
    private Long rowKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "mutation_type", nullable = false, length = 16)
    private MutationType type;

    @Convert(converter = AttributeMapConverter.class)
    @Column(name = "before_attributes", length = 4000)
    private Map<String, Object> beforeAttributes;

    @Column(name = "before_version")
    private Long beforeVersion;

    @Column(name = "before_updated_at")
    private Instant beforeUpdatedAt;

    @Convert(converter = AttributeMapConverter.class)
    @Column(name = "after_attributes", length = 4000)
    private Map<String, Object> afterAttributes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.PENDING;

    @Column(name = "attempts")
    private int attempts = 0;

    @Column(name = "last_error", length = 1024)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_attempt", nullable = false)
    private Instant lastAttempt;

    protected MutationOutboxEntry() {
    }

    public MutationOutboxEntry(MutationType type, Long rowKey, BaseRow before,
                               Map<String, Object> afterAttributes, Instant createdAt) {
        this.type = type;
        this.rowKey = rowKey;
        if (before != null) {
            this.beforeAttributes = before.attributes();
            this.beforeVersion = before.version();
            this.beforeUpdatedAt = before.updatedAt();
        }
        this.afterAttributes = afterAttributes;
        this.createdAt = createdAt;
        this.lastAttempt = createdAt;
    }

    /**
     * Rebuilds the event this entry recorded.
     */
    public MutationEvent toEvent() {
        BaseRow before = beforeVersion == null
                ? null
                : new BaseRow(rowKey, beforeAttributes, beforeVersion, beforeUpdatedAt);
        return switch (type) {
            case INSERT -> MutationEvent.insert(new BaseRow(rowKey, afterAttributes, id, createdAt), createdAt);
            case UPDATE -> MutationEvent.update(before, new BaseRow(rowKey, afterAttributes, id, createdAt), createdAt);
            case DELETE -> MutationEvent.delete(rowKey, before, id, createdAt);
        };
    }

    public Long getId() {
        return id;
    }

    public Long getRowKey() {
        return rowKey;
    }

    public MutationType getType() {
        return type;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAttempt() {
        return lastAttempt;
    }

    public void setLastAttempt(Instant lastAttempt) {
        this.lastAttempt = lastAttempt;
    }
}
