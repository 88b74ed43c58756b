package com.recaprio.projection.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * One committed change to the base relation.
 *
 * <p>Insert carries {@code after}, Update carries {@code before} and {@code after},
 * Delete carries the key and {@code before} when it is known. {@code sequence} is
 * the global commit sequence; for a given key it grows in commit order.
 */
public record MutationEvent(
        MutationType type,
        Long key,
        BaseRow before,
        BaseRow after,
        long sequence,
        Instant committedAt
) {

    public MutationEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(key, "key");
        if (type != MutationType.DELETE && after == null) {
            throw new IllegalArgumentException(type + " event for key " + key + " has no new row");
        }
    }

    public static MutationEvent insert(BaseRow after, Instant committedAt) {
        return new MutationEvent(MutationType.INSERT, after.key(), null, after, after.version(), committedAt);
    }

    public static MutationEvent update(BaseRow before, BaseRow after, Instant committedAt) {
        return new MutationEvent(MutationType.UPDATE, after.key(), before, after, after.version(), committedAt);
    }

    public static MutationEvent delete(Long key, BaseRow before, long sequence, Instant committedAt) {
        return new MutationEvent(MutationType.DELETE, key, before, null, sequence, committedAt);
    }

    /**
     * Columns touched by this mutation. Inserts touch every column of the new row;
     * an update without a known previous row is treated the same way.
     */
    public Set<String> changedColumns() {
        return switch (type) {
            case INSERT -> after.attributes().keySet();
            case UPDATE -> before == null ? after.attributes().keySet() : before.changedColumns(after);
            case DELETE -> before == null ? Set.of() : before.attributes().keySet();
        };
    }
}
