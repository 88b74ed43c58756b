package com.recaprio.projection.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of one row of the base relation.
 *
 * @param key        primary key of the row (the cluster id)
 * @param attributes raw column values, the inputs to derivation
 * @param version    commit sequence of the mutation that produced this snapshot
 * @param updatedAt  commit time of that mutation
 */
public record BaseRow(
        Long key,
        Map<String, Object> attributes,
        long version,
        Instant updatedAt
) {

    public BaseRow {
        Objects.requireNonNull(key, "key");
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Object get(String column) {
        return attributes.get(column);
    }

    public boolean has(String column) {
        return attributes.containsKey(column);
    }

    /**
     * Columns whose value differs between this snapshot and {@code other},
     * including columns present on only one side.
     */
    public Set<String> changedColumns(BaseRow other) {
        Set<String> changed = new LinkedHashSet<>();
        Set<String> columns = new LinkedHashSet<>(attributes.keySet());
        columns.addAll(other.attributes().keySet());
        for (String column : columns) {
            if (has(column) != other.has(column) || !Objects.equals(get(column), other.get(column))) {
                changed.add(column);
            }
        }
        return changed;
    }
}
