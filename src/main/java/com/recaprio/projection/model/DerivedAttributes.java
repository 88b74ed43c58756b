package com.recaprio.projection.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Derived column values computed from a single base row.
 */
public record DerivedAttributes(Map<String, Object> values) {

    public DerivedAttributes {
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static DerivedAttributes of(String column, Object value) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(column, value);
        return new DerivedAttributes(values);
    }

    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Value comparison that treats numbers of different boxed types as equal when
     * they denote the same quantity (2.0 and 2 and 2.00), since stored values come
     * back through JSON.
     */
    public boolean matches(DerivedAttributes other) {
        if (other == null || !values.keySet().equals(other.values().keySet())) {
            return false;
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (!sameValue(entry.getValue(), other.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameValue(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return new BigDecimal(l.toString()).compareTo(new BigDecimal(r.toString())) == 0;
        }
        return Objects.equals(left, right);
    }
}
