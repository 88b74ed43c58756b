package com.recaprio.projection.exception;

/**
 * A base row value lies outside the domain a derivation rule accepts.
 * Affects only the offending row.
 */
public class DomainException extends RuntimeException {

    private final Long key;
    private final String column;
    private final transient Object value;

    public DomainException(Long key, String column, Object value, String reason) {
        super("Key " + key + ": column '" + column + "' = " + value + " " + reason);
        this.key = key;
        this.column = column;
        this.value = value;
    }

    public Long getKey() {
        return key;
    }

    public String getColumn() {
        return column;
    }

    public Object getValue() {
        return value;
    }
}
