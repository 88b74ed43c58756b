package com.recaprio.projection.model;

/**
 * Half-open key range {@code [fromInclusive, toExclusive)}. A null bound is unbounded.
 */
public record KeyRange(Long fromInclusive, Long toExclusive) {

    private static final KeyRange EMPTY = new KeyRange(0L, 0L);

    public static KeyRange all() {
        return new KeyRange(null, null);
    }

    public static KeyRange of(Long fromInclusive, Long toExclusive) {
        return new KeyRange(fromInclusive, toExclusive);
    }

    public long lowerBound() {
        return fromInclusive == null ? Long.MIN_VALUE : fromInclusive;
    }

    /** Inclusive upper bound, for repository range queries. */
    public long upperBound() {
        return toExclusive == null ? Long.MAX_VALUE : toExclusive - 1;
    }

    public boolean isEmpty() {
        if (toExclusive != null && toExclusive == Long.MIN_VALUE) {
            return true;
        }
        return lowerBound() > upperBound();
    }

    public boolean contains(long key) {
        return !isEmpty() && key >= lowerBound() && key <= upperBound();
    }

    /**
     * The remainder of this range after {@code cursor}, the last key already seen.
     */
    public KeyRange resumeAfter(Long cursor) {
        if (cursor == null) {
            return this;
        }
        if (cursor == Long.MAX_VALUE) {
            return EMPTY;
        }
        long next = Math.max(cursor + 1, lowerBound());
        return new KeyRange(next, toExclusive);
    }
}
