package com.recaprio.projection.model;

/**
 * Physical shape of the projection store. Bound from {@code app.sync.mode}
 * ({@code inline}, {@code indexed-view}, {@code summary-table}).
 */
public enum ProjectionMode {
    INLINE,
    INDEXED_VIEW,
    SUMMARY_TABLE
}
