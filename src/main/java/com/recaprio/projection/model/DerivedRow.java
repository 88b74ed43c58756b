package com.recaprio.projection.model;

import java.time.Instant;

/**
 * A materialized projection row.
 *
 * @param key           same key as the source base row
 * @param attributes    derived values
 * @param lastSyncedAt  when the projection last accepted a write for this key
 * @param sourceVersion commit sequence of the base mutation these values were derived from
 */
public record DerivedRow(
        Long key,
        DerivedAttributes attributes,
        Instant lastSyncedAt,
        long sourceVersion
) { }
