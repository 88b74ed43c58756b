package com.recaprio.projection.model.dto;

import com.recaprio.projection.model.DerivedRow;

import java.time.Instant;
import java.util.Map;

/**
 * Read API shape of a projection row.
 */
public record ProjectionView(
        Long key,
        Map<String, Object> derivedAttributes,
        Instant lastSyncedAt
) {

    public static ProjectionView from(DerivedRow row) {
        return new ProjectionView(row.key(), row.attributes().values(), row.lastSyncedAt());
    }
}
