package com.recaprio.projection.model;

import java.time.Instant;

/**
 * Divergence between the projection and what re-derivation would produce.
 *
 * @param key        affected key
 * @param expected   value re-derivation produces, null when derivation itself failed
 * @param actual     stored value, null when nothing is stored
 * @param detectedAt detection time
 * @param reason     drift classification
 * @param detail     free-form diagnostic, may be null
 */
public record DriftRecord(
        Long key,
        DerivedAttributes expected,
        DerivedAttributes actual,
        Instant detectedAt,
        DriftReason reason,
        String detail
) { }
