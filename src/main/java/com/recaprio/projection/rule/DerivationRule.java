package com.recaprio.projection.rule;

import com.recaprio.projection.exception.DomainException;
import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.DerivedAttributes;

import java.util.Set;

/**
 * Pure mapping from a base row to its derived attributes.
 *
 * <p>Implementations must be deterministic over {@link #inputColumns()} and must not
 * perform I/O or read mutable shared state: the synchronizer and the consistency
 * monitor both call {@link #derive(BaseRow)} and expect identical answers.
 */
public interface DerivationRule {

    String name();

    /** Base columns the rule reads. Updates touching none of them skip derivation. */
    Set<String> inputColumns();

    Set<String> outputColumns();

    /**
     * @throws DomainException when an input is outside the rule's valid domain
     */
    DerivedAttributes derive(BaseRow row);

    default boolean isAffectedBy(Set<String> changedColumns) {
        for (String column : changedColumns) {
            if (inputColumns().contains(column)) {
                return true;
            }
        }
        return false;
    }
}
