package com.tablebridge.clause;

import java.util.Objects;

/**
 * One WHEN branch of a {@link CaseProjection}: when {@code column} equals
 * {@code value}, the projection yields {@code result}.
 *
 * @param column the column compared
 * @param value the value compared with; null compares with IS NULL
 * @param result the value produced when the branch matches (may be null)
 */
public record CaseCondition(String column, Object value, Object result) {

    public CaseCondition {
        Objects.requireNonNull(column, "column must not be null");
    }
}
