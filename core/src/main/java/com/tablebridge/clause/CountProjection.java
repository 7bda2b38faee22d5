package com.tablebridge.clause;

import java.util.List;
import java.util.Objects;

/**
 * Computed column counting the non-null values of {@code column}, aliased
 * to the column name.
 *
 * @param column the counted column
 */
public record CountProjection(String column) implements ClauseSpec {

    public CountProjection {
        Objects.requireNonNull(column, "column must not be null");
    }

    @Override
    public List<String> referencedColumns() {
        return List.of(column);
    }

    @Override
    public String typeName() {
        return "count";
    }
}
