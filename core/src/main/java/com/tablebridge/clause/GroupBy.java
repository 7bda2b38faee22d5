package com.tablebridge.clause;

import java.util.List;
import java.util.Objects;

/**
 * Grouping keys. Repeated GroupBy clauses concatenate their keys.
 *
 * @param columns the grouping columns, in order
 */
public record GroupBy(List<String> columns) implements ClauseSpec {

    public GroupBy {
        Objects.requireNonNull(columns, "columns must not be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("GroupBy requires at least one column");
        }
        columns = List.copyOf(columns);
    }

    public static GroupBy of(String... columns) {
        return new GroupBy(List.of(columns));
    }

    @Override
    public List<String> referencedColumns() {
        return columns;
    }

    @Override
    public String typeName() {
        return "group_by";
    }
}
