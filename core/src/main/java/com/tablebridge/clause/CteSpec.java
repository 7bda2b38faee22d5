package com.tablebridge.clause;

import com.tablebridge.generator.SQLQuoting;

import java.util.List;
import java.util.Objects;

/**
 * Named common table expression rendered as
 * {@code name AS (SELECT <columns> <queryTail>)}.
 *
 * <p>The query tail is raw SQL text and is emitted unchanged. Any CteSpec
 * switches the whole query to raw-text execution, so CTEs must never be
 * built from untrusted input.
 *
 * @param name the CTE name
 * @param columns the selected columns
 * @param queryTail raw text following the column list, typically FROM ... WHERE ...
 */
public record CteSpec(String name, List<String> columns, String queryTail) implements ClauseSpec {

    public CteSpec {
        SQLQuoting.validateIdentifier(name);
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(queryTail, "queryTail must not be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("CteSpec requires at least one column");
        }
        columns = List.copyOf(columns);
    }

    @Override
    public List<String> referencedColumns() {
        return columns;
    }

    @Override
    public String typeName() {
        return "cte";
    }
}
