package com.tablebridge.clause;

import java.util.List;
import java.util.Objects;

/**
 * Equality predicate on a table column, ANDed into the WHERE clause.
 *
 * @param column the column name
 * @param operator the comparison operator
 * @param value the value to compare with; null compares with IS NULL
 */
public record Filter(String column, ComparisonOperator operator, Object value) implements ClauseSpec {

    public Filter {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
    }

    /**
     * Creates a filter from descriptor operator text.
     *
     * @param column the column name
     * @param operator the operator text
     * @param value the value
     * @return the filter
     * @throws IllegalArgumentException if the operator is not supported
     */
    public static Filter of(String column, String operator, Object value) {
        return new Filter(column, ComparisonOperator.fromSymbol(operator), value);
    }

    public static Filter equal(String column, Object value) {
        return new Filter(column, ComparisonOperator.EQUAL, value);
    }

    @Override
    public List<String> referencedColumns() {
        return List.of(column);
    }

    @Override
    public String typeName() {
        return "where";
    }
}
