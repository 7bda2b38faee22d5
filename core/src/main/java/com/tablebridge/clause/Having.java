package com.tablebridge.clause;

import java.util.List;
import java.util.Objects;

/**
 * Equality predicate applied after grouping, ANDed into the HAVING clause.
 *
 * <p>A Having clause without any {@link GroupBy} is legal; the predicate then
 * applies to the whole result as a single group.
 *
 * @param column the column name
 * @param operator the comparison operator
 * @param value the value to compare with; null compares with IS NULL
 */
public record Having(String column, ComparisonOperator operator, Object value) implements ClauseSpec {

    public Having {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
    }

    public static Having of(String column, String operator, Object value) {
        return new Having(column, ComparisonOperator.fromSymbol(operator), value);
    }

    public static Having equal(String column, Object value) {
        return new Having(column, ComparisonOperator.EQUAL, value);
    }

    @Override
    public List<String> referencedColumns() {
        return List.of(column);
    }

    @Override
    public String typeName() {
        return "having";
    }
}
