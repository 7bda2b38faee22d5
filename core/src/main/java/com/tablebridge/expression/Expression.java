package com.tablebridge.expression;

import com.tablebridge.schema.ColumnType;

/**
 * Base interface for the SQL expressions the query builder composes.
 *
 * <p>Expressions appear in:
 * <ul>
 *   <li>the SELECT list (base columns and computed projections)</li>
 *   <li>WHERE and HAVING predicates</li>
 *   <li>GROUP BY keys and window PARTITION BY / ORDER BY lists</li>
 * </ul>
 *
 * <p>Rendering goes through a {@link ParameterBinder}, which decides whether
 * literal values become {@code ?} placeholders or inline SQL literals. All
 * implementations are immutable and compare structurally.
 */
public interface Expression {

    /**
     * Returns the type of the value this expression produces.
     *
     * @return the column type, {@link ColumnType#OTHER} when unknown
     */
    ColumnType dataType();

    /**
     * Renders this expression as SQL.
     *
     * @param binder collects bound parameters, or inlines them in raw-text mode
     * @return the SQL text
     */
    String toSQL(ParameterBinder binder);
}
