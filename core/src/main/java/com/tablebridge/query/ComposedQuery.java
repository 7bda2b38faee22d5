package com.tablebridge.query;

import com.tablebridge.clause.ClauseSpec;
import com.tablebridge.clause.CteSpec;
import com.tablebridge.expression.AliasExpression;
import com.tablebridge.expression.ColumnExpression;
import com.tablebridge.expression.Expression;
import com.tablebridge.schema.TableSchema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fully folded, ready-to-render query produced by {@link QueryBuilder}.
 *
 * <p>Values compare structurally, so building twice from the same inputs
 * yields equal queries.
 *
 * @param table the resolved table the query reads from
 * @param projection output columns in final order: base columns, then computed columns in clause order
 * @param ctes common table expressions, non-empty only in raw-text mode
 * @param filter WHERE terms, ANDed (empty means no WHERE)
 * @param groupBy GROUP BY keys in order
 * @param having HAVING terms, ANDed (empty means no HAVING)
 * @param mode parameterized or raw-text execution
 * @param excludedClauses Filter, GroupBy and Having clauses that were validated
 *        but left out of a raw-text statement
 */
public record ComposedQuery(TableSchema table,
                            List<AliasExpression> projection,
                            List<CteSpec> ctes,
                            List<Expression> filter,
                            List<ColumnExpression> groupBy,
                            List<Expression> having,
                            ExecutionMode mode,
                            List<ClauseSpec> excludedClauses) {

    public ComposedQuery {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        projection = List.copyOf(projection);
        ctes = List.copyOf(ctes);
        filter = List.copyOf(filter);
        groupBy = List.copyOf(groupBy);
        having = List.copyOf(having);
        excludedClauses = List.copyOf(excludedClauses);
    }

    /**
     * Returns the output column names in projection order. Result tuples are
     * mapped positionally against this list.
     *
     * @return the projection names
     */
    public List<String> projectionNames() {
        List<String> names = new ArrayList<>(projection.size());
        for (AliasExpression column : projection) {
            names.add(column.alias());
        }
        return names;
    }

    /**
     * Returns output names that occur more than once in the projection, in
     * order of their second occurrence. A mapped row keeps only the last
     * value for such a name.
     *
     * @return the repeated names, empty when every name is unique
     */
    public List<String> duplicateProjectionNames() {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (AliasExpression column : projection) {
            if (!seen.add(column.alias())) {
                duplicates.add(column.alias());
            }
        }
        return new ArrayList<>(duplicates);
    }

    public boolean isRawText() {
        return mode == ExecutionMode.RAW_TEXT;
    }
}
