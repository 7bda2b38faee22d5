package com.tablebridge.query;

import com.tablebridge.clause.Filter;
import com.tablebridge.exception.UnknownColumnException;
import com.tablebridge.expression.ColumnExpression;
import com.tablebridge.expression.ComparisonExpression;
import com.tablebridge.expression.Literal;
import com.tablebridge.expression.ParameterBinder;
import com.tablebridge.generator.RenderedStatement;
import com.tablebridge.schema.TableSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.tablebridge.generator.SQLQuoting.quoteIdentifierIfNeeded;

/**
 * Builds parameterized INSERT, UPDATE and DELETE statements against a
 * resolved table.
 *
 * <p>Every column is validated against the schema before any SQL is
 * produced. Filters use the same equality semantics as query filters and are
 * ANDed; an update or delete without filters affects every row.
 *
 * <p>These statements are not idempotent and must never be retried blindly.
 */
public class MutationBuilder {

    /**
     * Builds {@code INSERT INTO schema.table (c1, c2) VALUES (?, ?)} for one row.
     *
     * @param schema the resolved table schema
     * @param row column name to value, in column order of the statement
     * @return the insert statement
     * @throws UnknownColumnException if the row names an unknown column
     * @throws IllegalArgumentException if the row is empty
     */
    public RenderedStatement insert(TableSchema schema, Map<String, ?> row) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(row, "row must not be null");
        if (row.isEmpty()) {
            throw new IllegalArgumentException("Cannot insert an empty row into " + schema.qualifiedName());
        }

        ParameterBinder binder = ParameterBinder.parameterized();
        List<String> columns = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (Map.Entry<String, ?> entry : row.entrySet()) {
            columns.add(quoteIdentifierIfNeeded(schema.column(entry.getKey()).name()));
            values.add(Literal.of(entry.getValue()).toSQL(binder));
        }

        String sql = "INSERT INTO " + schema.toSQL() +
                     " (" + String.join(", ", columns) + ")" +
                     " VALUES (" + String.join(", ", values) + ")";
        return new RenderedStatement(sql, binder.parameters(), ExecutionMode.PARAMETERIZED);
    }

    /**
     * Builds {@code UPDATE schema.table SET c1 = ?, ... [WHERE ...]}.
     *
     * @param schema the resolved table schema
     * @param values column name to new value
     * @param filters equality filters selecting the rows to update
     * @return the update statement
     * @throws UnknownColumnException if a value or filter names an unknown column
     * @throws IllegalArgumentException if there are no values to set
     */
    public RenderedStatement update(TableSchema schema, Map<String, ?> values, List<Filter> filters) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(filters, "filters must not be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Update of " + schema.qualifiedName() + " sets no columns");
        }
        validateFilters(schema, filters);

        ParameterBinder binder = ParameterBinder.parameterized();
        List<String> assignments = new ArrayList<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String column = quoteIdentifierIfNeeded(schema.column(entry.getKey()).name());
            assignments.add(column + " = " + Literal.of(entry.getValue()).toSQL(binder));
        }

        String sql = "UPDATE " + schema.toSQL() + " SET " + String.join(", ", assignments) +
                     whereClause(schema, filters, binder);
        return new RenderedStatement(sql, binder.parameters(), ExecutionMode.PARAMETERIZED);
    }

    /**
     * Builds {@code DELETE FROM schema.table [WHERE ...]}.
     *
     * @param schema the resolved table schema
     * @param filters equality filters selecting the rows to delete
     * @return the delete statement
     * @throws UnknownColumnException if a filter names an unknown column
     */
    public RenderedStatement delete(TableSchema schema, List<Filter> filters) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(filters, "filters must not be null");
        validateFilters(schema, filters);

        ParameterBinder binder = ParameterBinder.parameterized();
        String sql = "DELETE FROM " + schema.toSQL() + whereClause(schema, filters, binder);
        return new RenderedStatement(sql, binder.parameters(), ExecutionMode.PARAMETERIZED);
    }

    private static void validateFilters(TableSchema schema, List<Filter> filters) {
        for (Filter filter : filters) {
            schema.column(filter.column());
        }
    }

    private static String whereClause(TableSchema schema, List<Filter> filters, ParameterBinder binder) {
        if (filters.isEmpty()) {
            return "";
        }
        List<String> terms = new ArrayList<>();
        for (Filter filter : filters) {
            ComparisonExpression term = new ComparisonExpression(
                new ColumnExpression(schema.column(filter.column())), filter.operator(), Literal.of(filter.value()));
            terms.add(term.toSQL(binder));
        }
        return " WHERE " + String.join(" AND ", terms);
    }
}
