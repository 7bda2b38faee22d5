package com.tablebridge.expression;

import com.tablebridge.generator.SQLQuoting;
import com.tablebridge.schema.ColumnType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Expression representing a window function.
 *
 * <p>Window functions compute a value for each row over a set of related
 * rows without collapsing them into groups.
 *
 * <p>Examples:
 * <pre>
 *   rank() OVER (PARTITION BY region ORDER BY amount)
 *   sum(amount) OVER (ORDER BY order_date)
 *   count(order_id) OVER ()
 * </pre>
 *
 * <p>Ranking functions take no argument; {@link #isRankingFunction(String)}
 * lets callers drop the argument for them.
 */
public final class WindowFunction implements Expression {

    private static final Set<String> RANKING_FUNCTIONS =
        Set.of("row_number", "rank", "dense_rank", "percent_rank", "cume_dist");

    private final String function;
    private final List<Expression> arguments;
    private final List<Expression> partitionBy;
    private final List<Expression> orderBy;

    /**
     * Creates a window function.
     *
     * @param function the function name (rank, sum, count, ...)
     * @param arguments the function arguments (empty for ranking functions)
     * @param partitionBy the partition by expressions (empty for no partitioning)
     * @param orderBy the order by expressions (empty for no ordering)
     * @throws IllegalArgumentException if the function name is not a plain identifier
     */
    public WindowFunction(String function,
                          List<Expression> arguments,
                          List<Expression> partitionBy,
                          List<Expression> orderBy) {
        SQLQuoting.validateIdentifier(function);
        this.function = function.toLowerCase(Locale.ROOT);
        this.arguments = new ArrayList<>(
            Objects.requireNonNull(arguments, "arguments must not be null"));
        this.partitionBy = new ArrayList<>(
            Objects.requireNonNull(partitionBy, "partitionBy must not be null"));
        this.orderBy = new ArrayList<>(
            Objects.requireNonNull(orderBy, "orderBy must not be null"));
    }

    /**
     * Returns whether the named function is a ranking function, which takes
     * no argument.
     *
     * @param function the function name, any case
     * @return true for row_number, rank, dense_rank, percent_rank and cume_dist
     */
    public static boolean isRankingFunction(String function) {
        return function != null && RANKING_FUNCTIONS.contains(function.toLowerCase(Locale.ROOT));
    }

    public String function() {
        return function;
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public List<Expression> partitionBy() {
        return Collections.unmodifiableList(partitionBy);
    }

    public List<Expression> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    @Override
    public ColumnType dataType() {
        switch (function) {
            case "row_number":
            case "rank":
            case "dense_rank":
            case "count":
                return ColumnType.BIGINT;
            case "percent_rank":
            case "cume_dist":
            case "avg":
                return ColumnType.DOUBLE;
            default:
                return arguments.isEmpty() ? ColumnType.OTHER : arguments.get(0).dataType();
        }
    }

    @Override
    public String toSQL(ParameterBinder binder) {
        StringBuilder sql = new StringBuilder();

        sql.append(function).append("(");
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(arguments.get(i).toSQL(binder));
        }
        sql.append(") OVER (");

        boolean hasPartition = !partitionBy.isEmpty();

        if (hasPartition) {
            sql.append("PARTITION BY ");
            appendList(sql, partitionBy, binder);
        }

        if (!orderBy.isEmpty()) {
            if (hasPartition) {
                sql.append(" ");
            }
            sql.append("ORDER BY ");
            appendList(sql, orderBy, binder);
        }

        return sql.append(")").toString();
    }

    private static void appendList(StringBuilder sql, List<Expression> expressions, ParameterBinder binder) {
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(expressions.get(i).toSQL(binder));
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WindowFunction)) return false;
        WindowFunction that = (WindowFunction) obj;
        return function.equals(that.function) &&
               arguments.equals(that.arguments) &&
               partitionBy.equals(that.partitionBy) &&
               orderBy.equals(that.orderBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments, partitionBy, orderBy);
    }

    @Override
    public String toString() {
        return "Window(" + function + ", partitions=" + partitionBy.size() +
               ", orderings=" + orderBy.size() + ")";
    }
}
