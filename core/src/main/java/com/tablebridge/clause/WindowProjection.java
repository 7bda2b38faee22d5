package com.tablebridge.clause;

import com.tablebridge.generator.SQLQuoting;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computed column holding a windowed aggregate of {@code column}.
 *
 * <p>The window is partitioned and ordered when both {@code partitionBy}
 * and {@code orderBy} are given, only ordered when only {@code orderBy} is
 * given, and empty otherwise. A partition list without an order list is
 * not applied.
 *
 * @param outputName the name of the computed column
 * @param functionName the window or aggregate function, e.g. "rank", "sum"
 * @param column the function argument column
 * @param partitionBy partition columns (empty when absent)
 * @param orderBy order columns (empty when absent)
 */
public record WindowProjection(String outputName,
                               String functionName,
                               String column,
                               List<String> partitionBy,
                               List<String> orderBy) implements ClauseSpec {

    public WindowProjection {
        Objects.requireNonNull(outputName, "outputName must not be null");
        Objects.requireNonNull(column, "column must not be null");
        if (outputName.isEmpty()) {
            throw new IllegalArgumentException("outputName must not be empty");
        }
        // The function name is emitted verbatim, so it must be a plain identifier
        SQLQuoting.validateIdentifier(functionName);
        partitionBy = partitionBy == null ? List.of() : List.copyOf(partitionBy);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }

    @Override
    public List<String> referencedColumns() {
        List<String> columns = new ArrayList<>();
        columns.add(column);
        columns.addAll(partitionBy);
        columns.addAll(orderBy);
        return columns;
    }

    @Override
    public String typeName() {
        return "window_function";
    }
}
