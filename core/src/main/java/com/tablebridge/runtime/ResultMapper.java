package com.tablebridge.runtime;

import com.tablebridge.exception.ProjectionMismatchException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pairs raw result tuples with projection names.
 */
public final class ResultMapper {

    private ResultMapper() {
    }

    /**
     * Maps raw tuples to rows.
     *
     * @param projectionNames the output column names, in projection order
     * @param rows the raw tuples returned by execution
     * @return one row per tuple, in input order; empty for an empty batch
     * @throws ProjectionMismatchException if any tuple's size differs from the projection's
     */
    public static List<ResultRow> mapRows(List<String> projectionNames, List<? extends List<?>> rows) {
        Objects.requireNonNull(projectionNames, "projectionNames must not be null");
        Objects.requireNonNull(rows, "rows must not be null");

        // Check every arity first so a bad batch yields no partial result
        for (List<?> row : rows) {
            if (row.size() != projectionNames.size()) {
                throw new ProjectionMismatchException(projectionNames.size(), row.size());
            }
        }

        List<ResultRow> mapped = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            mapped.add(new ResultRow(projectionNames, row));
        }
        return mapped;
    }
}
