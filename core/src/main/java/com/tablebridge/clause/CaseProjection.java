package com.tablebridge.clause;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computed column evaluating its conditions in listed order; the first
 * matching condition wins, otherwise the default is produced.
 *
 * @param outputName the name of the computed column
 * @param conditions the WHEN branches, in evaluation order
 * @param defaultValue the ELSE value; null means the column is NULL when nothing matches
 */
public record CaseProjection(String outputName, List<CaseCondition> conditions, Object defaultValue)
    implements ClauseSpec {

    public CaseProjection {
        Objects.requireNonNull(outputName, "outputName must not be null");
        Objects.requireNonNull(conditions, "conditions must not be null");
        if (outputName.isEmpty()) {
            throw new IllegalArgumentException("outputName must not be empty");
        }
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("CaseProjection requires at least one condition");
        }
        conditions = List.copyOf(conditions);
    }

    @Override
    public List<String> referencedColumns() {
        List<String> columns = new ArrayList<>(conditions.size());
        for (CaseCondition condition : conditions) {
            columns.add(condition.column());
        }
        return columns;
    }

    @Override
    public String typeName() {
        return "case_if";
    }
}
