package com.tablebridge.generator;

import com.tablebridge.query.ExecutionMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text ready for execution, with the values bound to its placeholders.
 *
 * @param sql the statement text
 * @param parameters placeholder values in order (always empty in raw-text mode)
 * @param mode how the statement must be executed
 */
public record RenderedStatement(String sql, List<Object> parameters, ExecutionMode mode) {

    public RenderedStatement {
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        // List.copyOf rejects null elements, and null is a legitimate bound value
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        if (mode == ExecutionMode.RAW_TEXT && !parameters.isEmpty()) {
            throw new IllegalArgumentException("Raw-text statements cannot carry bound parameters");
        }
    }

    /**
     * Creates a raw-text statement from caller-supplied SQL.
     *
     * @param sql the statement text
     * @return the statement
     */
    public static RenderedStatement rawText(String sql) {
        return new RenderedStatement(sql, List.of(), ExecutionMode.RAW_TEXT);
    }

    public boolean isRawText() {
        return mode == ExecutionMode.RAW_TEXT;
    }
}
