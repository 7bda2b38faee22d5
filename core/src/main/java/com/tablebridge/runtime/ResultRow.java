package com.tablebridge.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One result row: output column name to value, in projection order.
 *
 * <p>Rows are created fresh for each execution and are immutable. If a
 * projection repeats an output name, the row keeps the first position and
 * the last value for that name.
 */
public final class ResultRow {

    private final Map<String, Object> values;

    /**
     * Creates a row by pairing names with values positionally.
     *
     * @param names the projection names
     * @param values the row values (same size as names; nulls allowed)
     */
    public ResultRow(List<String> names, List<?> values) {
        Objects.requireNonNull(names, "names must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (names.size() != values.size()) {
            throw new IllegalArgumentException(
                "names and values must have the same size: " + names.size() + " vs " + values.size());
        }

        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            map.put(names.get(i), values.get(i));
        }
        this.values = Collections.unmodifiableMap(map);
    }

    /**
     * Returns the value of a column.
     *
     * @param column the output column name
     * @return the value, possibly null
     * @throws IllegalArgumentException if the row has no such column
     */
    public Object get(String column) {
        if (!values.containsKey(column)) {
            throw new IllegalArgumentException("No column '" + column + "' in row " + values.keySet());
        }
        return values.get(column);
    }

    public List<String> columnNames() {
        return new ArrayList<>(values.keySet());
    }

    /**
     * Returns the row as an unmodifiable ordered map.
     *
     * @return the column name to value map
     */
    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ResultRow)) return false;
        ResultRow that = (ResultRow) obj;
        return new ArrayList<>(values.entrySet()).equals(new ArrayList<>(that.values.entrySet()));
    }

    @Override
    public int hashCode() {
        return new ArrayList<>(values.entrySet()).hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
