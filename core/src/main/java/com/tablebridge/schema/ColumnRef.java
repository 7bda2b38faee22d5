package com.tablebridge.schema;

import java.util.Objects;

/**
 * Handle to a column of a resolved {@link TableSchema}.
 *
 * <p>Column references are only created by schema resolution and are the only
 * way the query builder refers to columns. Equality is by column name.
 */
public final class ColumnRef {

    private final String name;
    private final ColumnType type;
    private final boolean nullable;

    /**
     * Creates a column reference.
     *
     * @param name the column name
     * @param type the column type
     * @param nullable whether the column accepts nulls
     */
    public ColumnRef(String name, ColumnType type, boolean nullable) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.nullable = nullable;
    }

    public String name() {
        return name;
    }

    public ColumnType type() {
        return type;
    }

    public boolean nullable() {
        return nullable;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnRef)) return false;
        return name.equals(((ColumnRef) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + ": " + type + (nullable ? "" : " NOT NULL");
    }
}
