package com.tablebridge.schema;

import com.tablebridge.exception.UnknownColumnException;
import com.tablebridge.generator.SQLQuoting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a table's columns, in ordinal order.
 *
 * <p>A schema belongs to the call that resolved it. It is never cached or
 * shared between calls.
 */
public final class TableSchema {

    private final String schemaName;
    private final String tableName;
    private final Map<String, ColumnRef> columns;

    /**
     * Creates a table schema.
     *
     * @param schemaName the owning schema namespace
     * @param tableName the table name
     * @param columns the columns in ordinal order
     * @throws IllegalArgumentException if two columns share a name
     */
    public TableSchema(String schemaName, String tableName, List<ColumnRef> columns) {
        this.schemaName = Objects.requireNonNull(schemaName, "schemaName must not be null");
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        Objects.requireNonNull(columns, "columns must not be null");

        Map<String, ColumnRef> byName = new LinkedHashMap<>();
        for (ColumnRef column : columns) {
            if (byName.put(column.name(), column) != null) {
                throw new IllegalArgumentException("Duplicate column: " + column.name());
            }
        }
        this.columns = Collections.unmodifiableMap(byName);
    }

    public String schemaName() {
        return schemaName;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Returns the columns keyed by name, in ordinal order.
     *
     * @return an unmodifiable ordered map
     */
    public Map<String, ColumnRef> columns() {
        return columns;
    }

    /**
     * Returns the column names in ordinal order.
     *
     * @return the column names
     */
    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Looks up a column by its exact name.
     *
     * @param name the column name
     * @return the column reference
     * @throws UnknownColumnException if the table has no such column
     */
    public ColumnRef column(String name) {
        ColumnRef column = name == null ? null : columns.get(name);
        if (column == null) {
            throw new UnknownColumnException(name, qualifiedName());
        }
        return column;
    }

    /**
     * Returns the dotted {@code schema.table} name, for messages.
     *
     * @return the qualified name
     */
    public String qualifiedName() {
        return schemaName + "." + tableName;
    }

    /**
     * Returns the {@code schema.table} reference as it appears in generated SQL.
     *
     * @return the quoted-if-needed table reference
     */
    public String toSQL() {
        return SQLQuoting.quoteIdentifierIfNeeded(schemaName) + "." +
               SQLQuoting.quoteIdentifierIfNeeded(tableName);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableSchema)) return false;
        TableSchema that = (TableSchema) obj;
        return schemaName.equals(that.schemaName) &&
               tableName.equals(that.tableName) &&
               columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaName, tableName, columns);
    }

    @Override
    public String toString() {
        return "TableSchema(" + qualifiedName() + ", " + columns.values() + ")";
    }
}
