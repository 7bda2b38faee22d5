package com.tablebridge.exception;

/**
 * Thrown when a base column or a clause names a column that the resolved
 * table schema does not contain.
 *
 * <p>Raised while the query is being built, so no statement is ever sent
 * to the store for a query that references an unknown column.
 */
public class UnknownColumnException extends TableBridgeException {

    private final String columnName;
    private final String tableName;

    /**
     * Creates an unknown column exception.
     *
     * @param columnName the offending column name
     * @param tableName the qualified table the column was looked up in
     */
    public UnknownColumnException(String columnName, String tableName) {
        super("Unknown column '" + columnName + "' in table " + tableName);
        this.columnName = columnName;
        this.tableName = tableName;
    }

    /**
     * Returns the column name that could not be resolved.
     *
     * @return the column name
     */
    public String getColumnName() {
        return columnName;
    }

    /**
     * Returns the qualified name of the table that was searched.
     *
     * @return the table name
     */
    public String getTableName() {
        return tableName;
    }
}
