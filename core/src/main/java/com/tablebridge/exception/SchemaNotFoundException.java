package com.tablebridge.exception;

/**
 * Thrown when schema introspection finds no columns for the requested table.
 */
public class SchemaNotFoundException extends TableBridgeException {

    private final String schemaName;
    private final String tableName;

    /**
     * Creates a schema-not-found exception.
     *
     * @param schemaName the schema namespace that was searched
     * @param tableName the table that was not found
     */
    public SchemaNotFoundException(String schemaName, String tableName) {
        super("Table not found: " + schemaName + "." + tableName);
        this.schemaName = schemaName;
        this.tableName = tableName;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getTableName() {
        return tableName;
    }
}
