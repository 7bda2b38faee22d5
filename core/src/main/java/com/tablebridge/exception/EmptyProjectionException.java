package com.tablebridge.exception;

/**
 * Thrown when a query would select nothing: no base columns and no
 * computed projection clauses.
 */
public class EmptyProjectionException extends TableBridgeException {

    public EmptyProjectionException(String tableName) {
        super("Query against " + tableName + " has an empty projection: " +
              "no base columns and no computed columns were requested");
    }
}
