package com.tablebridge.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when the store rejects or fails a statement.
 *
 * <p>This exception wraps SQLException with the statement text and provides
 * user-friendly messages for common backend errors.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       List&lt;List&lt;Object&gt;&gt; rows = executor.execute(query);
 *   } catch (QueryExecutionException e) {
 *       logger.error(e.getUserMessage());
 *       logger.debug("Failed SQL: {}", e.getFailedSQL());
 *   }
 * </pre>
 *
 * @see com.tablebridge.runtime.QueryExecutor
 */
public class QueryExecutionException extends TableBridgeException {

    private static final Pattern MISSING_COLUMN =
        Pattern.compile("(?i)column \"?([^\"\\s]+)\"? (?:not found|does not exist)");
    private static final Pattern SYNTAX_NEAR =
        Pattern.compile("(?i)syntax error at or near \"([^\"]+)\"");

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Detects common backend error patterns and suggests what to check.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();

        if (message == null) {
            return "Query execution failed. Check SQL syntax and data types.";
        }

        Matcher column = MISSING_COLUMN.matcher(message);
        if (column.find()) {
            return "Column '" + column.group(1) + "' not found. " +
                   "Check column name spelling and case sensitivity.";
        }

        if (message.contains("Conversion Error") || message.contains("Could not convert")) {
            return "Data type mismatch in query. " +
                   "Check that filter and case values match the column types.";
        }

        if (message.contains("must appear in the GROUP BY clause") ||
            message.contains("must be part of an aggregate function")) {
            return "A projected column is neither grouped nor aggregated. " +
                   "Add it to a GroupBy clause or remove it from the projection.";
        }

        Matcher syntax = SYNTAX_NEAR.matcher(message);
        if (syntax.find()) {
            return "SQL syntax error near '" + syntax.group(1) + "'. " +
                   "Check raw query text supplied to CTE or raw update clauses.";
        }

        if (message.contains("Syntax Error") || message.contains("Parser Error")) {
            return "SQL syntax error. Check raw query text supplied to CTE or raw update clauses.";
        }

        if (message.contains("Catalog Error") && message.contains("does not exist")) {
            return "Table or function not found. Check schema, table and function names.";
        }

        return "Query execution failed: " + message;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
