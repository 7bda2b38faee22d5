package com.tablebridge.generator;

/**
 * Utilities for safely quoting SQL identifiers and literals.
 *
 * <p>Identifiers (schema, table, column and alias names) are double-quoted
 * when they are not plain names; string literals are single-quoted with
 * embedded quotes doubled. Literals are only inlined in raw-text mode;
 * parameterized statements bind them instead.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifierIfNeeded("order_id");   // order_id
 *   SQLQuoting.quoteIdentifierIfNeeded("group");      // "group"
 *   SQLQuoting.quoteLiteral("O'Reilly");              // 'O''Reilly'
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private SQLQuoting() {
    }

    /**
     * Quotes an identifier using double quotes, escaping internal quotes
     * according to the SQL standard.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        String escaped = identifier.replace("\"", "\"\"");
        return "\"" + escaped + "\"";
    }

    /**
     * Quotes a string literal value.
     *
     * <p>Uses single quotes and escapes internal quotes according to SQL standard.
     * Returns NULL (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }

        String escaped = value.replace("'", "''");
        return "'" + escaped + "'";
    }

    /**
     * Validates that a string is safe to emit unquoted, for names that are
     * spliced into SQL verbatim (function names, CTE names).
     *
     * <p>Only allows identifiers that start with a letter or underscore and
     * contain only letters, digits and underscores.
     *
     * @param identifier the identifier to validate
     * @throws IllegalArgumentException if identifier is null, empty, or
     *         contains invalid characters
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        if (!identifier.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
            throw new IllegalArgumentException(
                "Invalid identifier (must start with letter/underscore, " +
                "contain only alphanumeric/underscore): " + identifier);
        }
    }

    /**
     * Quotes an identifier only if needed.
     *
     * <p>Simple identifiers that follow standard naming conventions and are
     * not reserved words are left unquoted, keeping generated SQL readable.
     *
     * @param identifier the identifier to conditionally quote
     * @return the identifier, quoted if necessary
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        if (needsQuoting(identifier)) {
            return quoteIdentifier(identifier);
        }

        return identifier;
    }

    private static boolean needsQuoting(String identifier) {
        char first = identifier.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return true;
        }

        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return true;
            }
        }

        return isReservedWord(identifier.toUpperCase());
    }

    /**
     * Checks if a word is a SQL reserved word.
     *
     * @param word the word to check (should be uppercase)
     * @return true if reserved
     */
    private static boolean isReservedWord(String word) {
        switch (word) {
            case "SELECT":
            case "FROM":
            case "WHERE":
            case "GROUP":
            case "BY":
            case "ORDER":
            case "HAVING":
            case "WITH":
            case "AS":
            case "AND":
            case "OR":
            case "NOT":
            case "IN":
            case "IS":
            case "CASE":
            case "WHEN":
            case "THEN":
            case "ELSE":
            case "END":
            case "NULL":
            case "TRUE":
            case "FALSE":
            case "OVER":
            case "PARTITION":
            case "JOIN":
            case "ON":
            case "UNION":
            case "LIMIT":
            case "ALL":
            case "DISTINCT":
            case "INSERT":
            case "INTO":
            case "VALUES":
            case "UPDATE":
            case "SET":
            case "DELETE":
            case "TABLE":
            case "USER":
                return true;
            default:
                return false;
        }
    }
}
