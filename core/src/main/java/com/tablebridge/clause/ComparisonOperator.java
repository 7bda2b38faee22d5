package com.tablebridge.clause;

/**
 * Comparison operators a {@link Filter} or {@link Having} clause may carry.
 *
 * <p>Only equality is composed today. Richer comparisons must be added here
 * explicitly; unrecognized operator text is rejected instead of being
 * silently treated as equality.
 */
public enum ComparisonOperator {
    EQUAL("=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Parses operator text from a clause descriptor.
     *
     * @param text the operator text ("=" or "==")
     * @return the operator
     * @throws IllegalArgumentException if the operator is not supported
     */
    public static ComparisonOperator fromSymbol(String text) {
        if (text == null) {
            throw new IllegalArgumentException("operator must not be null");
        }
        switch (text.trim()) {
            case "=":
            case "==":
                return EQUAL;
            default:
                throw new IllegalArgumentException(
                    "Unsupported comparison operator '" + text + "': only equality (=) is supported");
        }
    }
}
