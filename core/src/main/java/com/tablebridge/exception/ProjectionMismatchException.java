package com.tablebridge.exception;

/**
 * Thrown when a result tuple does not have one value per projected column.
 */
public class ProjectionMismatchException extends TableBridgeException {

    private final int expected;
    private final int actual;

    /**
     * Creates a projection mismatch exception.
     *
     * @param expected the number of projected columns
     * @param actual the number of values in the offending row
     */
    public ProjectionMismatchException(int expected, int actual) {
        super("Row arity " + actual + " does not match projection arity " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
