package com.tablebridge.query;

/**
 * How a composed statement reaches the store.
 */
public enum ExecutionMode {
    /** Statement text with {@code ?} placeholders; values are bound separately. */
    PARAMETERIZED,

    /**
     * Statement assembled by string concatenation, including caller-supplied
     * raw SQL fragments. Never use with untrusted input.
     */
    RAW_TEXT
}
