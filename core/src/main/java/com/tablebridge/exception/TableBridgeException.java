package com.tablebridge.exception;

/**
 * Base class for all errors raised by tablebridge.
 *
 * <p>Every subclass is terminal for the call that raised it. Nothing in this
 * library retries; callers that retry must account for statements that are
 * not idempotent (update and delete).
 */
public abstract class TableBridgeException extends RuntimeException {

    protected TableBridgeException(String message) {
        super(message);
    }

    protected TableBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
