package com.tablebridge.exception;

/**
 * Thrown when the relational store cannot be reached, either while opening a
 * connection or during schema introspection.
 */
public class ConnectionException extends TableBridgeException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
