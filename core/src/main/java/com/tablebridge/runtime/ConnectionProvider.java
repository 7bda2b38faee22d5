package com.tablebridge.runtime;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies already-authenticated connections to the relational store.
 *
 * <p>Every call must return a connection the caller owns; tablebridge closes
 * it when the call completes. Credentials, pooling and transport retries are
 * the provider's business.
 *
 * @see JdbcConnectionProvider
 * @see ScopedConnection
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Opens a connection.
     *
     * @return an open connection owned by the caller
     * @throws SQLException if the store cannot be reached
     */
    Connection getConnection() throws SQLException;
}
