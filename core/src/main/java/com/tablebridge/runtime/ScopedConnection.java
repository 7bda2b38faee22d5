package com.tablebridge.runtime;

import com.tablebridge.exception.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Auto-closeable owner of one connection for the duration of one call.
 *
 * <p>Use with try-with-resources so the connection is released on every exit
 * path, including exceptions:
 * <pre>
 *   try (ScopedConnection scoped = ScopedConnection.open(provider)) {
 *       PreparedStatement stmt = scoped.get().prepareStatement(sql);
 *       ...
 *   } // Connection closed here
 * </pre>
 *
 * @see ConnectionProvider
 */
public final class ScopedConnection implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScopedConnection.class);

    private final Connection connection;
    private boolean released = false;

    ScopedConnection(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
    }

    /**
     * Acquires a connection from the provider.
     *
     * @param provider the connection provider
     * @return the scoped connection
     * @throws ConnectionException if the provider fails or returns no connection
     */
    public static ScopedConnection open(ConnectionProvider provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        Connection connection;
        try {
            connection = provider.getConnection();
        } catch (SQLException e) {
            throw new ConnectionException("Failed to acquire database connection: " + e.getMessage(), e);
        }
        if (connection == null) {
            throw new ConnectionException("Connection provider returned no connection", null);
        }
        return new ScopedConnection(connection);
    }

    /**
     * Returns the underlying connection.
     *
     * @return the connection
     * @throws IllegalStateException if the connection was already released
     */
    public Connection get() {
        if (released) {
            throw new IllegalStateException("Connection already released");
        }
        return connection;
    }

    /**
     * Closes the underlying connection. Idempotent.
     *
     * <p>A failure to close is logged, not thrown, so it never masks the
     * exception that ended the scope.
     */
    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("Failed to close connection: {}", e.getMessage());
        }
    }

    public boolean isReleased() {
        return released;
    }
}
