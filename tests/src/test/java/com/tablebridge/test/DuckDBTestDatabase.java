package com.tablebridge.test;

import com.tablebridge.runtime.ConnectionProvider;
import org.duckdb.DuckDBConnection;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory DuckDB database shared by the connections a test acquires.
 *
 * <p>The root connection stays open for the lifetime of the fixture; the
 * provider hands out duplicates of it, so every acquired connection sees
 * the same tables and can be closed independently.
 */
public final class DuckDBTestDatabase implements AutoCloseable {

    private final DuckDBConnection root;
    private final AtomicInteger acquired = new AtomicInteger();
    private final AtomicInteger open = new AtomicInteger();

    public DuckDBTestDatabase() throws SQLException {
        this.root = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:");
    }

    /**
     * Creates {@code schema_name.table_name (col1 VARCHAR, col2 VARCHAR, amount INTEGER)}.
     */
    public DuckDBTestDatabase withSampleTable() throws SQLException {
        execute("CREATE SCHEMA schema_name");
        execute("CREATE TABLE schema_name.table_name (col1 VARCHAR, col2 VARCHAR, amount INTEGER NOT NULL)");
        return this;
    }

    public void execute(String sql) throws SQLException {
        try (Statement stmt = root.createStatement()) {
            stmt.execute(sql);
        }
    }

    /**
     * Returns a provider that counts acquisitions and tracks connections
     * still open.
     */
    public ConnectionProvider provider() {
        return () -> {
            acquired.incrementAndGet();
            open.incrementAndGet();
            Connection connection = root.duplicate();
            return new TrackedConnection(connection, open).proxy();
        };
    }

    public int acquiredCount() {
        return acquired.get();
    }

    public int openCount() {
        return open.get();
    }

    public Connection rootConnection() {
        return root;
    }

    @Override
    public void close() throws SQLException {
        root.close();
    }
}
