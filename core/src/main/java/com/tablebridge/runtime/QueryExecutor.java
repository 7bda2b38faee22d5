package com.tablebridge.runtime;

import com.tablebridge.exception.ConnectionException;
import com.tablebridge.exception.QueryExecutionException;
import com.tablebridge.generator.RenderedStatement;
import com.tablebridge.generator.SQLGenerator;
import com.tablebridge.query.ComposedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Executes statements against the store and returns raw results.
 *
 * <p>Every method acquires its own {@link ScopedConnection} and releases it
 * before returning, on success and on failure. Parameterized statements go
 * through {@link PreparedStatement}; raw-text statements through a plain
 * {@link Statement}. Nothing is retried: update and delete statements are
 * not idempotent.
 *
 * <p>Example usage:
 * <pre>
 *   QueryExecutor executor = new QueryExecutor(provider);
 *   List&lt;List&lt;Object&gt;&gt; tuples = executor.execute(composedQuery);
 *   int deleted = executor.executeUpdate(mutationBuilder.delete(schema, filters));
 * </pre>
 *
 * @see ConnectionProvider
 * @see ResultMapper
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final ConnectionProvider connectionProvider;
    private final SQLGenerator generator;

    /**
     * Creates a query executor with the specified connection provider.
     *
     * @param connectionProvider the connection provider
     */
    public QueryExecutor(ConnectionProvider connectionProvider) {
        this(connectionProvider, new SQLGenerator());
    }

    public QueryExecutor(ConnectionProvider connectionProvider, SQLGenerator generator) {
        this.connectionProvider = Objects.requireNonNull(
            connectionProvider, "connectionProvider must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    /**
     * Renders and executes a composed query.
     *
     * @param query the composed query
     * @return the raw row tuples, one value per projection column
     * @throws QueryExecutionException if the store rejects the query
     * @throws ConnectionException if no connection can be acquired
     */
    public List<List<Object>> execute(ComposedQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return executeQuery(generator.generate(query));
    }

    /**
     * Executes a rendered query.
     *
     * @param statement the statement
     * @return the raw row tuples
     * @throws QueryExecutionException if the store rejects the query
     * @throws ConnectionException if no connection can be acquired
     */
    public List<List<Object>> executeQuery(RenderedStatement statement) {
        Objects.requireNonNull(statement, "statement must not be null");
        logger.debug("Executing {} query: {}", statement.mode(), statement.sql());

        try (ScopedConnection scoped = ScopedConnection.open(connectionProvider)) {
            Connection conn = scoped.get();
            if (statement.isRawText()) {
                try (Statement stmt = conn.createStatement();
                     ResultSet rs = stmt.executeQuery(statement.sql())) {
                    return readRows(rs);
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(statement.sql())) {
                bind(stmt, statement.parameters());
                try (ResultSet rs = stmt.executeQuery()) {
                    return readRows(rs);
                }
            }
        } catch (SQLException e) {
            throw new QueryExecutionException(
                "Failed to execute query: " + e.getMessage(), e, statement.sql());
        }
    }

    /**
     * Executes an INSERT, UPDATE or DELETE statement.
     *
     * @param statement the statement
     * @return the number of rows affected
     * @throws QueryExecutionException if the store rejects the statement
     * @throws ConnectionException if no connection can be acquired
     */
    public int executeUpdate(RenderedStatement statement) {
        Objects.requireNonNull(statement, "statement must not be null");
        return executeBatch(List.of(statement));
    }

    /**
     * Executes several statements, in order, on one connection.
     *
     * <p>Each statement commits according to the connection's auto-commit
     * setting; a failure stops the batch and earlier statements stay applied.
     *
     * @param statements the statements
     * @return the total number of rows affected
     * @throws QueryExecutionException if the store rejects a statement
     * @throws ConnectionException if no connection can be acquired
     */
    public int executeBatch(List<RenderedStatement> statements) {
        Objects.requireNonNull(statements, "statements must not be null");
        if (statements.isEmpty()) {
            return 0;
        }

        int affected = 0;
        try (ScopedConnection scoped = ScopedConnection.open(connectionProvider)) {
            Connection conn = scoped.get();
            for (RenderedStatement statement : statements) {
                affected += update(conn, statement);
            }
        }
        return affected;
    }

    /**
     * Executes caller-supplied statement text as-is.
     *
     * <p>The text is not validated or escaped in any way. Never pass text
     * that was built from untrusted input.
     *
     * @param sql the statement text
     * @return the number of rows affected
     * @throws QueryExecutionException if the store rejects the statement
     */
    public int executeRawUpdate(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        return executeUpdate(RenderedStatement.rawText(sql));
    }

    private static int update(Connection conn, RenderedStatement statement) {
        logger.debug("Executing {} update: {}", statement.mode(), statement.sql());
        try {
            if (statement.isRawText()) {
                try (Statement stmt = conn.createStatement()) {
                    return stmt.executeUpdate(statement.sql());
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(statement.sql())) {
                bind(stmt, statement.parameters());
                return stmt.executeUpdate();
            }
        } catch (SQLException e) {
            throw new QueryExecutionException(
                "Failed to execute update: " + e.getMessage(), e, statement.sql());
        }
    }

    private static void bind(PreparedStatement stmt, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            stmt.setObject(i + 1, parameters.get(i));
        }
    }

    private static List<List<Object>> readRows(ResultSet rs) throws SQLException {
        int columnCount = rs.getMetaData().getColumnCount();
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Object[] values = new Object[columnCount];
            for (int i = 0; i < columnCount; i++) {
                values[i] = rs.getObject(i + 1);
            }
            rows.add(Arrays.asList(values));
        }
        return rows;
    }

    public ConnectionProvider getConnectionProvider() {
        return connectionProvider;
    }
}
