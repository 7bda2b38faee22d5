package com.tablebridge;

import com.tablebridge.clause.ClauseDescriptorParser;
import com.tablebridge.clause.ClauseSpec;
import com.tablebridge.clause.Filter;
import com.tablebridge.exception.ConnectionException;
import com.tablebridge.exception.QueryExecutionException;
import com.tablebridge.exception.SchemaNotFoundException;
import com.tablebridge.exception.UnknownColumnException;
import com.tablebridge.generator.RenderedStatement;
import com.tablebridge.generator.SQLGenerator;
import com.tablebridge.query.ComposedQuery;
import com.tablebridge.query.MutationBuilder;
import com.tablebridge.query.QueryBuilder;
import com.tablebridge.runtime.ConnectionProvider;
import com.tablebridge.runtime.QueryExecutor;
import com.tablebridge.runtime.ResultMapper;
import com.tablebridge.runtime.ResultRow;
import com.tablebridge.runtime.ScopedConnection;
import com.tablebridge.schema.SchemaResolver;
import com.tablebridge.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for reading and writing one table.
 *
 * <p>Each call resolves the table's schema on its own connection, builds the
 * statement, then executes it on a second connection. No state is carried
 * between calls; a client may be shared across threads as long as the
 * {@link ConnectionProvider} can be.
 *
 * <p>Example usage:
 * <pre>
 *   TableClient orders = new TableClient(provider, "sales", "orders");
 *   List&lt;ResultRow&gt; rows = orders.select(
 *       List.of("region"),
 *       List.of(new CountProjection("order_id"), GroupBy.of("region")));
 * </pre>
 */
public class TableClient {

    private static final Logger logger = LoggerFactory.getLogger(TableClient.class);

    private final ConnectionProvider connectionProvider;
    private final String schemaName;
    private final String tableName;
    private final SchemaResolver schemaResolver;
    private final QueryBuilder queryBuilder;
    private final MutationBuilder mutationBuilder;
    private final QueryExecutor executor;

    public TableClient(ConnectionProvider connectionProvider, String schemaName, String tableName) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider must not be null");
        this.schemaName = Objects.requireNonNull(schemaName, "schemaName must not be null");
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.schemaResolver = new SchemaResolver();
        this.queryBuilder = new QueryBuilder();
        this.mutationBuilder = new MutationBuilder();
        this.executor = new QueryExecutor(connectionProvider, new SQLGenerator());
    }

    /**
     * Resolves the table's current schema.
     *
     * @return the schema
     * @throws SchemaNotFoundException if the table does not exist
     * @throws ConnectionException if no connection can be acquired
     */
    public TableSchema resolveSchema() {
        try (ScopedConnection scoped = ScopedConnection.open(connectionProvider)) {
            return schemaResolver.resolve(scoped.get(), schemaName, tableName);
        }
    }

    /**
     * Builds the query for the given columns and clauses without executing it.
     *
     * <p>Callers that must not run raw-text statements can inspect
     * {@link ComposedQuery#mode()} before calling {@link #execute(ComposedQuery)}.
     *
     * @param baseColumns the base projection columns
     * @param clauses the clauses, in fold order
     * @return the composed query
     * @throws SchemaNotFoundException if the table does not exist
     * @throws UnknownColumnException if any referenced column is not in the table
     */
    public ComposedQuery compose(List<String> baseColumns, List<? extends ClauseSpec> clauses) {
        return queryBuilder.build(resolveSchema(), baseColumns, clauses);
    }

    /**
     * Runs a query and maps its rows.
     *
     * @param baseColumns the base projection columns
     * @param clauses the clauses, in fold order
     * @return the rows, keyed by output column name in projection order
     * @throws SchemaNotFoundException if the table does not exist
     * @throws UnknownColumnException if any referenced column is not in the table
     * @throws QueryExecutionException if the store rejects the query
     */
    public List<ResultRow> select(List<String> baseColumns, List<? extends ClauseSpec> clauses) {
        return execute(compose(baseColumns, clauses));
    }

    public List<ResultRow> select(List<String> baseColumns, ClauseSpec... clauses) {
        return select(baseColumns, Arrays.asList(clauses));
    }

    /**
     * Runs a query whose clauses are given as a JSON array of descriptors.
     *
     * @param baseColumns the base projection columns
     * @param clauseDescriptors the JSON clause descriptors
     * @return the rows
     * @throws IllegalArgumentException if the descriptors are malformed
     */
    public List<ResultRow> selectJson(List<String> baseColumns, String clauseDescriptors) {
        return select(baseColumns, ClauseDescriptorParser.parse(clauseDescriptors));
    }

    /**
     * Executes a previously composed query and maps its rows.
     *
     * @param query the composed query
     * @return the rows
     */
    public List<ResultRow> execute(ComposedQuery query) {
        List<List<Object>> tuples = executor.execute(query);
        List<ResultRow> rows = ResultMapper.mapRows(query.projectionNames(), tuples);
        logger.debug("Read {} row(s) from {}", rows.size(), query.table().qualifiedName());
        return rows;
    }

    /**
     * Inserts rows, one statement per row, on a single connection.
     *
     * <p>Every row is validated before the first insert runs.
     *
     * @param rows column name to value maps
     * @return the number of rows inserted
     * @throws UnknownColumnException if a row names an unknown column
     */
    public int append(List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(rows, "rows must not be null");
        TableSchema schema = resolveSchema();
        List<RenderedStatement> statements = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            statements.add(mutationBuilder.insert(schema, row));
        }
        int inserted = executor.executeBatch(statements);
        logger.info("Inserted {} row(s) into {}", inserted, schema.qualifiedName());
        return inserted;
    }

    /**
     * Updates the rows matching all filters.
     *
     * @param values column name to new value
     * @param filters equality filters; empty updates every row
     * @return the number of rows updated
     */
    public int update(Map<String, ?> values, List<Filter> filters) {
        TableSchema schema = resolveSchema();
        int updated = executor.executeUpdate(mutationBuilder.update(schema, values, filters));
        logger.info("Updated {} row(s) in {}", updated, schema.qualifiedName());
        return updated;
    }

    /**
     * Deletes the rows matching all filters.
     *
     * @param filters equality filters; empty deletes every row
     * @return the number of rows deleted
     */
    public int delete(List<Filter> filters) {
        TableSchema schema = resolveSchema();
        int deleted = executor.executeUpdate(mutationBuilder.delete(schema, filters));
        logger.info("Deleted {} row(s) from {}", deleted, schema.qualifiedName());
        return deleted;
    }

    /**
     * Executes caller-supplied statement text without validation.
     *
     * @param sql the statement text
     * @return the number of rows affected
     */
    public int executeRawUpdate(String sql) {
        logger.warn("Executing unvalidated statement against {}.{}", schemaName, tableName);
        return executor.executeRawUpdate(sql);
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getTableName() {
        return tableName;
    }
}
