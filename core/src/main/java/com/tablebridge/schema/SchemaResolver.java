package com.tablebridge.schema;

import com.tablebridge.exception.ConnectionException;
import com.tablebridge.exception.SchemaNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Discovers a table's columns from the store by querying information_schema.
 *
 * <p>Each call performs exactly one introspection round trip on the supplied
 * connection and returns a fresh {@link TableSchema}. Results are not cached.
 * The connection is borrowed, never closed here.
 */
public class SchemaResolver {

    private static final Logger logger = LoggerFactory.getLogger(SchemaResolver.class);

    static final String COLUMNS_QUERY =
        "SELECT column_name, data_type, is_nullable " +
        "FROM information_schema.columns " +
        "WHERE table_schema = ? AND table_name = ? " +
        "ORDER BY ordinal_position";

    /**
     * Resolves the schema of {@code schemaName.tableName}.
     *
     * @param connection an open connection to the store
     * @param schemaName the schema namespace
     * @param tableName the table name
     * @return the resolved schema, columns in ordinal order
     * @throws SchemaNotFoundException if the table has no columns (does not exist)
     * @throws ConnectionException if the introspection query fails
     */
    public TableSchema resolve(Connection connection, String schemaName, String tableName) {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(schemaName, "schemaName must not be null");
        Objects.requireNonNull(tableName, "tableName must not be null");

        List<ColumnRef> columns = new ArrayList<>();

        try (PreparedStatement stmt = connection.prepareStatement(COLUMNS_QUERY)) {
            stmt.setString(1, schemaName);
            stmt.setString(2, tableName);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String columnName = rs.getString("column_name");
                    String dataType = rs.getString("data_type");
                    boolean nullable = !"NO".equalsIgnoreCase(rs.getString("is_nullable"));
                    columns.add(new ColumnRef(columnName, ColumnType.fromSqlTypeName(dataType), nullable));
                }
            }
        } catch (SQLException e) {
            throw new ConnectionException(
                "Failed to introspect " + schemaName + "." + tableName + ": " + e.getMessage(), e);
        }

        if (columns.isEmpty()) {
            throw new SchemaNotFoundException(schemaName, tableName);
        }

        logger.debug("Resolved {}.{} with {} columns", schemaName, tableName, columns.size());
        return new TableSchema(schemaName, tableName, columns);
    }
}
