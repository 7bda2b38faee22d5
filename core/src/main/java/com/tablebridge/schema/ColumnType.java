package com.tablebridge.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Locale;

/**
 * The closed set of column types tablebridge understands.
 *
 * <p>Store type names are mapped onto this enumeration when a schema is
 * resolved. Type names are never evaluated dynamically; anything that is
 * not recognized becomes {@link #OTHER}.
 */
public enum ColumnType {
    BOOLEAN("BOOLEAN"),
    TINYINT("TINYINT"),
    SMALLINT("SMALLINT"),
    INTEGER("INTEGER"),
    BIGINT("BIGINT"),
    REAL("REAL"),
    DOUBLE("DOUBLE"),
    DECIMAL("DECIMAL"),
    VARCHAR("VARCHAR"),
    BLOB("BLOB"),
    DATE("DATE"),
    TIME("TIME"),
    TIMESTAMP("TIMESTAMP"),
    OTHER(null);

    private final String sqlName;

    ColumnType(String sqlName) {
        this.sqlName = sqlName;
    }

    /**
     * Returns the SQL type name used in CAST expressions.
     *
     * @return the SQL type name, or null for {@link #OTHER}
     */
    public String sqlName() {
        return sqlName;
    }

    /**
     * Maps a store type name (as reported by information_schema) to a column type.
     *
     * @param typeName the type name, e.g. "INTEGER", "VARCHAR(255)", "nvarchar"
     * @return the matching column type, or {@link #OTHER}
     */
    public static ColumnType fromSqlTypeName(String typeName) {
        if (typeName == null) {
            return OTHER;
        }

        // Normalize: uppercase and remove size specifiers like VARCHAR(255)
        String normalized = typeName.toUpperCase(Locale.ROOT).replaceAll("\\(.*\\)", "").trim();

        switch (normalized) {
            case "BOOLEAN":
            case "BOOL":
            case "BIT":
                return BOOLEAN;
            case "TINYINT":
            case "INT1":
            case "UTINYINT":
                return TINYINT;
            case "SMALLINT":
            case "INT2":
            case "USMALLINT":
                return SMALLINT;
            case "INTEGER":
            case "INT":
            case "INT4":
            case "UINTEGER":
                return INTEGER;
            case "BIGINT":
            case "INT8":
            case "UBIGINT":
            case "HUGEINT":
                return BIGINT;
            case "REAL":
            case "FLOAT":
            case "FLOAT4":
                return REAL;
            case "DOUBLE":
            case "DOUBLE PRECISION":
            case "FLOAT8":
                return DOUBLE;
            case "DECIMAL":
            case "NUMERIC":
            case "MONEY":
                return DECIMAL;
            case "VARCHAR":
            case "NVARCHAR":
            case "CHAR":
            case "NCHAR":
            case "BPCHAR":
            case "TEXT":
            case "NTEXT":
            case "STRING":
                return VARCHAR;
            case "BLOB":
            case "BYTEA":
            case "BINARY":
            case "VARBINARY":
                return BLOB;
            case "DATE":
                return DATE;
            case "TIME":
                return TIME;
            case "TIMESTAMP":
            case "DATETIME":
            case "DATETIME2":
            case "TIMESTAMP WITH TIME ZONE":
            case "TIMESTAMPTZ":
                return TIMESTAMP;
            default:
                return OTHER;
        }
    }

    /**
     * Infers the column type of a Java value bound as a statement parameter.
     *
     * @param value the value (may be null)
     * @return the matching column type, or {@link #OTHER} for null and unknown classes
     */
    public static ColumnType forValue(Object value) {
        if (value instanceof String || value instanceof Character) {
            return VARCHAR;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
            return INTEGER;
        }
        if (value instanceof Long) {
            return BIGINT;
        }
        if (value instanceof Float) {
            return REAL;
        }
        if (value instanceof Double) {
            return DOUBLE;
        }
        if (value instanceof BigDecimal || value instanceof BigInteger) {
            return DECIMAL;
        }
        if (value instanceof LocalDate || value instanceof java.sql.Date) {
            return DATE;
        }
        if (value instanceof LocalTime || value instanceof java.sql.Time) {
            return TIME;
        }
        if (value instanceof LocalDateTime || value instanceof OffsetDateTime ||
            value instanceof java.sql.Timestamp) {
            return TIMESTAMP;
        }
        if (value instanceof byte[]) {
            return BLOB;
        }
        return OTHER;
    }
}
