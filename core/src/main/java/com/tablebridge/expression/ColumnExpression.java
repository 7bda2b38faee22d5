package com.tablebridge.expression;

import com.tablebridge.generator.SQLQuoting;
import com.tablebridge.schema.ColumnRef;
import com.tablebridge.schema.ColumnType;

import java.util.Objects;

/**
 * Expression referring to a column of the queried table.
 *
 * <p>Names are quoted only when they need it, keeping generated SQL readable.
 */
public final class ColumnExpression implements Expression {

    private final ColumnRef column;

    public ColumnExpression(ColumnRef column) {
        this.column = Objects.requireNonNull(column, "column must not be null");
    }

    public ColumnRef column() {
        return column;
    }

    public String columnName() {
        return column.name();
    }

    @Override
    public ColumnType dataType() {
        return column.type();
    }

    @Override
    public String toSQL(ParameterBinder binder) {
        return SQLQuoting.quoteIdentifierIfNeeded(column.name());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnExpression)) return false;
        return column.equals(((ColumnExpression) obj).column);
    }

    @Override
    public int hashCode() {
        return column.hashCode();
    }

    @Override
    public String toString() {
        return column.name();
    }
}
