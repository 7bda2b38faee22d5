package com.tablebridge.expression;

import com.tablebridge.generator.SQLQuoting;
import com.tablebridge.schema.ColumnType;

import java.util.Objects;

/**
 * Expression representing an aliased projection column ({@code expr AS name}).
 *
 * <p>A plain column aliased to its own name renders without the AS clause.
 */
public final class AliasExpression implements Expression {

    private final Expression expression;
    private final String alias;

    /**
     * Creates an alias expression.
     *
     * @param expression the expression to alias
     * @param alias the alias name
     */
    public AliasExpression(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    @Override
    public ColumnType dataType() {
        return expression.dataType();
    }

    /**
     * Renders the projection column. The alias is quoted if it is a reserved
     * word or contains special characters.
     *
     * @return the SQL string
     */
    @Override
    public String toSQL(ParameterBinder binder) {
        String sql = expression.toSQL(binder);
        if (expression instanceof ColumnExpression column && column.columnName().equals(alias)) {
            return sql;
        }
        return sql + " AS " + SQLQuoting.quoteIdentifierIfNeeded(alias);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasExpression)) return false;
        AliasExpression that = (AliasExpression) obj;
        return Objects.equals(expression, that.expression) &&
               Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }

    @Override
    public String toString() {
        return expression + " AS " + alias;
    }
}
