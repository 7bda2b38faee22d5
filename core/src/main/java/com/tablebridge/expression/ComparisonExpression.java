package com.tablebridge.expression;

import com.tablebridge.clause.ComparisonOperator;
import com.tablebridge.schema.ColumnType;

import java.util.Objects;

/**
 * Comparison of a column with a literal, as used in WHERE, HAVING and
 * CASE WHEN conditions.
 *
 * <p>Equality with a null literal renders as {@code IS NULL}, since
 * {@code col = NULL} never matches.
 */
public final class ComparisonExpression implements Expression {

    private final Expression left;
    private final ComparisonOperator operator;
    private final Literal right;

    public ComparisonExpression(Expression left, ComparisonOperator operator, Literal right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public static ComparisonExpression equal(Expression left, Object value) {
        return new ComparisonExpression(left, ComparisonOperator.EQUAL, Literal.of(value));
    }

    public Expression left() {
        return left;
    }

    public ComparisonOperator operator() {
        return operator;
    }

    public Literal right() {
        return right;
    }

    @Override
    public ColumnType dataType() {
        return ColumnType.BOOLEAN;
    }

    @Override
    public String toSQL(ParameterBinder binder) {
        if (right.isNull() && operator == ComparisonOperator.EQUAL) {
            return left.toSQL(binder) + " IS NULL";
        }
        return left.toSQL(binder) + " " + operator.symbol() + " " + right.toSQL(binder);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComparisonExpression)) return false;
        ComparisonExpression that = (ComparisonExpression) obj;
        return left.equals(that.left) && operator == that.operator && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
