package com.tablebridge.expression;

import com.tablebridge.schema.ColumnType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a CASE WHEN conditional expression.
 *
 * <p>Conditions are evaluated in order and the THEN value of the first
 * matching condition is returned. If no condition matches, the ELSE value is
 * returned, or NULL when there is no ELSE.
 *
 * <p>SQL form:
 * <pre>
 *   CASE
 *     WHEN condition1 THEN result1
 *     WHEN condition2 THEN result2
 *     ...
 *     ELSE default_result
 *   END
 * </pre>
 */
public final class CaseWhenExpression implements Expression {

    private final List<Expression> conditions;
    private final List<Expression> thenBranches;
    private final Expression elseBranch;

    /**
     * Creates a CASE WHEN expression.
     *
     * @param conditions the WHEN conditions (must match thenBranches size)
     * @param thenBranches the THEN result expressions
     * @param elseBranch the ELSE result expression (may be null)
     * @throws IllegalArgumentException if conditions and thenBranches have different sizes
     */
    public CaseWhenExpression(List<Expression> conditions, List<Expression> thenBranches, Expression elseBranch) {
        Objects.requireNonNull(conditions, "conditions must not be null");
        Objects.requireNonNull(thenBranches, "thenBranches must not be null");

        if (conditions.size() != thenBranches.size()) {
            throw new IllegalArgumentException(
                "conditions and thenBranches must have the same size: " +
                conditions.size() + " vs " + thenBranches.size());
        }

        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("CASE WHEN requires at least one condition");
        }

        this.conditions = new ArrayList<>(conditions);
        this.thenBranches = new ArrayList<>(thenBranches);
        this.elseBranch = elseBranch;
    }

    public List<Expression> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    public List<Expression> thenBranches() {
        return Collections.unmodifiableList(thenBranches);
    }

    /**
     * Returns the ELSE branch expression.
     *
     * @return the ELSE expression, or null if not specified
     */
    public Expression elseBranch() {
        return elseBranch;
    }

    /**
     * Returns the type of the first branch whose type is known.
     *
     * @return the branch type, or {@link ColumnType#OTHER}
     */
    @Override
    public ColumnType dataType() {
        for (Expression branch : thenBranches) {
            if (branch.dataType() != ColumnType.OTHER) {
                return branch.dataType();
            }
        }
        return elseBranch != null ? elseBranch.dataType() : ColumnType.OTHER;
    }

    /**
     * Generates the SQL representation of this CASE WHEN expression.
     *
     * @return SQL string in the form "CASE WHEN c1 THEN r1 ... ELSE e END"
     */
    @Override
    public String toSQL(ParameterBinder binder) {
        StringBuilder sql = new StringBuilder("CASE ");

        for (int i = 0; i < conditions.size(); i++) {
            sql.append("WHEN ").append(conditions.get(i).toSQL(binder));
            sql.append(" THEN ").append(thenBranches.get(i).toSQL(binder)).append(" ");
        }

        if (elseBranch != null) {
            sql.append("ELSE ").append(elseBranch.toSQL(binder)).append(" ");
        }

        sql.append("END");
        return sql.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseWhenExpression)) return false;
        CaseWhenExpression that = (CaseWhenExpression) obj;
        return Objects.equals(conditions, that.conditions) &&
               Objects.equals(thenBranches, that.thenBranches) &&
               Objects.equals(elseBranch, that.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions, thenBranches, elseBranch);
    }

    @Override
    public String toString() {
        return "CaseWhen(" + conditions.size() + " branches" +
               (elseBranch != null ? ", with ELSE" : "") + ")";
    }
}
