package com.tablebridge.expression;

import com.tablebridge.schema.ColumnType;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Expression representing a constant value supplied by the caller.
 *
 * <p>Compared literals ({@code col = ?}) take their type from the column.
 * Produced literals, such as CASE results, have nothing to infer a type
 * from, so a typed literal renders its placeholder as {@code CAST(? AS T)}.
 */
public final class Literal implements Expression {

    private final Object value;
    private final boolean typed;

    private Literal(Object value, boolean typed) {
        this.value = ParameterBinder.normalize(value);
        this.typed = typed;
    }

    /**
     * Creates a literal compared against a column.
     *
     * @param value the value (may be null)
     * @return the literal
     */
    public static Literal of(Object value) {
        return new Literal(value, false);
    }

    /**
     * Creates a literal whose placeholder carries an explicit type cast.
     *
     * @param value the value (may be null)
     * @return the literal
     */
    public static Literal typed(Object value) {
        return new Literal(value, true);
    }

    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public ColumnType dataType() {
        return ColumnType.forValue(value);
    }

    @Override
    public String toSQL(ParameterBinder binder) {
        if (value == null) {
            return "NULL";
        }

        String placeholder = binder.bind(value);
        if (!typed || binder.isInline()) {
            return placeholder;
        }

        ColumnType type = dataType();
        if (type == ColumnType.DECIMAL) {
            int scale = Math.max(((BigDecimal) value).scale(), 0);
            return "CAST(" + placeholder + " AS DECIMAL(38, " + Math.min(scale, 38) + "))";
        }
        if (type.sqlName() == null) {
            return placeholder;
        }
        return "CAST(" + placeholder + " AS " + type.sqlName() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return typed == that.typed && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, typed);
    }

    @Override
    public String toString() {
        return value == null ? "NULL" : ParameterBinder.inlineLiteral(value);
    }
}
