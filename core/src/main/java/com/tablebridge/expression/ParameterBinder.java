package com.tablebridge.expression;

import com.tablebridge.generator.SQLQuoting;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects literal values while an expression tree is rendered.
 *
 * <p>In parameterized mode every literal becomes a {@code ?} placeholder and
 * its value is recorded in text order. In inline mode (raw-text execution)
 * literals are rendered as quoted SQL literals and nothing is recorded.
 *
 * <p>A binder is single-use: create one per rendered statement.
 */
public final class ParameterBinder {

    private final boolean inline;
    private final List<Object> parameters = new ArrayList<>();

    private ParameterBinder(boolean inline) {
        this.inline = inline;
    }

    public static ParameterBinder parameterized() {
        return new ParameterBinder(false);
    }

    public static ParameterBinder inline() {
        return new ParameterBinder(true);
    }

    public boolean isInline() {
        return inline;
    }

    /**
     * Binds a value and returns the SQL that stands for it.
     *
     * @param value the value (must not be null; nulls render as NULL without binding)
     * @return "?" in parameterized mode, otherwise the inline literal
     */
    public String bind(Object value) {
        if (value == null) {
            return "NULL";
        }
        Object bindable = normalize(value);
        if (inline) {
            return inlineLiteral(bindable);
        }
        parameters.add(bindable);
        return "?";
    }

    /**
     * Converts values the JDBC driver cannot bind to an equivalent it can:
     * {@link Character} to {@link String}, {@link BigInteger} to
     * {@link BigDecimal}. Other values are returned unchanged.
     *
     * @param value the value (may be null)
     * @return the bindable value
     */
    public static Object normalize(Object value) {
        if (value instanceof Character) {
            return value.toString();
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        return value;
    }

    /**
     * Returns the values bound so far, in placeholder order.
     *
     * @return an unmodifiable list of parameter values
     */
    public List<Object> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    /**
     * Renders a value as an inline SQL literal.
     */
    static String inlineLiteral(Object value) {
        if (value instanceof String || value instanceof Character) {
            return SQLQuoting.quoteLiteral(value.toString());
        }
        if (value instanceof Boolean) {
            return value.toString().toUpperCase();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof LocalDate || value instanceof java.sql.Date) {
            return "DATE " + SQLQuoting.quoteLiteral(value.toString());
        }
        if (value instanceof LocalDateTime) {
            return "TIMESTAMP " + SQLQuoting.quoteLiteral(value.toString().replace('T', ' '));
        }
        if (value instanceof java.sql.Timestamp) {
            return "TIMESTAMP " + SQLQuoting.quoteLiteral(value.toString());
        }
        return SQLQuoting.quoteLiteral(value.toString());
    }
}
