package com.tablebridge.expression;

import com.tablebridge.generator.SQLQuoting;
import com.tablebridge.schema.ColumnType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Expression representing a plain (non-windowed) function call, such as
 * {@code count(order_id)}.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;

    /**
     * Creates a function call.
     *
     * @param functionName the function name, a plain identifier
     * @param arguments the arguments
     * @throws IllegalArgumentException if the function name is not a plain identifier
     */
    public FunctionCall(String functionName, List<Expression> arguments) {
        SQLQuoting.validateIdentifier(functionName);
        this.functionName = functionName.toLowerCase(Locale.ROOT);
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    public static FunctionCall count(Expression argument) {
        return new FunctionCall("count", List.of(argument));
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public ColumnType dataType() {
        if (functionName.equals("count")) {
            return ColumnType.BIGINT;
        }
        return arguments.isEmpty() ? ColumnType.OTHER : arguments.get(0).dataType();
    }

    @Override
    public String toSQL(ParameterBinder binder) {
        StringBuilder sql = new StringBuilder(functionName).append("(");
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(arguments.get(i).toSQL(binder));
        }
        return sql.append(")").toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return functionName.equals(that.functionName) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments);
    }

    @Override
    public String toString() {
        return functionName + arguments;
    }
}
