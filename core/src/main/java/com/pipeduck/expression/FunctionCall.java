package com.pipeduck.expression;

import com.pipeduck.functions.FunctionRegistry;
import com.pipeduck.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a call to a scalar function.
 *
 * <p>Examples:
 * <pre>
 *   upper(name)
 *   adddate(order_date, 7)
 *   coalesce(region, 'unknown')
 * </pre>
 *
 * <p>The function name is the PPL name; {@link FunctionRegistry} renders the host engine
 * equivalent. Aggregate calls are {@link AggregateExpression}.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final DataType dataType;
    private final boolean nullable;

    /**
     * Creates a function call expression.
     *
     * @param functionName the PPL function name
     * @param arguments the resolved arguments
     * @param dataType the return data type
     * @param nullable whether the result can be null
     */
    public FunctionCall(String functionName, List<Expression> arguments,
                        DataType dataType, boolean nullable) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (this.functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toSQL() {
        String[] argStrings = arguments.stream()
            .map(Expression::toSQL)
            .toArray(String[]::new);
        return FunctionRegistry.translate(functionName, argStrings);
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall that)) return false;
        return nullable == that.nullable &&
               functionName.equalsIgnoreCase(that.functionName) &&
               Objects.equals(arguments, that.arguments) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName.toLowerCase(), arguments, dataType, nullable);
    }
}
