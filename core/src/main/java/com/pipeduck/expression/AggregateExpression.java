package com.pipeduck.expression;

import com.pipeduck.functions.FunctionRegistry;
import com.pipeduck.types.DataType;
import java.util.Objects;

/**
 * Represents an aggregate expression of a {@code stats} command, e.g. {@code count()},
 * {@code sum(amount)}, {@code dc(customer)}.
 *
 * <p>{@code dc}/{@code distinct_count} are kept as {@code count} with the distinct flag set:
 * <pre>
 *   dc(customer)  ->  COUNT(DISTINCT customer)
 * </pre>
 *
 * <p>The alias is the output column name: the user supplied {@code as} name or the
 * canonical rendering of the PPL call.
 */
public final class AggregateExpression implements Expression {

    private final String function;
    private final Expression argument;
    private final String alias;
    private final boolean distinct;
    private final DataType dataType;

    /**
     * Creates an aggregate expression.
     *
     * @param function the aggregate function name (count, sum, avg, ...)
     * @param argument the expression to aggregate (null for {@code count()})
     * @param alias the result column name
     * @param distinct whether to aggregate only distinct values
     * @param dataType the result type
     */
    public AggregateExpression(String function, Expression argument, String alias,
                               boolean distinct, DataType dataType) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.argument = argument;
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.distinct = distinct;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public String function() {
        return function;
    }

    /**
     * Returns the expression being aggregated.
     *
     * @return the argument expression, or null for {@code count()}
     */
    public Expression argument() {
        return argument;
    }

    public String alias() {
        return alias;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        // COUNT returns 0 for empty groups
        return !function.equalsIgnoreCase("count");
    }

    @Override
    public String toSQL() {
        StringBuilder sql = new StringBuilder();
        sql.append(FunctionRegistry.resolveName(function).toUpperCase());
        sql.append("(");
        if (distinct) {
            sql.append("DISTINCT ");
        }
        sql.append(argument != null ? argument.toSQL() : "*");
        sql.append(")");
        return sql.toString();
    }

    @Override
    public String toString() {
        return toSQL() + " AS " + alias;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregateExpression that)) return false;
        return distinct == that.distinct &&
               function.equalsIgnoreCase(that.function) &&
               Objects.equals(argument, that.argument) &&
               alias.equals(that.alias) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function.toLowerCase(), argument, alias, distinct, dataType);
    }
}
