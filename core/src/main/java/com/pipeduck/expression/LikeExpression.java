package com.pipeduck.expression;

import com.pipeduck.types.BooleanType;
import com.pipeduck.types.DataType;
import java.util.Objects;

/**
 * Expression representing a LIKE predicate with SQL wildcards ({@code %} matches any
 * sequence, {@code _} one character).
 *
 * <p>Examples:
 * <pre>
 *   name like '%smith'
 *   name not like 'A_'
 * </pre>
 */
public final class LikeExpression implements Expression {

    private final Expression value;
    private final Expression pattern;
    private final boolean negated;

    public LikeExpression(Expression value, Expression pattern, boolean negated) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.negated = negated;
    }

    public Expression value() {
        return value;
    }

    public Expression pattern() {
        return pattern;
    }

    public boolean negated() {
        return negated;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return value.nullable() || pattern.nullable();
    }

    @Override
    public String toSQL() {
        String not = negated ? "NOT " : "";
        return "(%s %sLIKE %s)".formatted(value.toSQL(), not, pattern.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LikeExpression that)) return false;
        return negated == that.negated &&
               Objects.equals(value, that.value) &&
               Objects.equals(pattern, that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, pattern, negated);
    }
}
