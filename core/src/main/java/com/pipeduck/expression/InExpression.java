package com.pipeduck.expression;

import com.pipeduck.types.BooleanType;
import com.pipeduck.types.DataType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing {@code value [NOT] IN (v1, v2, ...)} over a literal list.
 * Membership in a subquery result is {@link InSubquery}.
 */
public final class InExpression implements Expression {

    private final Expression testExpr;
    private final List<Expression> values;
    private final boolean negated;

    public InExpression(Expression testExpr, List<Expression> values, boolean negated) {
        Objects.requireNonNull(testExpr, "testExpr must not be null");
        Objects.requireNonNull(values, "values must not be null");

        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN list requires at least one value");
        }

        this.testExpr = testExpr;
        this.values = new ArrayList<>(values);
        this.negated = negated;
    }

    public Expression testExpr() {
        return testExpr;
    }

    public List<Expression> values() {
        return Collections.unmodifiableList(values);
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        if (testExpr.nullable()) {
            return true;
        }
        return values.stream().anyMatch(Expression::nullable);
    }

    @Override
    public String toSQL() {
        StringBuilder sql = new StringBuilder("(");
        sql.append(testExpr.toSQL());
        sql.append(negated ? " NOT IN (" : " IN (");
        sql.append(values.stream()
            .map(Expression::toSQL)
            .collect(Collectors.joining(", ")));
        sql.append("))");
        return sql.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InExpression)) return false;
        InExpression that = (InExpression) obj;
        return negated == that.negated &&
               Objects.equals(testExpr, that.testExpr) &&
               Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testExpr, values, negated);
    }

    @Override
    public String toString() {
        return toSQL();
    }
}
