package com.pipeduck.expression;

import com.pipeduck.logical.LogicalPlan;
import com.pipeduck.types.BooleanType;
import com.pipeduck.types.DataType;
import java.util.Objects;

/**
 * IN subquery expression that tests membership of a value in the single output column
 * of a subquery.
 *
 * <p>NULL handling follows SQL semantics: a NULL test value yields NULL, and a value not
 * found in a result containing NULL yields NULL rather than false.
 */
public final class InSubquery extends SubqueryExpression {

    private final Expression testExpression;
    private final boolean isNegated;

    public InSubquery(Expression testExpression, LogicalPlan subquery, boolean isNegated) {
        super(subquery);
        this.testExpression = Objects.requireNonNull(testExpression, "testExpression must not be null");
        this.isNegated = isNegated;
    }

    public InSubquery(Expression testExpression, LogicalPlan subquery) {
        this(testExpression, subquery, false);
    }

    public Expression testExpression() {
        return testExpression;
    }

    public boolean isNegated() {
        return isNegated;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public String toSQL() {
        return "(" + testExpression.toSQL() + (isNegated ? " NOT IN " : " IN ") + subquerySQL() + ")";
    }

    @Override
    public String toString() {
        String operator = isNegated ? "NOT IN" : "IN";
        return String.format("%s %s (%s)", testExpression, operator, subquery);
    }
}
