package com.pipeduck.expression;

import com.pipeduck.logical.LogicalPlan;
import com.pipeduck.types.BooleanType;
import com.pipeduck.types.DataType;

/**
 * EXISTS subquery expression: true when the subquery returns at least one row. The
 * values returned are ignored, so the subquery may have any number of columns.
 */
public final class ExistsSubquery extends SubqueryExpression {

    private final boolean isNegated;

    public ExistsSubquery(LogicalPlan subquery, boolean isNegated) {
        super(subquery);
        this.isNegated = isNegated;
    }

    public ExistsSubquery(LogicalPlan subquery) {
        this(subquery, false);
    }

    public boolean isNegated() {
        return isNegated;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public String toSQL() {
        return (isNegated ? "NOT EXISTS " : "EXISTS ") + subquerySQL();
    }

    @Override
    public String toString() {
        String operator = isNegated ? "NOT EXISTS" : "EXISTS";
        return String.format("%s (%s)", operator, subquery);
    }
}
