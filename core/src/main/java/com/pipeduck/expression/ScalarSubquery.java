package com.pipeduck.expression;

import com.pipeduck.logical.LogicalPlan;
import com.pipeduck.types.DataType;

/**
 * Scalar subquery expression that returns a single value.
 *
 * <p>The subquery must produce exactly one column; the analyzer checks this. Zero rows
 * yield NULL, more than one row is a runtime error of the host engine.
 */
public final class ScalarSubquery extends SubqueryExpression {

    public ScalarSubquery(LogicalPlan subquery) {
        super(subquery);
        if (subquery.schema().size() != 1) {
            throw new IllegalArgumentException(
                "scalar subquery must produce exactly one column, got " + subquery.schema().size());
        }
    }

    @Override
    public DataType dataType() {
        return subquery.schema().fieldAt(0).dataType();
    }

    @Override
    public String toSQL() {
        return subquerySQL();
    }

    @Override
    public String toString() {
        return String.format("ScalarSubquery(%s)", subquery);
    }
}
