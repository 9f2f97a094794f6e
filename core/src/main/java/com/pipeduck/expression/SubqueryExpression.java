package com.pipeduck.expression;

import com.pipeduck.generator.SQLGenerator;
import com.pipeduck.logical.LogicalPlan;
import java.util.Objects;

/**
 * Base class for subquery expressions, written in PPL as a bracketed pipeline.
 *
 * <ul>
 *   <li>Scalar subquery: {@code where amount > [ source = orders | stats avg(amount) ]}</li>
 *   <li>IN subquery: {@code where id in [ source = vip | fields id ]}</li>
 *   <li>EXISTS subquery: {@code where exists [ source = orders | where o_custkey = c_custkey ]}</li>
 * </ul>
 *
 * <p>The nested plan may contain outer column references (correlation).
 */
public abstract class SubqueryExpression implements Expression {

    protected final LogicalPlan subquery;

    protected SubqueryExpression(LogicalPlan subquery) {
        this.subquery = Objects.requireNonNull(subquery, "subquery must not be null");
    }

    public LogicalPlan subquery() {
        return subquery;
    }

    @Override
    public boolean nullable() {
        return true;
    }

    protected String subquerySQL() {
        return "(" + new SQLGenerator().generate(subquery) + ")";
    }
}
