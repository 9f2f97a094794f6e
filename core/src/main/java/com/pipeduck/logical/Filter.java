package com.pipeduck.logical;

import com.pipeduck.expression.Expression;
import com.pipeduck.types.StructType;
import java.util.Objects;

/**
 * Logical plan node representing a filter, the plan of a {@code where} command.
 *
 * <p>SQL generation:
 * <pre>SELECT * FROM (child) WHERE condition</pre>
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    /**
     * Creates a filter node.
     *
     * @param child the child node
     * @param condition the filter condition (must evaluate to boolean)
     */
    public Filter(LogicalPlan child, Expression condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public Expression condition() {
        return condition;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        return String.format("SELECT * FROM %s WHERE %s",
            generator.generateFromItem(child()), condition.toSQL());
    }

    @Override
    protected StructType inferSchema() {
        // Filter doesn't change the schema
        return child().schema();
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", condition);
    }
}
