package com.pipeduck.logical;

import com.pipeduck.expression.AggregateExpression;
import com.pipeduck.expression.ColumnReference;
import com.pipeduck.expression.Expression;
import com.pipeduck.expression.StructFieldAccess;
import com.pipeduck.generator.SQLQuoting;
import com.pipeduck.types.StructField;
import com.pipeduck.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing an aggregation, the plan of a {@code stats} command.
 *
 * <p>The output columns are the grouping columns followed by the aggregates, in that
 * order. With no grouping expressions the whole input is a single group and the
 * output is exactly one row.
 *
 * <pre>
 *   stats count() as n, avg(amount) by region
 * </pre>
 *
 * <p>SQL generation:
 * <pre>
 * SELECT groupingExpr1, ..., aggFunc1 AS alias1, ...
 * FROM (child)
 * GROUP BY groupingExpr1, ...
 * </pre>
 */
public final class Aggregate extends LogicalPlan {

    private final List<Expression> groupingExpressions;
    private final List<AggregateExpression> aggregateExpressions;

    /**
     * Creates an aggregate node.
     *
     * @param child the child node
     * @param groupingExpressions the grouping expressions (empty for global aggregation)
     * @param aggregateExpressions the aggregate expressions (must not be empty)
     */
    public Aggregate(LogicalPlan child,
                     List<Expression> groupingExpressions,
                     List<AggregateExpression> aggregateExpressions) {
        super(child);
        this.groupingExpressions = new ArrayList<>(
            Objects.requireNonNull(groupingExpressions, "groupingExpressions must not be null"));
        this.aggregateExpressions = new ArrayList<>(
            Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null"));
        if (this.aggregateExpressions.isEmpty()) {
            throw new IllegalArgumentException("aggregateExpressions must not be empty");
        }
    }

    public List<Expression> groupingExpressions() {
        return Collections.unmodifiableList(groupingExpressions);
    }

    public List<AggregateExpression> aggregateExpressions() {
        return Collections.unmodifiableList(aggregateExpressions);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    /**
     * Returns whether this aggregation has no {@code by} clause.
     */
    public boolean isGlobal() {
        return groupingExpressions.isEmpty();
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        List<String> selectExprs = new ArrayList<>();
        for (Expression expr : groupingExpressions) {
            String sql = expr.toSQL();
            if (expr instanceof StructFieldAccess) {
                sql += " AS " + SQLQuoting.quoteIdentifier(groupingName(expr));
            }
            selectExprs.add(sql);
        }
        for (AggregateExpression aggExpr : aggregateExpressions) {
            selectExprs.add(aggExpr.toSQL() + " AS " + SQLQuoting.quoteIdentifierIfNeeded(aggExpr.alias()));
        }

        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(String.join(", ", selectExprs));
        sql.append(" FROM ").append(generator.generateFromItem(child()));

        if (!groupingExpressions.isEmpty()) {
            List<String> groupExprs = new ArrayList<>();
            for (Expression expr : groupingExpressions) {
                groupExprs.add(expr.toSQL());
            }
            sql.append(" GROUP BY ").append(String.join(", ", groupExprs));
        }
        return sql.toString();
    }

    @Override
    protected StructType inferSchema() {
        List<StructField> fields = new ArrayList<>();
        for (Expression expr : groupingExpressions) {
            fields.add(new StructField(groupingName(expr), expr.dataType(), expr.nullable()));
        }
        for (AggregateExpression aggExpr : aggregateExpressions) {
            fields.add(new StructField(aggExpr.alias(), aggExpr.dataType(), aggExpr.nullable()));
        }
        return new StructType(fields);
    }

    /**
     * Returns the output column name of a grouping expression: the column name, or the
     * dotted path for a nested field.
     */
    public static String groupingName(Expression expr) {
        if (expr instanceof ColumnReference column) {
            return column.columnName();
        }
        if (expr instanceof StructFieldAccess access) {
            return access.path();
        }
        return expr.toSQL();
    }

    @Override
    public String toString() {
        return String.format("Aggregate(groupBy=%s, agg=%s)", groupingExpressions, aggregateExpressions);
    }
}
