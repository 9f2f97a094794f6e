package com.pipeduck.generator;

import com.pipeduck.logical.AliasedRelation;
import com.pipeduck.logical.Join;
import com.pipeduck.logical.LogicalPlan;
import com.pipeduck.logical.TableScan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * SQL generator that renders pipeduck logical plans as Spark SQL.
 *
 * <p>Each plan node renders its own clause through
 * {@link LogicalPlan#toSQL(com.pipeduck.logical.SQLGenerator)} and asks the generator
 * for the FROM item of its child. Children are wrapped as subqueries aliased with
 * their relation name, so qualified column references ({@code orders.status},
 * {@code c.c_name}) stay valid through the pipeline; joins are inlined so both
 * sides keep their names.
 *
 * <p>Example usage:
 * <pre>
 *   LogicalPlan plan = compiler.compile("source = orders | where status = 'open'");
 *   String sql = new SQLGenerator().generate(plan);
 *   // SELECT * FROM orders WHERE (orders.status = 'open')
 * </pre>
 *
 * <p>Instances keep a subquery alias counter and are not thread-safe; create one per
 * rendering.
 */
public class SQLGenerator implements com.pipeduck.logical.SQLGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SQLGenerator.class);

    private int aliasCounter;
    private int depth;

    /**
     * Generates SQL for a logical plan node.
     *
     * @param plan the logical plan to translate
     * @return the generated SQL string
     * @throws NullPointerException if plan is null
     */
    @Override
    public String generate(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        if (depth == 0) {
            aliasCounter = 0;
        }
        depth++;
        try {
            String sql = plan.toSQL(this);
            if (depth == 1) {
                logger.debug("Generated SQL: {}", sql);
            }
            return sql;
        } finally {
            depth--;
        }
    }

    @Override
    public String generateFromItem(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");

        if (plan instanceof Join join) {
            return join.toJoinClause(this);
        }
        if (plan instanceof TableScan scan) {
            return SQLQuoting.quoteTableName(scan.tableName());
        }
        if (plan instanceof AliasedRelation aliased && aliased.child() instanceof TableScan scan) {
            return SQLQuoting.quoteTableName(scan.tableName()) + " AS "
                + SQLQuoting.quoteIdentifierIfNeeded(aliased.alias());
        }
        if (plan instanceof AliasedRelation aliased) {
            return "(" + generate(aliased.child()) + ") AS " + SQLQuoting.quoteIdentifierIfNeeded(aliased.alias());
        }

        String qualifier = plan.relationQualifier();
        String alias = qualifier != null ? SQLQuoting.quoteIdentifierIfNeeded(qualifier) : generateSubqueryAlias();
        return "(" + generate(plan) + ") AS " + alias;
    }

    @Override
    public String generateSubqueryAlias() {
        return "subquery_" + (++aliasCounter);
    }
}
