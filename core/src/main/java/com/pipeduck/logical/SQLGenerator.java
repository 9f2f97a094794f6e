package com.pipeduck.logical;

/**
 * Interface for SQL generation from logical plans.
 *
 * <p>The implementation lives in the generator package; plan nodes only see this
 * interface when rendering their own clause.
 */
public interface SQLGenerator {

    /**
     * Generates SQL for a logical plan node.
     *
     * @param plan the logical plan to translate
     * @return the generated SQL string
     */
    String generate(LogicalPlan plan);

    /**
     * Renders a plan as an item of a FROM clause: a table name, a join, or a
     * parenthesized subquery with an alias.
     *
     * @param plan the plan to render
     * @return the FROM clause item
     */
    String generateFromItem(LogicalPlan plan);

    /**
     * Generates a unique subquery alias.
     *
     * @return a unique alias like "subquery_1", "subquery_2", etc.
     */
    String generateSubqueryAlias();
}
