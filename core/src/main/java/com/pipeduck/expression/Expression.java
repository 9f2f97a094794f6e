package com.pipeduck.expression;

import com.pipeduck.types.DataType;

/**
 * Base interface for resolved expressions in a pipeduck logical plan.
 *
 * <p>Expressions are produced by the analyzer from PPL AST expressions once every
 * column reference has been bound against a scope, so every expression knows its
 * result type. They appear in:
 * <ul>
 *   <li>{@code where} predicates and join conditions</li>
 *   <li>{@code eval} assignments and {@code fields} projections</li>
 *   <li>{@code stats} aggregates and group keys</li>
 *   <li>{@code sort} keys</li>
 * </ul>
 *
 * <p>All concrete implementations are immutable.
 */
public interface Expression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();

    /**
     * Converts this expression to its Spark SQL text.
     *
     * @return the SQL string representation
     */
    String toSQL();
}
