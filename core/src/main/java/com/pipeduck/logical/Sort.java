package com.pipeduck.logical;

import com.pipeduck.expression.Expression;
import com.pipeduck.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a sort, the plan of a {@code sort} command.
 *
 * <p>Sort orders apply in listed order: rows equal on the first key are ordered by
 * the second, and so on. {@code sort - a, + b} sorts by {@code a} descending, ties by
 * {@code b} ascending.
 *
 * <p>SQL generation:
 * <pre>SELECT * FROM (child) ORDER BY expr1 ASC NULLS FIRST, expr2 DESC NULLS LAST, ...</pre>
 */
public final class Sort extends LogicalPlan {

    private final List<SortOrder> sortOrders;

    public Sort(LogicalPlan child, List<SortOrder> sortOrders) {
        super(child);
        this.sortOrders = new ArrayList<>(Objects.requireNonNull(sortOrders, "sortOrders must not be null"));

        if (this.sortOrders.isEmpty()) {
            throw new IllegalArgumentException("sortOrders must not be empty");
        }
    }

    public List<SortOrder> sortOrders() {
        return Collections.unmodifiableList(sortOrders);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        List<String> orderClauses = new ArrayList<>();
        for (SortOrder order : sortOrders) {
            StringBuilder clause = new StringBuilder();
            clause.append(order.expression().toSQL());
            clause.append(order.direction() == SortDirection.DESCENDING ? " DESC" : " ASC");
            clause.append(order.nullOrdering() == NullOrdering.NULLS_FIRST ? " NULLS FIRST" : " NULLS LAST");
            orderClauses.add(clause.toString());
        }

        return String.format("SELECT * FROM %s ORDER BY %s",
            generator.generateFromItem(child()), String.join(", ", orderClauses));
    }

    @Override
    protected StructType inferSchema() {
        // Sort doesn't change the schema
        return child().schema();
    }

    @Override
    public String toString() {
        return String.format("Sort(%s)", sortOrders);
    }

    /**
     * Represents a sort order (expression + direction + null handling).
     */
    public static final class SortOrder {
        private final Expression expression;
        private final SortDirection direction;
        private final NullOrdering nullOrdering;

        public SortOrder(Expression expression, SortDirection direction, NullOrdering nullOrdering) {
            this.expression = Objects.requireNonNull(expression);
            this.direction = Objects.requireNonNull(direction);
            this.nullOrdering = Objects.requireNonNull(nullOrdering);
        }

        /**
         * Creates a sort order with the default null placement: nulls first when
         * ascending, last when descending.
         */
        public SortOrder(Expression expression, SortDirection direction) {
            this(expression, direction,
                 direction == SortDirection.ASCENDING ? NullOrdering.NULLS_FIRST : NullOrdering.NULLS_LAST);
        }

        public Expression expression() {
            return expression;
        }

        public SortDirection direction() {
            return direction;
        }

        public NullOrdering nullOrdering() {
            return nullOrdering;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof SortOrder that)) return false;
            return expression.equals(that.expression) &&
                   direction == that.direction &&
                   nullOrdering == that.nullOrdering;
        }

        @Override
        public int hashCode() {
            return Objects.hash(expression, direction, nullOrdering);
        }

        @Override
        public String toString() {
            return String.format("%s %s %s", expression, direction, nullOrdering);
        }
    }

    public enum SortDirection {
        ASCENDING,
        DESCENDING
    }

    public enum NullOrdering {
        NULLS_FIRST,
        NULLS_LAST
    }
}
