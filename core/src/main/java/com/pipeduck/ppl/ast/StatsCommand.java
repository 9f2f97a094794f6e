package com.pipeduck.ppl.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code stats <agg> [as alias], ... [by <expr>, ...]}.
 *
 * @param aggregations the aggregate list, in order
 * @param groupBy the group keys; empty for a single global group
 */
public record StatsCommand(List<Aggregation> aggregations, List<AstExpression> groupBy) implements PPLCommand {

    public StatsCommand {
        aggregations = List.copyOf(aggregations);
        groupBy = List.copyOf(groupBy);
        if (aggregations.isEmpty()) {
            throw new IllegalArgumentException("stats requires at least one aggregation");
        }
    }

    /**
     * One entry of the aggregate list.
     *
     * @param expression the aggregate call as written
     * @param alias the {@code as} name, or null
     */
    public record Aggregation(AstExpression expression, String alias) {

        public Aggregation {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        /**
         * Returns the output column name: the alias, or the canonical text of the call
         * ({@code count()}, {@code avg(amount)}).
         */
        public String outputName() {
            return alias != null ? alias : expression.canonicalName();
        }
    }

    @Override
    public String canonicalText() {
        String aggs = aggregations.stream()
            .map(a -> a.alias() != null ? a.expression().canonicalName() + " as " + a.alias()
                                        : a.expression().canonicalName())
            .collect(Collectors.joining(", "));
        if (groupBy.isEmpty()) {
            return "stats " + aggs;
        }
        return "stats " + aggs + " by "
            + groupBy.stream().map(AstExpression::canonicalName).collect(Collectors.joining(", "));
    }
}
