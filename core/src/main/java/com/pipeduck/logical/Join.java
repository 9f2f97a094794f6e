package com.pipeduck.logical;

import com.pipeduck.expression.Expression;
import com.pipeduck.types.StructField;
import com.pipeduck.types.StructType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a join, the plan of a {@code join} command.
 *
 * <p>The output schema is the left schema followed by the right schema; column
 * name collisions are kept and must be qualified downstream. Semi and anti joins
 * output the left schema only.
 *
 * <p>Examples:
 * <pre>
 *   | join on c_custkey = o_custkey orders
 *   | left join left = c right = o on c.id = o.cid [ source = orders | where total > 10 ]
 *   | cross join nation
 * </pre>
 */
public final class Join extends LogicalPlan {

    private final JoinType joinType;
    private final Expression condition;

    /**
     * Creates a join node.
     *
     * @param left the left relation
     * @param right the right relation
     * @param joinType the join type
     * @param condition the join condition (null for CROSS join; optional otherwise)
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, Expression condition) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.condition = condition;

        if (joinType == JoinType.CROSS && condition != null) {
            throw new IllegalArgumentException("condition must be null for CROSS join");
        }
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    public JoinType joinType() {
        return joinType;
    }

    /**
     * Returns the join condition.
     *
     * @return the condition, or null when the join has no ON clause
     */
    public Expression condition() {
        return condition;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        return "SELECT * FROM " + generator.generateFromItem(this);
    }

    /**
     * Renders this join as a FROM clause item: {@code left JOIN right ON condition}.
     */
    public String toJoinClause(SQLGenerator generator) {
        StringBuilder sql = new StringBuilder();
        sql.append(generator.generateFromItem(left()));
        sql.append(" ").append(joinType.keyword()).append(" ");
        sql.append(generator.generateFromItem(right()));
        if (condition != null) {
            sql.append(" ON ").append(condition.toSQL());
        }
        return sql.toString();
    }

    @Override
    protected StructType inferSchema() {
        StructType leftSchema = left().schema();
        if (joinType.isLeftOnly()) {
            return leftSchema;
        }
        List<StructField> fields = new ArrayList<>(leftSchema.fields());
        fields.addAll(right().schema().fields());
        return new StructType(fields);
    }

    @Override
    public String toString() {
        if (condition != null) {
            return String.format("Join(%s, condition=%s)", joinType, condition);
        }
        return String.format("Join(%s)", joinType);
    }

    /**
     * Supported join types.
     */
    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT("LEFT OUTER JOIN"),
        RIGHT("RIGHT OUTER JOIN"),
        FULL("FULL OUTER JOIN"),
        CROSS("CROSS JOIN"),
        LEFT_SEMI("LEFT SEMI JOIN"),
        LEFT_ANTI("LEFT ANTI JOIN");

        private final String keyword;

        JoinType(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        /**
         * Returns whether the join outputs only the left side's columns.
         */
        public boolean isLeftOnly() {
            return this == LEFT_SEMI || this == LEFT_ANTI;
        }
    }
}
