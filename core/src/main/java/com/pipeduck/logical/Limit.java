package com.pipeduck.logical;

import com.pipeduck.types.StructType;
import java.util.Objects;

/**
 * Logical plan node representing a limit, the plan of {@code head n [from m]}.
 *
 * <p>SQL generation:
 * <pre>SELECT * FROM (child) LIMIT limit OFFSET offset</pre>
 */
public final class Limit extends LogicalPlan {

    private final long limit;
    private final long offset;

    /**
     * Creates a limit node with an offset.
     *
     * @param child the child node
     * @param limit the maximum number of rows to return
     * @param offset the number of rows to skip
     */
    public Limit(LogicalPlan child, long limit, long offset) {
        super(child);
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative");
        }
        this.limit = limit;
        this.offset = offset;
    }

    public Limit(LogicalPlan child, long limit) {
        this(child, limit, 0);
    }

    public long limit() {
        return limit;
    }

    public long offset() {
        return offset;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        String from = generator.generateFromItem(child());
        if (offset > 0) {
            return String.format("SELECT * FROM %s LIMIT %d OFFSET %d", from, limit, offset);
        }
        return String.format("SELECT * FROM %s LIMIT %d", from, limit);
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public String toString() {
        if (offset > 0) {
            return String.format("Limit(limit=%d, offset=%d)", limit, offset);
        }
        return String.format("Limit(%d)", limit);
    }
}
