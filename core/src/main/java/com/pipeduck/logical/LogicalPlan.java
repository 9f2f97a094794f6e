package com.pipeduck.logical;

import com.pipeduck.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all logical plan nodes.
 *
 * <p>A node owns zero or more children and defines an output schema (ordered, typed
 * columns). Plans are built bottom-up by the analyzer and never mutated afterwards;
 * the schema is computed once on first access.
 *
 * <p>The plan is handed to the host engine as is, or rendered as Spark SQL by calling
 * {@link #toSQL(SQLGenerator)}.
 *
 * @see SQLGenerator
 */
public abstract class LogicalPlan {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /** Output schema of this node, computed lazily */
    private StructType schema;

    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = new ArrayList<>(children);
    }

    /**
     * Translates this logical plan node to SQL.
     *
     * @param generator the SQL generator to use
     * @return the generated SQL string
     */
    public abstract String toSQL(SQLGenerator generator);

    /**
     * Infers the output schema for this logical plan node from its children.
     *
     * @return the output schema
     */
    protected abstract StructType inferSchema();

    public List<LogicalPlan> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns the output schema of this plan node.
     *
     * @return the output schema
     */
    public StructType schema() {
        if (schema == null) {
            schema = inferSchema();
        }
        return schema;
    }

    /**
     * Returns the name under which the columns of this plan can be qualified, or null if
     * the plan has no single relation name (a join, or anything computed from a join).
     */
    public String relationQualifier() {
        if (children.size() != 1 || children.get(0) instanceof Join) {
            return null;
        }
        return children.get(0).relationQualifier();
    }

    /**
     * Renders the plan tree, one node per line, children indented under their parent.
     *
     * <pre>
     * Limit(5)
     * +- Sort([n DESCENDING NULLS_LAST])
     *    +- Aggregate(groupBy=[region], agg=[COUNT(*) AS n])
     * </pre>
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, "", "");
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, String marker, String indent) {
        sb.append(indent).append(marker).append(this).append('\n');
        String childIndent = marker.isEmpty() ? indent : indent + "   ";
        for (LogicalPlan child : children) {
            child.appendTree(sb, "+- ", childIndent);
        }
    }

    /**
     * Returns a one-line description of this node without its children.
     */
    @Override
    public abstract String toString();
}
