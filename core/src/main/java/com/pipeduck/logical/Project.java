package com.pipeduck.logical;

import com.pipeduck.expression.ColumnReference;
import com.pipeduck.expression.Expression;
import com.pipeduck.generator.SQLQuoting;
import com.pipeduck.types.StructField;
import com.pipeduck.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a projection.
 *
 * <p>Produced by {@code fields} (exactly the listed columns), {@code eval} (existing
 * columns followed by computed ones) and {@code rename} (all columns, some renamed).
 *
 * <p>SQL generation:
 * <pre>SELECT expr1 AS name1, expr2 AS name2, ... FROM (child)</pre>
 */
public final class Project extends LogicalPlan {

    private final List<Expression> projections;
    private final List<String> names;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param projections the projection expressions
     * @param names the output column name of each projection
     */
    public Project(LogicalPlan child, List<Expression> projections, List<String> names) {
        super(child);
        this.projections = new ArrayList<>(Objects.requireNonNull(projections, "projections must not be null"));
        this.names = new ArrayList<>(Objects.requireNonNull(names, "names must not be null"));

        if (this.projections.isEmpty()) {
            throw new IllegalArgumentException("projections must not be empty");
        }
        if (this.projections.size() != this.names.size()) {
            throw new IllegalArgumentException("projections and names must have the same size");
        }
        // input columns kept under their own name may repeat, as both sides of a join can
        for (int i = 0; i < this.names.size(); i++) {
            String name = this.names.get(i);
            if (!isPassThrough(i) && Collections.frequency(this.names, name) > 1) {
                throw new IllegalArgumentException("duplicate output column: " + name);
            }
        }
    }

    /**
     * Returns whether the i-th projection is an input column kept under its own name.
     */
    public boolean isPassThrough(int i) {
        return projections.get(i) instanceof ColumnReference column && column.columnName().equals(names.get(i));
    }

    public List<Expression> projections() {
        return Collections.unmodifiableList(projections);
    }

    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        StringBuilder sql = new StringBuilder("SELECT ");
        for (int i = 0; i < projections.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            Expression expr = projections.get(i);
            String name = names.get(i);
            sql.append(expr.toSQL());
            if (!isPassThrough(i)) {
                sql.append(" AS ").append(SQLQuoting.quoteIdentifierIfNeeded(name));
            }
        }
        sql.append(" FROM ").append(generator.generateFromItem(child()));
        return sql.toString();
    }

    @Override
    protected StructType inferSchema() {
        List<StructField> fields = new ArrayList<>();
        for (int i = 0; i < projections.size(); i++) {
            Expression expr = projections.get(i);
            fields.add(new StructField(names.get(i), expr.dataType(), expr.nullable()));
        }
        return new StructType(fields);
    }

    @Override
    public String toString() {
        List<String> items = new ArrayList<>();
        for (int i = 0; i < projections.size(); i++) {
            Expression expr = projections.get(i);
            String name = names.get(i);
            items.add(isPassThrough(i)
                ? expr.toString()
                : expr + " AS " + name);
        }
        return String.format("Project(%s)", items);
    }
}
