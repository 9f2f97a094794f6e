package com.pipeduck.logical;

import com.pipeduck.types.StructType;
import java.util.Objects;

/**
 * Logical plan node representing a relation with a user-provided alias, from
 * {@code source = orders as o} or a join side {@code join ... customer as c}.
 *
 * <p>The alias replaces the relation's own name as the column qualifier, so
 * {@code o.status} resolves and {@code orders.status} no longer does.
 */
public final class AliasedRelation extends LogicalPlan {

    private final String alias;

    public AliasedRelation(LogicalPlan child, String alias) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        if (alias.isEmpty()) {
            throw new IllegalArgumentException("alias must not be empty");
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public String alias() {
        return alias;
    }

    @Override
    public String relationQualifier() {
        return alias;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        return "SELECT * FROM " + generator.generateFromItem(this);
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public String toString() {
        return String.format("AliasedRelation[%s]", alias);
    }
}
