package com.pipeduck.ppl.ast;

import java.util.Objects;

/**
 * A bracketed subquery in value position, producing one value.
 */
public record ScalarSubqueryValue(PPLQuery subquery) implements AstExpression {

    public ScalarSubqueryValue {
        Objects.requireNonNull(subquery, "subquery must not be null");
    }

    @Override
    public String canonicalName() {
        return "[ " + subquery.canonicalText() + " ]";
    }
}
