package com.pipeduck.ppl.ast;

import java.util.Objects;

/**
 * {@code <expr> [not] in [ <subquery> ]}.
 */
public record InSubqueryPredicate(AstExpression value, PPLQuery subquery, boolean negated) implements AstExpression {

    public InSubqueryPredicate {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(subquery, "subquery must not be null");
    }

    @Override
    public String canonicalName() {
        return value.canonicalName() + (negated ? " not" : "") + " in [ " + subquery.canonicalText() + " ]";
    }
}
