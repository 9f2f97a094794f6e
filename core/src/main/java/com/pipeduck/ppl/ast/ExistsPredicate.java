package com.pipeduck.ppl.ast;

import java.util.Objects;

/**
 * {@code exists [ <subquery> ]}; negation is an enclosing {@code not}.
 */
public record ExistsPredicate(PPLQuery subquery) implements AstExpression {

    public ExistsPredicate {
        Objects.requireNonNull(subquery, "subquery must not be null");
    }

    @Override
    public String canonicalName() {
        return "exists [ " + subquery.canonicalText() + " ]";
    }
}
