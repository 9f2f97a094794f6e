package com.pipeduck.ppl.ast;

import java.util.Objects;

public record BetweenPredicate(AstExpression value, AstExpression lower, AstExpression upper,
                               boolean negated) implements AstExpression {

    public BetweenPredicate {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(lower, "lower must not be null");
        Objects.requireNonNull(upper, "upper must not be null");
    }

    @Override
    public String canonicalName() {
        return value.canonicalName() + (negated ? " not" : "") + " between "
            + lower.canonicalName() + " and " + upper.canonicalName();
    }
}
