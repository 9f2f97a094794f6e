package com.pipeduck.ppl.ast;

import java.util.Objects;

public record LikePredicate(AstExpression value, AstExpression pattern, boolean negated) implements AstExpression {

    public LikePredicate {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
    }

    @Override
    public String canonicalName() {
        return value.canonicalName() + (negated ? " not" : "") + " like " + pattern.canonicalName();
    }
}
