package com.pipeduck.ppl.ast;

import java.util.Objects;

public record IsNullPredicate(AstExpression value, boolean negated) implements AstExpression {

    public IsNullPredicate {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public String canonicalName() {
        return value.canonicalName() + (negated ? " is not null" : " is null");
    }
}
