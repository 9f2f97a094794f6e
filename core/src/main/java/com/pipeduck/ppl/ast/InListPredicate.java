package com.pipeduck.ppl.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record InListPredicate(AstExpression value, List<AstExpression> values, boolean negated) implements AstExpression {

    public InListPredicate {
        Objects.requireNonNull(value, "value must not be null");
        values = List.copyOf(values);
    }

    @Override
    public String canonicalName() {
        return value.canonicalName() + (negated ? " not" : "") + " in ("
            + values.stream().map(AstExpression::canonicalName).collect(Collectors.joining(", ")) + ")";
    }
}
