package com.pipeduck.ppl.ast;

import java.util.Objects;

public record WhereCommand(AstExpression predicate) implements PPLCommand {

    public WhereCommand {
        Objects.requireNonNull(predicate, "predicate must not be null");
    }

    @Override
    public String canonicalText() {
        return "where " + predicate.canonicalName();
    }
}
