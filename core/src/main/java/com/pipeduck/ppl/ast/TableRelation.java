package com.pipeduck.ppl.ast;

import java.util.Objects;

public record TableRelation(String name, String alias) implements Relation {

    public TableRelation {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String canonicalText() {
        return name + (alias != null ? " as " + alias : "");
    }
}
