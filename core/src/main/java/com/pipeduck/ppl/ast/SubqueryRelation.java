package com.pipeduck.ppl.ast;

import java.util.Objects;

public record SubqueryRelation(PPLQuery query, String alias) implements Relation {

    public SubqueryRelation {
        Objects.requireNonNull(query, "query must not be null");
    }

    @Override
    public String canonicalText() {
        return "[ " + query.canonicalText() + " ]" + (alias != null ? " as " + alias : "");
    }
}
