package com.pipeduck.ppl.ast;

/**
 * The right side of a join: a table or a bracketed subquery.
 */
public sealed interface Relation permits TableRelation, SubqueryRelation {

    /**
     * Returns the {@code as} alias, or null.
     */
    String alias();

    String canonicalText();
}
