package com.pipeduck.ppl.ast;

import java.util.Objects;

/**
 * {@code [type] join [left = <alias>] [right = <alias>] [on <predicate>] <relation>}.
 *
 * @param joinType the written join type, or null when omitted
 * @param leftAlias the alias given to the incoming pipeline, or null
 * @param rightAlias the alias given to the right side, or null
 * @param condition the ON predicate, or null
 * @param right the right side relation
 */
public record JoinCommand(JoinKind joinType, String leftAlias, String rightAlias,
                          AstExpression condition, Relation right) implements PPLCommand {

    public enum JoinKind {
        INNER,
        LEFT,
        RIGHT,
        FULL,
        CROSS,
        SEMI,
        ANTI
    }

    public JoinCommand {
        Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public String canonicalText() {
        StringBuilder sb = new StringBuilder();
        if (joinType != null) {
            sb.append(joinType.name().toLowerCase()).append(' ');
        }
        sb.append("join");
        if (leftAlias != null) {
            sb.append(" left = ").append(leftAlias);
        }
        if (rightAlias != null) {
            sb.append(" right = ").append(rightAlias);
        }
        if (condition != null) {
            sb.append(" on ").append(condition.canonicalName());
        }
        sb.append(' ').append(right.canonicalText());
        return sb.toString();
    }
}
