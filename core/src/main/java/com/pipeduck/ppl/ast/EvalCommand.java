package com.pipeduck.ppl.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code eval <name> = <expr>, ...}. Assignments are applied left to right; later ones
 * may reference earlier ones.
 */
public record EvalCommand(List<Assignment> assignments) implements PPLCommand {

    public EvalCommand {
        assignments = List.copyOf(assignments);
        if (assignments.isEmpty()) {
            throw new IllegalArgumentException("eval requires at least one assignment");
        }
    }

    public record Assignment(String name, AstExpression expression) {

        public Assignment {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    @Override
    public String canonicalText() {
        return "eval " + assignments.stream()
            .map(a -> a.name() + " = " + a.expression().canonicalName())
            .collect(Collectors.joining(", "));
    }
}
