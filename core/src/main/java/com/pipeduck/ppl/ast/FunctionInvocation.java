package com.pipeduck.ppl.ast;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A function call, scalar or aggregate: {@code upper(name)}, {@code count()}.
 *
 * @param name the function name, lower-cased
 */
public record FunctionInvocation(String name, List<AstExpression> arguments) implements AstExpression {

    public FunctionInvocation {
        Objects.requireNonNull(name, "name must not be null");
        name = name.toLowerCase(Locale.ROOT);
        arguments = List.copyOf(arguments);
    }

    @Override
    public String canonicalName() {
        return name + "(" + arguments.stream().map(AstExpression::canonicalName).collect(Collectors.joining(", ")) + ")";
    }
}
