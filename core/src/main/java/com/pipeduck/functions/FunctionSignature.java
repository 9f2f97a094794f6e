package com.pipeduck.functions;

import com.pipeduck.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * Arity and return type rule of a PPL function.
 *
 * @param name the PPL function name (lower case)
 * @param kind scalar or aggregate
 * @param minArgs minimum number of arguments
 * @param maxArgs maximum number of arguments, or -1 for variadic
 * @param returnType the return type rule
 */
public record FunctionSignature(String name, Kind kind, int minArgs, int maxArgs, ReturnTypeResolver returnType) {

    public enum Kind {
        SCALAR,
        AGGREGATE
    }

    /**
     * Computes the return type from the argument types.
     */
    @FunctionalInterface
    public interface ReturnTypeResolver {

        /**
         * @param argTypes the resolved argument types
         * @return the return type
         * @throws IllegalArgumentException if an argument has a type the function does not accept
         */
        DataType resolve(List<DataType> argTypes);
    }

    public FunctionSignature {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(returnType, "returnType must not be null");
    }

    public boolean isAggregate() {
        return kind == Kind.AGGREGATE;
    }

    public boolean acceptsArgumentCount(int count) {
        return count >= minArgs && (maxArgs < 0 || count <= maxArgs);
    }

    /**
     * Describes the accepted arity, e.g. {@code 1}, {@code 2..3} or {@code at least 1}.
     */
    public String arityDescription() {
        if (maxArgs < 0) {
            return "at least " + minArgs;
        }
        return minArgs == maxArgs ? String.valueOf(minArgs) : minArgs + ".." + maxArgs;
    }
}
