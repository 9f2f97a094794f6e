package com.pipeduck.ppl.ast;

import java.util.Locale;
import java.util.Objects;

/**
 * Arithmetic ({@code + - * / %}), comparison ({@code = != <> < <= > >=}) or logical
 * ({@code and}, {@code or}) operation.
 *
 * @param operator the operator symbol; logical operators in lower case
 */
public record BinaryOperation(String operator, AstExpression left, AstExpression right) implements AstExpression {

    public BinaryOperation {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
        operator = operator.toLowerCase(Locale.ROOT);
    }

    public boolean isLogical() {
        return operator.equals("and") || operator.equals("or");
    }

    @Override
    public String canonicalName() {
        String l = left instanceof BinaryOperation ? "(" + left.canonicalName() + ")" : left.canonicalName();
        String r = right instanceof BinaryOperation ? "(" + right.canonicalName() + ")" : right.canonicalName();
        return l + " " + operator + " " + r;
    }
}
