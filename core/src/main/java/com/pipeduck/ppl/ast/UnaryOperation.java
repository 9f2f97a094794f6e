package com.pipeduck.ppl.ast;

import java.util.Locale;
import java.util.Objects;

/**
 * {@code not <expr>} or {@code -<expr>}.
 *
 * @param operator {@code not} or {@code -}
 */
public record UnaryOperation(String operator, AstExpression operand) implements AstExpression {

    public UnaryOperation {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
        operator = operator.toLowerCase(Locale.ROOT);
    }

    public boolean isNot() {
        return operator.equals("not");
    }

    @Override
    public String canonicalName() {
        String inner = operand instanceof BinaryOperation ? "(" + operand.canonicalName() + ")" : operand.canonicalName();
        return isNot() ? "not " + inner : "-" + inner;
    }
}
