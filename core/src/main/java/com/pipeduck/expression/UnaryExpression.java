package com.pipeduck.expression;

import com.pipeduck.types.BooleanType;
import com.pipeduck.types.DataType;
import java.util.Objects;

/**
 * Expression representing a unary operation.
 *
 * <p>Examples:
 * <pre>
 *   -amount                  -- negation
 *   NOT (status = 'open')    -- logical NOT
 *   region IS NULL           -- null check
 *   region IS NOT NULL       -- not null check
 * </pre>
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NEGATE("-", "negation"),
        NOT("NOT", "logical NOT"),
        IS_NULL("IS NULL", "null check"),
        IS_NOT_NULL("IS NOT NULL", "not null check");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }
    }

    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public DataType dataType() {
        if (operator == Operator.NEGATE) {
            return operand.dataType();
        }
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        // null checks never return null
        if (operator == Operator.IS_NULL || operator == Operator.IS_NOT_NULL) {
            return false;
        }
        return operand.nullable();
    }

    @Override
    public String toSQL() {
        switch (operator) {
            case NEGATE:
                return "(-" + operand.toSQL() + ")";
            case NOT:
                return "(NOT " + operand.toSQL() + ")";
            default:
                return "(" + operand.toSQL() + " " + operator.symbol() + ")";
        }
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator && Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    // ==================== Factory Methods ====================

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    public static UnaryExpression isNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NULL, operand);
    }

    public static UnaryExpression isNotNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NOT_NULL, operand);
    }
}
