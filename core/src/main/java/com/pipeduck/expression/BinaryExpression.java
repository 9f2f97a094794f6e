package com.pipeduck.expression;

import com.pipeduck.types.BooleanType;
import com.pipeduck.types.DataType;
import com.pipeduck.types.DataTypes;
import com.pipeduck.types.DateType;
import com.pipeduck.types.DoubleType;
import com.pipeduck.types.TimestampType;
import java.util.Objects;

/**
 * Expression representing a binary operation (operation with two operands).
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Arithmetic: a + b, a - b, a * b, a / b, a % b</li>
 *   <li>Comparison: a > b, a >= b, a < b, a <= b, a = b, a != b</li>
 *   <li>Logical: a AND b, a OR b</li>
 * </ul>
 *
 * <p>Arithmetic also covers date arithmetic with an interval on the right:
 * <pre>
 *   order_date + interval 7 days     -- date
 *   event_time - interval 1 hour     -- timestamp
 * </pre>
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        // Arithmetic operators
        ADD("+", "addition"),
        SUBTRACT("-", "subtraction"),
        MULTIPLY("*", "multiplication"),
        DIVIDE("/", "division"),
        MODULO("%", "modulo"),

        // Comparison operators
        EQUAL("=", "equal"),
        NOT_EQUAL("!=", "not equal"),
        LESS_THAN("<", "less than"),
        LESS_THAN_OR_EQUAL("<=", "less than or equal"),
        GREATER_THAN(">", "greater than"),
        GREATER_THAN_OR_EQUAL(">=", "greater than or equal"),

        // Logical operators
        AND("AND", "logical AND"),
        OR("OR", "logical OR");

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

        /**
         * Resolves a PPL operator token; {@code <>} is accepted as not-equal.
         *
         * @throws IllegalArgumentException for an unknown symbol
         */
        public static Operator fromSymbol(String symbol) {
            if ("<>".equals(symbol)) {
                return NOT_EQUAL;
            }
            for (Operator op : values()) {
                if (op.symbol.equalsIgnoreCase(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown binary operator: " + symbol);
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUBTRACT || this == MULTIPLY ||
                   this == DIVIDE || this == MODULO;
        }

        public boolean isComparison() {
            return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN ||
                   this == LESS_THAN_OR_EQUAL || this == GREATER_THAN ||
                   this == GREATER_THAN_OR_EQUAL;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public DataType dataType() {
        if (operator.isComparison() || operator.isLogical()) {
            return BooleanType.get();
        }
        if (right instanceof IntervalLiteral interval) {
            if (left.dataType() instanceof DateType && interval.isDayGranular()) {
                return DateType.get();
            }
            return TimestampType.get();
        }
        DataType leftType = left.dataType();
        DataType rightType = right.dataType();
        if (DataTypes.isNumeric(leftType) && DataTypes.isNumeric(rightType)) {
            // integral division yields a fraction
            if (operator == Operator.DIVIDE && DataTypes.isIntegral(leftType) && DataTypes.isIntegral(rightType)) {
                return DoubleType.get();
            }
            return DataTypes.widerNumeric(leftType, rightType);
        }
        return DataTypes.isNumeric(leftType) ? leftType : rightType;
    }

    @Override
    public boolean nullable() {
        if (operator == Operator.DIVIDE || operator == Operator.MODULO) {
            return true; // division by zero yields null
        }
        return left.nullable() || right.nullable();
    }

    @Override
    public String toSQL() {
        return String.format("(%s %s %s)", left.toSQL(), operator.symbol(), right.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return Objects.equals(left, that.left) &&
               operator == that.operator &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    // ==================== Factory Methods ====================

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }
}
