package com.pipeduck.expression;

import com.pipeduck.generator.SQLQuoting;
import com.pipeduck.types.BooleanType;
import com.pipeduck.types.DataType;
import com.pipeduck.types.DateType;
import com.pipeduck.types.DoubleType;
import com.pipeduck.types.IntegerType;
import com.pipeduck.types.LongType;
import com.pipeduck.types.NullType;
import com.pipeduck.types.StringType;
import com.pipeduck.types.TimestampType;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>PPL literals are:
 * <ul>
 *   <li>Integer literals: {@code 42} (integer, or long when out of int range)</li>
 *   <li>Decimal literals: {@code 3.14} (double)</li>
 *   <li>String literals: {@code 'open'} or {@code "open"}</li>
 *   <li>Boolean literals: {@code true}, {@code false}</li>
 *   <li>Null literal: {@code null}</li>
 * </ul>
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     */
    public Literal(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public String toSQL() {
        if (value == null) {
            return "NULL";
        }
        if (dataType instanceof StringType) {
            return SQLQuoting.quoteLiteral(value.toString());
        }
        if (dataType instanceof BooleanType) {
            return value.toString().toUpperCase();
        }
        if (dataType instanceof DateType) {
            return "DATE " + SQLQuoting.quoteLiteral(value.toString());
        }
        if (dataType instanceof TimestampType) {
            return "TIMESTAMP " + SQLQuoting.quoteLiteral(value.toString());
        }
        if (dataType instanceof LongType) {
            return value + "L";
        }
        // Numeric and other types
        return value.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    // ==================== Factory Methods ====================

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    /**
     * Creates the untyped NULL literal.
     */
    public static Literal nullValue() {
        return new Literal(null, NullType.get());
    }
}
