package com.pipeduck.types;

import java.util.Objects;

/**
 * Fixed-precision decimal number.
 *
 * <p>The index mapping vocabulary has no decimal type: decimals are written as
 * {@code double} and precision/scale are lost on the way back.
 */
public final class DecimalType implements DataType {

    public static final int MAX_PRECISION = 38;

    private final int precision;
    private final int scale;

    /**
     * Creates a decimal type with the given precision and scale.
     *
     * @param precision the total number of digits (1-38)
     * @param scale the number of digits after the decimal point (0 to precision)
     */
    public DecimalType(int precision, int scale) {
        if (precision < 1 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("precision must be between 1 and 38, got: " + precision);
        }
        if (scale < 0 || scale > precision) {
            throw new IllegalArgumentException("scale must be between 0 and " + precision + ", got: " + scale);
        }
        this.precision = precision;
        this.scale = scale;
    }

    public int precision() {
        return precision;
    }

    public int scale() {
        return scale;
    }

    @Override
    public String typeName() {
        return String.format("decimal(%d,%d)", precision, scale);
    }

    @Override
    public int defaultSize() {
        if (precision <= 9) return 4;
        if (precision <= 18) return 8;
        return 16;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DecimalType that)) return false;
        return precision == that.precision && scale == that.scale;
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, scale);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
