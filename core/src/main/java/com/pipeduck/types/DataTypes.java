package com.pipeduck.types;

/**
 * Type family predicates and the numeric widening used by expression typing.
 */
public final class DataTypes {

    private DataTypes() {}

    public static boolean isIntegral(DataType type) {
        return type instanceof ByteType || type instanceof ShortType ||
               type instanceof IntegerType || type instanceof LongType;
    }

    public static boolean isFloating(DataType type) {
        return type instanceof FloatType || type instanceof DoubleType;
    }

    public static boolean isNumeric(DataType type) {
        return isIntegral(type) || isFloating(type) || type instanceof DecimalType;
    }

    public static boolean isTemporal(DataType type) {
        return type instanceof DateType || type instanceof TimestampType;
    }

    /**
     * Returns the wider of two numeric types: double beats float beats decimal beats
     * the integral types, which widen by size.
     *
     * @throws IllegalArgumentException if either type is not numeric
     */
    public static DataType widerNumeric(DataType left, DataType right) {
        if (!isNumeric(left) || !isNumeric(right)) {
            throw new IllegalArgumentException("not numeric: " + left + ", " + right);
        }
        if (left instanceof DoubleType || right instanceof DoubleType) {
            return DoubleType.get();
        }
        if (left instanceof FloatType || right instanceof FloatType) {
            return left instanceof DecimalType || right instanceof DecimalType
                ? DoubleType.get()
                : FloatType.get();
        }
        if (left instanceof DecimalType l && right instanceof DecimalType r) {
            int scale = Math.max(l.scale(), r.scale());
            int integral = Math.max(l.precision() - l.scale(), r.precision() - r.scale());
            int precision = Math.min(integral + scale, DecimalType.MAX_PRECISION);
            return new DecimalType(precision, Math.min(scale, precision));
        }
        if (left instanceof DecimalType) return left;
        if (right instanceof DecimalType) return right;
        return left.defaultSize() >= right.defaultSize() ? left : right;
    }

    /**
     * Returns whether values of the two types can be compared with {@code =}, {@code <} etc.
     * Null is comparable with everything; strings are comparable with temporal types so that
     * {@code ts > '2024-01-01'} works.
     */
    public static boolean isComparable(DataType left, DataType right) {
        if (left instanceof NullType || right instanceof NullType) {
            return true;
        }
        if (isNumeric(left) && isNumeric(right)) {
            return true;
        }
        if (isTemporal(left) && (isTemporal(right) || right instanceof StringType)) {
            return true;
        }
        if (isTemporal(right) && left instanceof StringType) {
            return true;
        }
        return left.equals(right)
            || (left instanceof IpAddressType && right instanceof StringType)
            || (right instanceof IpAddressType && left instanceof StringType);
    }
}
