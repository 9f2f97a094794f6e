package com.pipeduck.types;

/**
 * Calendar interval, the type of an {@code interval <n> <unit>} literal.
 *
 * <p>Only valid as an operand of date arithmetic; it has no index mapping counterpart.
 */
public final class IntervalType implements DataType {

    private static final IntervalType INSTANCE = new IntervalType();

    private IntervalType() {}

    public static IntervalType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "interval";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IntervalType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
