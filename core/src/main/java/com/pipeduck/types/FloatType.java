package com.pipeduck.types;

/**
 * Single precision floating point.
 *
 * <p>Both the index {@code float} and {@code half_float} field types map here. A field that
 * came from {@code half_float} carries {@link FieldMetadata#halfFloat()} so that it is
 * written back with its original tag.
 */
public final class FloatType implements DataType {

    private static final FloatType INSTANCE = new FloatType();

    private FloatType() {}

    public static FloatType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "float";
    }

    @Override
    public int defaultSize() {
        return 4;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FloatType;
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
