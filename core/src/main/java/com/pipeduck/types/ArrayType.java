package com.pipeduck.types;

import java.util.Objects;

/**
 * Ordered collection of elements of the same type.
 *
 * <p>Index mappings do not distinguish a scalar field from an array of that scalar, so an
 * array serializes to its element's mapping.
 */
public final class ArrayType implements DataType {

    private final DataType elementType;
    private final boolean containsNull;

    /**
     * Creates an array type with the given element type.
     *
     * @param elementType the type of elements in the array
     * @param containsNull whether the array can contain null elements
     */
    public ArrayType(DataType elementType, boolean containsNull) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
        this.containsNull = containsNull;
    }

    public ArrayType(DataType elementType) {
        this(elementType, true);
    }

    public DataType elementType() {
        return elementType;
    }

    public boolean containsNull() {
        return containsNull;
    }

    @Override
    public String typeName() {
        return "array<" + elementType.typeName() + ">";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayType that)) return false;
        return containsNull == that.containsNull &&
               Objects.equals(elementType, that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, containsNull);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
