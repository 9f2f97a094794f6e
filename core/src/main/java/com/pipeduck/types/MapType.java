package com.pipeduck.types;

import java.util.Objects;

/**
 * Key-value pairs.
 *
 * <p>Maps serialize as an empty object mapping; their entries are expected to be
 * dynamically mapped by the store at write time, so key and value types are not
 * encoded in the mapping document.
 */
public final class MapType implements DataType {

    private final DataType keyType;
    private final DataType valueType;
    private final boolean valueContainsNull;

    /**
     * Creates a map type with the given key and value types.
     *
     * @param keyType the type of keys
     * @param valueType the type of values
     * @param valueContainsNull whether values can be null
     */
    public MapType(DataType keyType, DataType valueType, boolean valueContainsNull) {
        this.keyType = Objects.requireNonNull(keyType, "keyType must not be null");
        this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
        this.valueContainsNull = valueContainsNull;
    }

    public MapType(DataType keyType, DataType valueType) {
        this(keyType, valueType, true);
    }

    public DataType keyType() {
        return keyType;
    }

    public DataType valueType() {
        return valueType;
    }

    public boolean valueContainsNull() {
        return valueContainsNull;
    }

    @Override
    public String typeName() {
        return "map<" + keyType.typeName() + "," + valueType.typeName() + ">";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MapType that)) return false;
        return valueContainsNull == that.valueContainsNull &&
               Objects.equals(keyType, that.keyType) &&
               Objects.equals(valueType, that.valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyType, valueType, valueContainsNull);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
