package com.pipeduck.types;

import java.util.Objects;

/**
 * Represents a field in a StructType.
 *
 * <p>Each field has a name, data type, nullability flag and the mapping hints in
 * {@link FieldMetadata}.
 */
public record StructField(String name, DataType dataType, boolean nullable, FieldMetadata metadata) {

    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        metadata = metadata != null ? metadata : FieldMetadata.EMPTY;
    }

    public StructField(String name, DataType dataType, boolean nullable) {
        this(name, dataType, nullable, FieldMetadata.EMPTY);
    }

    /**
     * Creates a nullable struct field without metadata.
     *
     * @param name the field name
     * @param dataType the field data type
     */
    public StructField(String name, DataType dataType) {
        this(name, dataType, true);
    }

    public StructField withName(String newName) {
        return new StructField(newName, dataType, nullable, metadata);
    }

    @Override
    public String toString() {
        return name + ": " + dataType + (nullable ? "" : " NOT NULL");
    }
}
