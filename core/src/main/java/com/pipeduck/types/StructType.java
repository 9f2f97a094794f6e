package com.pipeduck.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Represents a struct type (row schema) with named fields.
 *
 * <p>Used both as the output schema of a logical plan node and as the type of a nested
 * object field in an index mapping. Field order is significant.
 */
public final class StructType implements DataType {

    /** Empty struct type with no fields. */
    public static final StructType EMPTY = new StructType(Collections.emptyList());

    private final List<StructField> fields;

    public StructType(List<StructField> fields) {
        this.fields = List.copyOf(fields);
    }

    public StructType(StructField... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Returns the fields in this struct.
     *
     * @return an unmodifiable list of fields
     */
    public List<StructField> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    /**
     * Returns the field at the given index.
     *
     * @param index the field index
     * @return the field
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    /**
     * Returns the first field with the given name, or null if not found.
     *
     * @param name the field name
     * @return the field, or null if not found
     */
    public StructField fieldByName(String name) {
        return fields.stream()
            .filter(f -> f.name().equals(name))
            .findFirst()
            .orElse(null);
    }


    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (StructField field : fields) {
            names.add(field.name());
        }
        return names;
    }

    /**
     * Returns a new struct with the given field appended.
     */
    public StructType add(StructField field) {
        List<StructField> extended = new ArrayList<>(fields);
        extended.add(Objects.requireNonNull(field, "field must not be null"));
        return new StructType(extended);
    }

    @Override
    public String typeName() {
        StringBuilder sb = new StringBuilder("struct<");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(",");
            sb.append(fields.get(i).name()).append(":").append(fields.get(i).dataType().typeName());
        }
        return sb.append(">").toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructType that = (StructType) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "StructType(" + fields + ")";
    }
}
