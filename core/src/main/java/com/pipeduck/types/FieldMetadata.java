package com.pipeduck.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Round-trip hints attached to a {@link StructField}.
 *
 * <p>The columnar type system is coarser than the index mapping vocabulary: {@code keyword}
 * and {@code text} both become {@link StringType}, {@code float} and {@code half_float}
 * both become {@link FloatType}. These hints record what the mapping originally said so
 * that serialization can emit it again.
 *
 * @param textField the field was declared as {@code text}
 * @param halfFloat the field was declared as {@code half_float}
 * @param multiFields sub-field mappings of a text field, keyed {@code "<field>.<sub>"},
 *                    valued with the sub-field's declared type tag, in declaration order
 * @param aliasPath the target path when the field was declared as an {@code alias}, or null
 */
public record FieldMetadata(boolean textField,
                            boolean halfFloat,
                            Map<String, String> multiFields,
                            String aliasPath) {

    /** Metadata carrying no hints. */
    public static final FieldMetadata EMPTY = new FieldMetadata(false, false, Map.of(), null);

    public FieldMetadata {
        multiFields = multiFields == null || multiFields.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(multiFields));
    }

    public static FieldMetadata ofTextField() {
        return EMPTY.withTextField();
    }

    public static FieldMetadata ofHalfFloat() {
        return EMPTY.withHalfFloat();
    }

    public static FieldMetadata alias(String path) {
        return EMPTY.withAliasPath(Objects.requireNonNull(path, "path must not be null"));
    }

    public FieldMetadata withTextField() {
        return new FieldMetadata(true, halfFloat, multiFields, aliasPath);
    }

    public FieldMetadata withHalfFloat() {
        return new FieldMetadata(textField, true, multiFields, aliasPath);
    }

    public FieldMetadata withMultiFields(Map<String, String> fields) {
        return new FieldMetadata(textField, halfFloat, fields, aliasPath);
    }

    public FieldMetadata withAliasPath(String path) {
        return new FieldMetadata(textField, halfFloat, multiFields, path);
    }

    public boolean hasMultiFields() {
        return !multiFields.isEmpty();
    }

    public boolean isAlias() {
        return aliasPath != null;
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }
}
