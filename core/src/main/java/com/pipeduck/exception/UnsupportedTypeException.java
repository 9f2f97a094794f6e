package com.pipeduck.exception;

/**
 * Exception thrown by the mapping layer when a type has no counterpart on the other side.
 *
 * <p>On deserialization this names an unknown index type tag or an unsupported date
 * format; on serialization it names a columnar type with no index representation.
 */
public class UnsupportedTypeException extends RuntimeException {

    private final String fieldName;
    private final String typeName;

    /**
     * Creates an unsupported type exception.
     *
     * @param fieldName the field being translated (may be null when unknown)
     * @param typeName the type tag, format string or type name that failed
     * @param message the error message
     */
    public UnsupportedTypeException(String fieldName, String typeName, String message) {
        super(message);
        this.fieldName = fieldName;
        this.typeName = typeName;
    }

    public String fieldName() {
        return fieldName;
    }

    public String typeName() {
        return typeName;
    }
}
