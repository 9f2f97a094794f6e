package com.pipeduck.exception;

/**
 * Exception thrown for a construct that parses but has no implemented semantics,
 * for example an aggregate function used outside {@code stats}.
 */
public class UnsupportedConstructException extends RuntimeException {

    private final String construct;

    public UnsupportedConstructException(String construct, String message) {
        super(message);
        this.construct = construct;
    }

    /**
     * Returns the text of the unsupported construct.
     */
    public String construct() {
        return construct;
    }
}
