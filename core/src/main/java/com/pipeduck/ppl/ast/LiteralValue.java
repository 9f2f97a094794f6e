package com.pipeduck.ppl.ast;

/**
 * A literal: integer ({@link Long}), decimal ({@link Double}), string, boolean or null.
 */
public record LiteralValue(Object value, Kind kind) implements AstExpression {

    public enum Kind {
        INTEGER,
        DECIMAL,
        STRING,
        BOOLEAN,
        NULL
    }

    public static LiteralValue ofInteger(long value) {
        return new LiteralValue(value, Kind.INTEGER);
    }

    public static LiteralValue ofDecimal(double value) {
        return new LiteralValue(value, Kind.DECIMAL);
    }

    public static LiteralValue ofString(String value) {
        return new LiteralValue(value, Kind.STRING);
    }

    public static LiteralValue ofBoolean(boolean value) {
        return new LiteralValue(value, Kind.BOOLEAN);
    }

    public static LiteralValue ofNull() {
        return new LiteralValue(null, Kind.NULL);
    }

    @Override
    public String canonicalName() {
        switch (kind) {
            case STRING:
                return "'" + value.toString().replace("'", "\\'") + "'";
            case NULL:
                return "null";
            default:
                return String.valueOf(value);
        }
    }
}
