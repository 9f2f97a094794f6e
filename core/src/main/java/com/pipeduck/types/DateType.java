package com.pipeduck.types;

/**
 * Calendar date without a time component.
 *
 * <p>Produced for index {@code date} fields whose format is {@code date} or
 * {@code strict_date}; written back as {@code date} with format {@code strict_date}.
 */
public final class DateType implements DataType {

    private static final DateType INSTANCE = new DateType();

    private DateType() {}

    public static DateType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "date";
    }

    @Override
    public int defaultSize() {
        return 4; // days since epoch
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DateType;
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
