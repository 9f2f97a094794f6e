package com.pipeduck.types;

/**
 * Date and time.
 *
 * <p>Produced for index {@code date} fields with a time-bearing format such as
 * {@code strict_date_optional_time||epoch_millis}. Serialized as {@code date} with the
 * nanosecond format {@code strict_date_optional_time_nanos}.
 */
public final class TimestampType implements DataType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {}

    public static TimestampType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timestamp";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimestampType;
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
