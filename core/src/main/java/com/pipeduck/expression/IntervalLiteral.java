package com.pipeduck.expression;

import com.pipeduck.types.DataType;
import com.pipeduck.types.IntervalType;
import java.util.Locale;
import java.util.Objects;

/**
 * An {@code interval <n> <unit>} literal, usable as an operand of date arithmetic
 * ({@code ts + interval 1 day}) or as the second argument of {@code adddate}/{@code subdate}.
 */
public final class IntervalLiteral implements Expression {

    /**
     * Interval units accepted by the PPL grammar.
     */
    public enum Unit {
        MICROSECOND,
        MILLISECOND,
        SECOND,
        MINUTE,
        HOUR,
        DAY,
        WEEK,
        MONTH,
        QUARTER,
        YEAR;

        /**
         * Parses a unit keyword, accepting the plural form ({@code days}).
         *
         * @throws IllegalArgumentException for an unknown unit
         */
        public static Unit fromKeyword(String keyword) {
            String upper = keyword.toUpperCase(Locale.ROOT);
            if (upper.endsWith("S")) {
                upper = upper.substring(0, upper.length() - 1);
            }
            return Unit.valueOf(upper);
        }
    }

    private final long value;
    private final Unit unit;

    public IntervalLiteral(long value, Unit unit) {
        this.value = value;
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
    }

    public long value() {
        return value;
    }

    public Unit unit() {
        return unit;
    }

    /**
     * Returns whether this interval is a whole number of days, so it can be applied to a
     * plain date without promoting it to a timestamp.
     */
    public boolean isDayGranular() {
        return unit == Unit.DAY || unit == Unit.WEEK;
    }

    @Override
    public DataType dataType() {
        return IntervalType.get();
    }

    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public String toSQL() {
        return "INTERVAL " + value + " " + unit.name();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IntervalLiteral that)) return false;
        return value == that.value && unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }
}
