package com.pipeduck.ppl.ast;

import java.util.Locale;
import java.util.Objects;

/**
 * {@code interval <n> <unit>}.
 */
public record IntervalValue(long value, String unit) implements AstExpression {

    public IntervalValue {
        Objects.requireNonNull(unit, "unit must not be null");
        unit = unit.toLowerCase(Locale.ROOT);
    }

    @Override
    public String canonicalName() {
        return "interval " + value + " " + unit;
    }
}
