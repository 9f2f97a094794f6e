package com.pipeduck.ppl.ast;

import java.util.List;

/**
 * A possibly qualified field reference: {@code status}, {@code o.status},
 * {@code address.city}. Back-quoted parts arrive unquoted.
 */
public record UnresolvedField(List<String> parts) implements AstExpression {

    public UnresolvedField {
        parts = List.copyOf(parts);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("field reference must have at least one part");
        }
    }

    public static UnresolvedField of(String... parts) {
        return new UnresolvedField(List.of(parts));
    }

    public String lastPart() {
        return parts.get(parts.size() - 1);
    }

    @Override
    public String canonicalName() {
        return String.join(".", parts);
    }
}
