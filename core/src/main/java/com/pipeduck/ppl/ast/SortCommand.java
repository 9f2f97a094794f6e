package com.pipeduck.ppl.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code sort [+|-]<field>, ...}.
 */
public record SortCommand(List<SortKey> keys) implements PPLCommand {

    public SortCommand {
        keys = List.copyOf(keys);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("sort requires at least one key");
        }
    }

    /**
     * @param field the sort field
     * @param ascending false only for an explicit {@code -} sign
     */
    public record SortKey(AstExpression field, boolean ascending) {

        public SortKey {
            Objects.requireNonNull(field, "field must not be null");
        }
    }

    @Override
    public String canonicalText() {
        return "sort " + keys.stream()
            .map(k -> (k.ascending() ? "" : "- ") + k.field().canonicalName())
            .collect(Collectors.joining(", "));
    }
}
