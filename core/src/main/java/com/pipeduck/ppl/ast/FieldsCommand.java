package com.pipeduck.ppl.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code fields [+|-] <field>, ...}: keep exactly the listed fields in the listed order,
 * or with {@code -} drop them.
 */
public record FieldsCommand(boolean exclude, List<UnresolvedField> fields) implements PPLCommand {

    public FieldsCommand {
        fields = List.copyOf(fields);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("fields requires at least one field");
        }
    }

    @Override
    public String canonicalText() {
        return "fields " + (exclude ? "- " : "")
            + fields.stream().map(UnresolvedField::canonicalName).collect(Collectors.joining(", "));
    }
}
