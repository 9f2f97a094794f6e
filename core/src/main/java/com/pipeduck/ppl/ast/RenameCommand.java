package com.pipeduck.ppl.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code rename <field> as <name>, ...}.
 */
public record RenameCommand(List<Rename> renames) implements PPLCommand {

    public RenameCommand {
        renames = List.copyOf(renames);
        if (renames.isEmpty()) {
            throw new IllegalArgumentException("rename requires at least one pair");
        }
    }

    public record Rename(UnresolvedField field, String newName) {

        public Rename {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(newName, "newName must not be null");
        }
    }

    @Override
    public String canonicalText() {
        return "rename " + renames.stream()
            .map(r -> r.field().canonicalName() + " as " + r.newName())
            .collect(Collectors.joining(", "));
    }
}
