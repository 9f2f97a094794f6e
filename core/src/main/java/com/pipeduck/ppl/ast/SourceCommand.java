package com.pipeduck.ppl.ast;

import java.util.Objects;

/**
 * {@code source = <table> [as <alias>]}.
 *
 * @param table the table name, possibly dotted
 * @param alias the alias, or null
 */
public record SourceCommand(String table, String alias) implements PPLCommand {

    public SourceCommand {
        Objects.requireNonNull(table, "table must not be null");
    }

    @Override
    public String canonicalText() {
        return "source = " + table + (alias != null ? " as " + alias : "");
    }
}
