package com.pipeduck.ppl.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed PPL pipeline: a {@code source} command followed by the piped commands,
 * in order.
 *
 * @param commands the commands, the first being a {@link SourceCommand}
 */
public record PPLQuery(List<PPLCommand> commands) {

    public PPLQuery {
        commands = List.copyOf(commands);
        if (commands.isEmpty() || !(commands.get(0) instanceof SourceCommand)) {
            throw new IllegalArgumentException("a query must start with a source command");
        }
    }

    public SourceCommand source() {
        return (SourceCommand) commands.get(0);
    }

    /**
     * Returns the commands after {@code source}.
     */
    public List<PPLCommand> pipeline() {
        return commands.subList(1, commands.size());
    }

    /**
     * Renders the pipeline back to PPL text.
     */
    public String canonicalText() {
        return commands.stream().map(PPLCommand::canonicalText).collect(Collectors.joining(" | "));
    }

    @Override
    public String toString() {
        return canonicalText();
    }
}
