package com.pipeduck.ppl.ast;

/**
 * A command of a PPL pipeline.
 */
public sealed interface PPLCommand
    permits SourceCommand, WhereCommand, StatsCommand, EvalCommand, SortCommand,
            HeadCommand, FieldsCommand, RenameCommand, JoinCommand {

    /**
     * Renders this command back to PPL text.
     */
    String canonicalText();
}
