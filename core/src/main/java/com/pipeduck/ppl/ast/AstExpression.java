package com.pipeduck.ppl.ast;

/**
 * An expression as written in PPL, before name resolution.
 */
public sealed interface AstExpression
    permits UnresolvedField, LiteralValue, IntervalValue, BinaryOperation, UnaryOperation,
            FunctionInvocation, BetweenPredicate, LikePredicate, InListPredicate,
            IsNullPredicate, InSubqueryPredicate, ExistsPredicate, ScalarSubqueryValue {

    /**
     * Renders the expression in canonical PPL form: lower-case keywords and function
     * names, single spaces around binary operators, no redundant whitespace. Used as the
     * default output name of an unaliased aggregate ({@code count()}, {@code sum(amount)}).
     */
    String canonicalName();
}
