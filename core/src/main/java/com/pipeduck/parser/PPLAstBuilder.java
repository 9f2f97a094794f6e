package com.pipeduck.parser;

import com.pipeduck.expression.IntervalLiteral;
import com.pipeduck.parser.antlr.PPLBaseVisitor;
import com.pipeduck.parser.antlr.PPLParser;
import com.pipeduck.ppl.ast.*;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that builds the PPL AST ({@link PPLQuery}, {@link PPLCommand},
 * {@link AstExpression}) from the parse tree.
 *
 * <p>No name resolution happens here: field references stay unresolved and function
 * names are only lower-cased. Literal conversion errors (integer overflow, unknown
 * interval unit) are reported as {@link PPLParseException}s at the literal's position.
 */
public class PPLAstBuilder extends PPLBaseVisitor<Object> {

    // ==================== Entry Points ====================

    @Override
    public PPLQuery visitSingleStatement(PPLParser.SingleStatementContext ctx) {
        return visitQuery(ctx.query());
    }

    @Override
    public PPLQuery visitQuery(PPLParser.QueryContext ctx) {
        List<PPLCommand> commands = new ArrayList<>();
        String alias = ctx.alias != null ? identifierText(ctx.alias) : null;
        commands.add(new SourceCommand(qualifiedNameText(ctx.tableName), alias));
        for (PPLParser.CommandContext command : ctx.command()) {
            commands.add((PPLCommand) visit(command));
        }
        return new PPLQuery(commands);
    }

    // ==================== Commands ====================

    @Override
    public PPLCommand visitCommand(PPLParser.CommandContext ctx) {
        return (PPLCommand) visit(ctx.getChild(0));
    }

    @Override
    public WhereCommand visitWhereCommand(PPLParser.WhereCommandContext ctx) {
        return new WhereCommand(expression(ctx.expression()));
    }

    @Override
    public StatsCommand visitStatsCommand(PPLParser.StatsCommandContext ctx) {
        List<StatsCommand.Aggregation> aggregations = new ArrayList<>();
        for (PPLParser.AggregationContext agg : ctx.aggregation()) {
            String alias = agg.alias != null ? identifierText(agg.alias) : null;
            aggregations.add(new StatsCommand.Aggregation(valueExpression(agg.valueExpression()), alias));
        }
        List<AstExpression> groupBy = new ArrayList<>();
        for (PPLParser.ValueExpressionContext key : ctx.groupKeys) {
            groupBy.add(valueExpression(key));
        }
        return new StatsCommand(aggregations, groupBy);
    }

    @Override
    public EvalCommand visitEvalCommand(PPLParser.EvalCommandContext ctx) {
        List<EvalCommand.Assignment> assignments = new ArrayList<>();
        for (PPLParser.EvalAssignmentContext assignment : ctx.evalAssignment()) {
            assignments.add(new EvalCommand.Assignment(
                identifierText(assignment.identifier()), expression(assignment.expression())));
        }
        return new EvalCommand(assignments);
    }

    @Override
    public SortCommand visitSortCommand(PPLParser.SortCommandContext ctx) {
        List<SortCommand.SortKey> keys = new ArrayList<>();
        for (PPLParser.SortKeyContext key : ctx.sortKey()) {
            boolean ascending = key.sign == null || key.sign.getType() == PPLParser.PLUS;
            keys.add(new SortCommand.SortKey(field(key.qualifiedName()), ascending));
        }
        return new SortCommand(keys);
    }

    @Override
    public HeadCommand visitHeadCommand(PPLParser.HeadCommandContext ctx) {
        Long size = null;
        if (ctx.size != null) {
            size = parseLong(ctx.size);
            if (ctx.sizeNegative != null) {
                size = -size;
            }
        }
        long offset = 0;
        if (ctx.offset != null) {
            offset = parseLong(ctx.offset);
            if (ctx.offsetNegative != null) {
                offset = -offset;
            }
        }
        return new HeadCommand(size, offset);
    }

    @Override
    public FieldsCommand visitFieldsCommand(PPLParser.FieldsCommandContext ctx) {
        boolean exclude = ctx.sign != null && ctx.sign.getType() == PPLParser.MINUS;
        List<UnresolvedField> fields = new ArrayList<>();
        for (PPLParser.QualifiedNameContext name : ctx.qualifiedName()) {
            fields.add(field(name));
        }
        return new FieldsCommand(exclude, fields);
    }

    @Override
    public RenameCommand visitRenameCommand(PPLParser.RenameCommandContext ctx) {
        List<RenameCommand.Rename> renames = new ArrayList<>();
        for (PPLParser.RenameClauseContext clause : ctx.renameClause()) {
            renames.add(new RenameCommand.Rename(field(clause.qualifiedName()), identifierText(clause.identifier())));
        }
        return new RenameCommand(renames);
    }

    @Override
    public JoinCommand visitJoinCommand(PPLParser.JoinCommandContext ctx) {
        JoinCommand.JoinKind kind = ctx.joinType() != null ? joinKind(ctx.joinType()) : null;
        String leftAlias = ctx.leftAlias != null ? identifierText(ctx.leftAlias) : null;
        String rightAlias = ctx.rightAlias != null ? identifierText(ctx.rightAlias) : null;
        AstExpression condition = ctx.expression() != null ? expression(ctx.expression()) : null;
        Relation right = (Relation) visit(ctx.joinRelation());
        return new JoinCommand(kind, leftAlias, rightAlias, condition, right);
    }

    private JoinCommand.JoinKind joinKind(PPLParser.JoinTypeContext ctx) {
        if (ctx.SEMI() != null) {
            return JoinCommand.JoinKind.SEMI;
        }
        if (ctx.ANTI() != null) {
            return JoinCommand.JoinKind.ANTI;
        }
        if (ctx.INNER() != null) {
            return JoinCommand.JoinKind.INNER;
        }
        if (ctx.CROSS() != null) {
            return JoinCommand.JoinKind.CROSS;
        }
        if (ctx.LEFT() != null) {
            return JoinCommand.JoinKind.LEFT;
        }
        if (ctx.RIGHT() != null) {
            return JoinCommand.JoinKind.RIGHT;
        }
        return JoinCommand.JoinKind.FULL;
    }

    @Override
    public Relation visitTableJoinRelation(PPLParser.TableJoinRelationContext ctx) {
        String alias = ctx.alias != null ? identifierText(ctx.alias) : null;
        return new TableRelation(qualifiedNameText(ctx.qualifiedName()), alias);
    }

    @Override
    public Relation visitSubqueryJoinRelation(PPLParser.SubqueryJoinRelationContext ctx) {
        String alias = ctx.alias != null ? identifierText(ctx.alias) : null;
        return new SubqueryRelation(visitQuery(ctx.query()), alias);
    }

    // ==================== Boolean Expressions ====================

    private AstExpression expression(PPLParser.ExpressionContext ctx) {
        return (AstExpression) visit(ctx);
    }

    @Override
    public AstExpression visitLogicalNot(PPLParser.LogicalNotContext ctx) {
        return new UnaryOperation("not", expression(ctx.expression()));
    }

    @Override
    public AstExpression visitLogicalAnd(PPLParser.LogicalAndContext ctx) {
        return new BinaryOperation("and", expression(ctx.left), expression(ctx.right));
    }

    @Override
    public AstExpression visitLogicalOr(PPLParser.LogicalOrContext ctx) {
        return new BinaryOperation("or", expression(ctx.left), expression(ctx.right));
    }

    @Override
    public AstExpression visitPredicateExpression(PPLParser.PredicateExpressionContext ctx) {
        return (AstExpression) visit(ctx.predicate());
    }

    // ==================== Predicates ====================

    @Override
    public AstExpression visitComparison(PPLParser.ComparisonContext ctx) {
        String operator = ctx.comparisonOperator().getText();
        if (operator.equals("==")) {
            operator = "=";
        } else if (operator.equals("<>")) {
            operator = "!=";
        }
        return new BinaryOperation(operator, valueExpression(ctx.left), valueExpression(ctx.right));
    }

    @Override
    public AstExpression visitBetween(PPLParser.BetweenContext ctx) {
        return new BetweenPredicate(valueExpression(ctx.value), valueExpression(ctx.lower),
            valueExpression(ctx.upper), ctx.NOT() != null);
    }

    @Override
    public AstExpression visitLike(PPLParser.LikeContext ctx) {
        return new LikePredicate(valueExpression(ctx.value), valueExpression(ctx.pattern), ctx.NOT() != null);
    }

    @Override
    public AstExpression visitInList(PPLParser.InListContext ctx) {
        // valueExpression(0) is the tested value
        List<PPLParser.ValueExpressionContext> all = ctx.valueExpression();
        List<AstExpression> values = new ArrayList<>();
        for (int i = 1; i < all.size(); i++) {
            values.add(valueExpression(all.get(i)));
        }
        return new InListPredicate(valueExpression(ctx.value), values, ctx.NOT() != null);
    }

    @Override
    public AstExpression visitInSubquery(PPLParser.InSubqueryContext ctx) {
        return new InSubqueryPredicate(valueExpression(ctx.value), visitQuery(ctx.query()), ctx.NOT() != null);
    }

    @Override
    public AstExpression visitExists(PPLParser.ExistsContext ctx) {
        return new ExistsPredicate(visitQuery(ctx.query()));
    }

    @Override
    public AstExpression visitIsNull(PPLParser.IsNullContext ctx) {
        return new IsNullPredicate(valueExpression(ctx.value), ctx.NOT() != null);
    }

    @Override
    public AstExpression visitValuePredicate(PPLParser.ValuePredicateContext ctx) {
        return valueExpression(ctx.valueExpression());
    }

    // ==================== Value Expressions ====================

    private AstExpression valueExpression(PPLParser.ValueExpressionContext ctx) {
        return (AstExpression) visit(ctx);
    }

    @Override
    public AstExpression visitUnaryMinus(PPLParser.UnaryMinusContext ctx) {
        Token start = ctx.valueExpression().getStart();
        if (start.getType() == PPLParser.INTEGER_LITERAL && start == ctx.valueExpression().getStop()) {
            // parsed with its sign, as the magnitude of Long.MIN_VALUE is out of range
            return LiteralValue.ofInteger(parseLong(start, "-"));
        }
        AstExpression operand = valueExpression(ctx.valueExpression());
        // Fold the sign into numeric literals so "-5" stays a literal.
        if (operand instanceof LiteralValue literal) {
            if (literal.kind() == LiteralValue.Kind.INTEGER) {
                return LiteralValue.ofInteger(-((Long) literal.value()));
            }
            if (literal.kind() == LiteralValue.Kind.DECIMAL) {
                return LiteralValue.ofDecimal(-((Double) literal.value()));
            }
        }
        return new UnaryOperation("-", operand);
    }

    @Override
    public AstExpression visitMultiplicative(PPLParser.MultiplicativeContext ctx) {
        return new BinaryOperation(ctx.op.getText(), valueExpression(ctx.left), valueExpression(ctx.right));
    }

    @Override
    public AstExpression visitAdditive(PPLParser.AdditiveContext ctx) {
        return new BinaryOperation(ctx.op.getText(), valueExpression(ctx.left), valueExpression(ctx.right));
    }

    @Override
    public AstExpression visitPrimary(PPLParser.PrimaryContext ctx) {
        return (AstExpression) visit(ctx.primaryExpression());
    }

    @Override
    public AstExpression visitFunctionCall(PPLParser.FunctionCallContext ctx) {
        List<AstExpression> args = new ArrayList<>();
        for (PPLParser.ExpressionContext arg : ctx.expression()) {
            args.add(expression(arg));
        }
        // count(*) is count()
        return new FunctionInvocation(identifierText(ctx.identifier()), args);
    }

    @Override
    public AstExpression visitIntervalLiteral(PPLParser.IntervalLiteralContext ctx) {
        long value = parseLong(ctx.INTEGER_LITERAL().getSymbol());
        if (ctx.MINUS() != null) {
            value = -value;
        }
        String unit = identifierText(ctx.unit);
        try {
            IntervalLiteral.Unit.fromKeyword(unit);
        } catch (IllegalArgumentException e) {
            throw error(ctx.unit, "unknown interval unit '" + unit + "'");
        }
        return new IntervalValue(value, unit);
    }

    @Override
    public AstExpression visitLiteralExpression(PPLParser.LiteralExpressionContext ctx) {
        return (AstExpression) visit(ctx.literal());
    }

    @Override
    public AstExpression visitFieldReference(PPLParser.FieldReferenceContext ctx) {
        return field(ctx.qualifiedName());
    }

    @Override
    public AstExpression visitParenthesized(PPLParser.ParenthesizedContext ctx) {
        return expression(ctx.expression());
    }

    @Override
    public AstExpression visitScalarSubquery(PPLParser.ScalarSubqueryContext ctx) {
        return new ScalarSubqueryValue(visitQuery(ctx.query()));
    }

    // ==================== Literals ====================

    @Override
    public AstExpression visitIntegerLiteral(PPLParser.IntegerLiteralContext ctx) {
        return LiteralValue.ofInteger(parseLong(ctx.INTEGER_LITERAL().getSymbol()));
    }

    @Override
    public AstExpression visitDecimalLiteral(PPLParser.DecimalLiteralContext ctx) {
        return LiteralValue.ofDecimal(Double.parseDouble(ctx.getText()));
    }

    @Override
    public AstExpression visitStringLiteral(PPLParser.StringLiteralContext ctx) {
        return LiteralValue.ofString(unquoteString(ctx.STRING_LITERAL().getText()));
    }

    @Override
    public AstExpression visitBooleanLiteral(PPLParser.BooleanLiteralContext ctx) {
        return LiteralValue.ofBoolean(ctx.TRUE() != null);
    }

    @Override
    public AstExpression visitNullLiteral(PPLParser.NullLiteralContext ctx) {
        return LiteralValue.ofNull();
    }

    // ==================== Utility Methods ====================

    private UnresolvedField field(PPLParser.QualifiedNameContext ctx) {
        List<String> parts = new ArrayList<>();
        for (PPLParser.IdentifierContext id : ctx.identifier()) {
            parts.add(identifierText(id));
        }
        return new UnresolvedField(parts);
    }

    private String qualifiedNameText(PPLParser.QualifiedNameContext ctx) {
        return String.join(".", field(ctx).parts());
    }

    private String identifierText(PPLParser.IdentifierContext ctx) {
        if (ctx instanceof PPLParser.QuotedIdentifierContext quoted) {
            String text = quoted.BACKQUOTED_IDENTIFIER().getText();
            return text.substring(1, text.length() - 1).replace("``", "`");
        }
        return ctx.getText();
    }

    /**
     * Strips the quotes of a single- or double-quoted literal and resolves its escapes:
     * a doubled quote or a backslash followed by any character.
     */
    static String unquoteString(String text) {
        char quote = text.charAt(0);
        String body = text.substring(1, text.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(next);
                }
            } else if (c == quote && i + 1 < body.length() && body.charAt(i + 1) == quote) {
                sb.append(quote);
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private long parseLong(Token token) {
        return parseLong(token, "");
    }

    private long parseLong(Token token, String sign) {
        try {
            return Long.parseLong(sign + token.getText());
        } catch (NumberFormatException e) {
            throw new PPLParseException(token.getLine(), token.getCharPositionInLine(), token.getText(),
                "integer literal out of range");
        }
    }

    private PPLParseException error(ParserRuleContext ctx, String message) {
        Token start = ctx.getStart();
        return new PPLParseException(start.getLine(), start.getCharPositionInLine(), ctx.getText(), message);
    }
}
