package com.pipeduck.analyzer;

import com.pipeduck.exception.AnalysisException;
import com.pipeduck.exception.UnsupportedConstructException;
import com.pipeduck.expression.*;
import com.pipeduck.functions.FunctionRegistry;
import com.pipeduck.functions.FunctionSignature;
import com.pipeduck.logical.LogicalPlan;
import com.pipeduck.ppl.ast.*;
import com.pipeduck.types.BooleanType;
import com.pipeduck.types.DataType;
import com.pipeduck.types.DataTypes;
import com.pipeduck.types.NullType;
import com.pipeduck.types.StringType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Resolves and type-checks PPL expressions against a {@link Scope}.
 *
 * <p>Aggregate calls are rejected here; {@code stats} resolves its aggregate list itself
 * and only passes the aggregate arguments through this class. Bracketed subqueries are
 * handed back to the owning {@link PPLAnalyzer} with the current scope as their parent.
 */
final class ExpressionAnalyzer {

    private static final Set<String> DATE_OFFSET_FUNCTIONS = Set.of("adddate", "date_add", "subdate", "date_sub");

    private final PPLAnalyzer analyzer;

    ExpressionAnalyzer(PPLAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Resolves an expression.
     *
     * @throws AnalysisException on an unresolved name or a type mismatch
     * @throws UnsupportedConstructException on an interval outside date arithmetic or an
     *         aggregate call
     */
    Expression analyze(AstExpression expr, Scope scope) {
        if (expr instanceof UnresolvedField field) {
            return scope.resolve(field);
        }
        if (expr instanceof LiteralValue literal) {
            return literal(literal);
        }
        if (expr instanceof IntervalValue interval) {
            throw new UnsupportedConstructException(interval.canonicalName(),
                "Interval literal '" + interval.canonicalName()
                    + "' is only supported as an operand of date arithmetic or adddate/subdate");
        }
        if (expr instanceof BinaryOperation op) {
            return binary(op, scope);
        }
        if (expr instanceof UnaryOperation op) {
            return unary(op, scope);
        }
        if (expr instanceof FunctionInvocation call) {
            return function(call, scope);
        }
        if (expr instanceof BetweenPredicate between) {
            Expression value = analyze(between.value(), scope);
            Expression lower = analyze(between.lower(), scope);
            Expression upper = analyze(between.upper(), scope);
            requireComparable(value, lower, expr);
            requireComparable(value, upper, expr);
            return new BetweenExpression(value, lower, upper, between.negated());
        }
        if (expr instanceof LikePredicate like) {
            Expression value = analyze(like.value(), scope);
            Expression pattern = analyze(like.pattern(), scope);
            requireString(value, expr);
            requireString(pattern, expr);
            return new LikeExpression(value, pattern, like.negated());
        }
        if (expr instanceof InListPredicate in) {
            Expression value = analyze(in.value(), scope);
            List<Expression> values = new ArrayList<>();
            for (AstExpression item : in.values()) {
                Expression resolved = analyze(item, scope);
                requireComparable(value, resolved, expr);
                values.add(resolved);
            }
            return new InExpression(value, values, in.negated());
        }
        if (expr instanceof IsNullPredicate isNull) {
            Expression value = analyze(isNull.value(), scope);
            return isNull.negated() ? UnaryExpression.isNotNull(value) : UnaryExpression.isNull(value);
        }
        if (expr instanceof InSubqueryPredicate in) {
            Expression value = analyze(in.value(), scope);
            LogicalPlan subquery = singleColumnSubquery(in.subquery(), scope, "in");
            requireComparable(value, new ColumnReference(subquery.schema().fieldAt(0).name(),
                subquery.schema().fieldAt(0).dataType()), expr);
            return new InSubquery(value, subquery, in.negated());
        }
        if (expr instanceof ExistsPredicate exists) {
            return new ExistsSubquery(analyzer.analyzeSubquery(exists.subquery(), scope));
        }
        if (expr instanceof ScalarSubqueryValue scalar) {
            return new ScalarSubquery(singleColumnSubquery(scalar.subquery(), scope, "scalar"));
        }
        throw new UnsupportedConstructException(expr.canonicalName(),
            "Unsupported expression: " + expr.canonicalName());
    }

    /**
     * Resolves a predicate and checks that it is boolean.
     *
     * @param context the command name, for the error message
     */
    Expression analyzePredicate(AstExpression expr, Scope scope, String context) {
        Expression predicate = analyze(expr, scope);
        DataType type = predicate.dataType();
        if (!(type instanceof BooleanType)) {
            throw new AnalysisException(String.format(
                "%s condition must be boolean, but '%s' is %s", context, expr.canonicalName(), type.typeName()));
        }
        return predicate;
    }

    // ==================== Literals ====================

    private static Expression literal(LiteralValue literal) {
        switch (literal.kind()) {
            case INTEGER: {
                long value = (Long) literal.value();
                if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                    return Literal.of((int) value);
                }
                return Literal.of(value);
            }
            case DECIMAL:
                return Literal.of((Double) literal.value());
            case STRING:
                return Literal.of((String) literal.value());
            case BOOLEAN:
                return Literal.of((Boolean) literal.value());
            default:
                return Literal.nullValue();
        }
    }

    // ==================== Operators ====================

    private Expression binary(BinaryOperation op, Scope scope) {
        BinaryExpression.Operator operator = BinaryExpression.Operator.fromSymbol(op.operator());

        if (operator == BinaryExpression.Operator.ADD || operator == BinaryExpression.Operator.SUBTRACT) {
            if (op.right() instanceof IntervalValue interval) {
                return dateArithmetic(analyze(op.left(), scope), operator, interval, op);
            }
            // interval + date is date + interval
            if (operator == BinaryExpression.Operator.ADD && op.left() instanceof IntervalValue interval) {
                return dateArithmetic(analyze(op.right(), scope), operator, interval, op);
            }
        }

        Expression left = analyze(op.left(), scope);
        Expression right = analyze(op.right(), scope);
        DataType leftType = left.dataType();
        DataType rightType = right.dataType();

        if (operator.isArithmetic()) {
            if (!numericOrNull(leftType) || !numericOrNull(rightType)) {
                throw typeMismatch(op, leftType, rightType);
            }
        } else if (operator.isComparison()) {
            requireComparable(left, right, op);
        } else if (!booleanOrNull(leftType) || !booleanOrNull(rightType)) {
            throw typeMismatch(op, leftType, rightType);
        }
        return new BinaryExpression(left, operator, right);
    }

    private static Expression dateArithmetic(Expression date, BinaryExpression.Operator operator,
                                             IntervalValue interval, AstExpression source) {
        if (!DataTypes.isTemporal(date.dataType()) && !(date.dataType() instanceof StringType)) {
            throw new AnalysisException(String.format(
                "Type mismatch in '%s': interval arithmetic needs a date or timestamp, got %s",
                source.canonicalName(), date.dataType().typeName()));
        }
        return new BinaryExpression(date, operator, interval(interval));
    }

    private static IntervalLiteral interval(IntervalValue value) {
        return new IntervalLiteral(value.value(), IntervalLiteral.Unit.fromKeyword(value.unit()));
    }

    private Expression unary(UnaryOperation op, Scope scope) {
        Expression operand = analyze(op.operand(), scope);
        DataType type = operand.dataType();
        if (op.isNot()) {
            if (!booleanOrNull(type)) {
                throw new AnalysisException(String.format(
                    "Type mismatch in '%s': not expects a boolean, got %s", op.canonicalName(), type.typeName()));
            }
            return UnaryExpression.not(operand);
        }
        if (!numericOrNull(type)) {
            throw new AnalysisException(String.format(
                "Type mismatch in '%s': negation expects a number, got %s", op.canonicalName(), type.typeName()));
        }
        return new UnaryExpression(UnaryExpression.Operator.NEGATE, operand);
    }

    // ==================== Functions ====================

    private Expression function(FunctionInvocation call, Scope scope) {
        String name = call.name();
        FunctionSignature signature = FunctionRegistry.lookup(name).orElseThrow(() ->
            new AnalysisException("Unsupported function: " + name, name));

        if (signature.isAggregate()) {
            throw new UnsupportedConstructException(call.canonicalName(),
                "Aggregate function '" + call.canonicalName() + "' is only allowed in the stats aggregate list");
        }
        if (!signature.acceptsArgumentCount(call.arguments().size())) {
            throw new AnalysisException(String.format("Function %s expects %s argument(s), got %d",
                name, signature.arityDescription(), call.arguments().size()), name);
        }

        // adddate(d, interval 1 day) is d + interval 1 day
        if (DATE_OFFSET_FUNCTIONS.contains(name) && call.arguments().get(1) instanceof IntervalValue interval) {
            BinaryExpression.Operator operator = name.startsWith("add") || name.equals("date_add")
                ? BinaryExpression.Operator.ADD
                : BinaryExpression.Operator.SUBTRACT;
            return dateArithmetic(analyze(call.arguments().get(0), scope), operator, interval, call);
        }

        List<Expression> args = analyzeArguments(call, scope);
        DataType returnType = resolveReturnType(signature, call, args);
        boolean nullable = !name.equals("isnull") && !name.equals("isnotnull") && !name.equals("now");
        return new FunctionCall(name, args, returnType, nullable);
    }

    List<Expression> analyzeArguments(FunctionInvocation call, Scope scope) {
        List<Expression> args = new ArrayList<>();
        for (AstExpression arg : call.arguments()) {
            args.add(analyze(arg, scope));
        }
        return args;
    }

    /**
     * Applies the signature's return type rule, reporting rejected argument types as an
     * analysis error.
     */
    static DataType resolveReturnType(FunctionSignature signature, FunctionInvocation call, List<Expression> args) {
        List<DataType> argTypes = new ArrayList<>();
        for (Expression arg : args) {
            argTypes.add(arg.dataType());
        }
        try {
            return signature.returnType().resolve(argTypes);
        } catch (IllegalArgumentException e) {
            throw new AnalysisException(
                String.format("Invalid arguments in '%s': %s", call.canonicalName(), e.getMessage()), call.name());
        }
    }

    // ==================== Subqueries ====================

    private LogicalPlan singleColumnSubquery(PPLQuery query, Scope scope, String kind) {
        LogicalPlan plan = analyzer.analyzeSubquery(query, scope);
        int columns = plan.schema().size();
        if (columns != 1) {
            throw new AnalysisException(String.format(
                "%s subquery must return exactly one column, but returns %d: %s",
                kind, columns, plan.schema().fieldNames()));
        }
        return plan;
    }

    // ==================== Type Checks ====================

    private static boolean numericOrNull(DataType type) {
        return DataTypes.isNumeric(type) || type instanceof NullType;
    }

    private static boolean booleanOrNull(DataType type) {
        return type instanceof BooleanType || type instanceof NullType;
    }

    private static void requireComparable(Expression left, Expression right, AstExpression source) {
        if (!DataTypes.isComparable(left.dataType(), right.dataType())) {
            throw typeMismatch(source, left.dataType(), right.dataType());
        }
    }

    private static void requireString(Expression value, AstExpression source) {
        DataType type = value.dataType();
        if (!(type instanceof StringType) && !(type instanceof NullType)) {
            throw new AnalysisException(String.format(
                "Type mismatch in '%s': like expects strings, got %s", source.canonicalName(), type.typeName()));
        }
    }

    private static AnalysisException typeMismatch(AstExpression source, DataType left, DataType right) {
        return new AnalysisException(String.format("Type mismatch in '%s': %s and %s",
            source.canonicalName(), left.typeName(), right.typeName()));
    }
}
