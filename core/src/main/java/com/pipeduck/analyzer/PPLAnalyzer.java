package com.pipeduck.analyzer;

import com.pipeduck.catalog.Catalog;
import com.pipeduck.config.AnalyzerOptions;
import com.pipeduck.exception.AnalysisException;
import com.pipeduck.exception.UnsupportedConstructException;
import com.pipeduck.expression.AggregateExpression;
import com.pipeduck.expression.ColumnReference;
import com.pipeduck.expression.Expression;
import com.pipeduck.expression.StructFieldAccess;
import com.pipeduck.functions.FunctionRegistry;
import com.pipeduck.functions.FunctionSignature;
import com.pipeduck.logical.*;
import com.pipeduck.ppl.ast.*;
import com.pipeduck.types.StructField;
import com.pipeduck.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link LogicalPlan} from a parsed PPL pipeline.
 *
 * <p>Commands are applied left to right. Each one wraps the running plan in a new node
 * and produces the {@link Scope} the next command resolves names against:
 * <ul>
 *   <li>{@code source}: {@link TableScan}, optionally under an {@link AliasedRelation}</li>
 *   <li>{@code where}: {@link Filter}</li>
 *   <li>{@code stats}: {@link Aggregate}, group columns then aggregates</li>
 *   <li>{@code eval}, {@code fields}, {@code rename}: {@link Project}</li>
 *   <li>{@code sort}: {@link Sort}</li>
 *   <li>{@code head}: {@link Limit}</li>
 *   <li>{@code join}: {@link Join}</li>
 * </ul>
 *
 * <p>The first failure aborts analysis; no partial plan is returned. An analyzer holds no
 * state between calls and may be shared, provided the catalog may be.
 */
public class PPLAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(PPLAnalyzer.class);

    private final Catalog catalog;
    private final AnalyzerOptions options;
    private final ExpressionAnalyzer expressions;

    public PPLAnalyzer(Catalog catalog) {
        this(catalog, AnalyzerOptions.DEFAULTS);
    }

    public PPLAnalyzer(Catalog catalog, AnalyzerOptions options) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.expressions = new ExpressionAnalyzer(this);
    }

    /**
     * Analyzes a pipeline.
     *
     * @param query the parsed pipeline
     * @return the logical plan
     * @throws AnalysisException if a name cannot be resolved, a type does not fit, or the
     *         catalog fails
     * @throws UnsupportedConstructException for valid syntax without implemented semantics
     */
    public LogicalPlan analyze(PPLQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        logger.debug("Analyzing PPL: {}", query.canonicalText());
        Step result = analyzeQuery(query, null);
        logger.debug("Logical plan:\n{}", result.plan().treeString());
        return result.plan();
    }

    /**
     * Analyzes a bracketed subquery in expression position. Names it cannot resolve
     * itself are looked up in {@code outer}.
     */
    LogicalPlan analyzeSubquery(PPLQuery query, Scope outer) {
        logger.debug("Analyzing subquery: {}", query.canonicalText());
        return analyzeQuery(query, outer).plan();
    }

    private record Step(LogicalPlan plan, Scope scope) {

        /**
         * Places {@code next} on top of the pipeline; its columns are those of {@code scope}.
         */
        static Step of(LogicalPlan next, Scope scope) {
            return new Step(next, scope.rebase(next));
        }
    }

    private Step analyzeQuery(PPLQuery query, Scope parent) {
        Step step = source(query.source(), parent);
        for (PPLCommand command : query.pipeline()) {
            logger.debug("Applying '{}'", command.canonicalText());
            step = apply(command, step);
        }
        return step;
    }

    private Step apply(PPLCommand command, Step step) {
        if (command instanceof WhereCommand where) {
            return where(where, step);
        }
        if (command instanceof StatsCommand stats) {
            return stats(stats, step);
        }
        if (command instanceof EvalCommand eval) {
            return eval(eval, step);
        }
        if (command instanceof SortCommand sort) {
            return sort(sort, step);
        }
        if (command instanceof HeadCommand head) {
            return head(head, step);
        }
        if (command instanceof FieldsCommand fields) {
            return fields(fields, step);
        }
        if (command instanceof RenameCommand rename) {
            return rename(rename, step);
        }
        if (command instanceof JoinCommand join) {
            return join(join, step);
        }
        throw new UnsupportedConstructException(command.canonicalText(),
            "Unsupported command: " + command.canonicalText());
    }

    // ==================== source ====================

    private Step source(SourceCommand source, Scope parent) {
        TableScan scan = scanTable(source.table());
        LogicalPlan plan = scan;
        Set<String> qualifiers = new LinkedHashSet<>();
        qualifiers.add(scan.relationQualifier());
        if (source.alias() != null) {
            plan = new AliasedRelation(scan, source.alias());
            qualifiers.add(source.alias());
        }
        return new Step(plan, Scope.ofRelation(plan, qualifiers, parent, catalog));
    }

    private TableScan scanTable(String name) {
        Optional<StructType> schema;
        try {
            schema = catalog.resolveTable(name);
        } catch (AnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalysisException("Catalog lookup of table '" + name + "' failed: " + e.getMessage(), e);
        }
        StructType tableSchema = schema.orElseThrow(() ->
            new AnalysisException("Table or index '" + name + "' not found", name));
        return new TableScan(name, tableSchema);
    }

    // ==================== where ====================

    private Step where(WhereCommand where, Step step) {
        Expression condition = expressions.analyzePredicate(where.predicate(), step.scope(), "where");
        return Step.of(new Filter(step.plan(), condition), step.scope());
    }

    // ==================== stats ====================

    private Step stats(StatsCommand stats, Step step) {
        Scope scope = step.scope();

        List<Expression> groupBy = new ArrayList<>();
        List<Set<String>> qualifiers = new ArrayList<>();
        for (AstExpression key : stats.groupBy()) {
            Expression resolved = expressions.analyze(key, scope);
            groupBy.add(resolved);
            qualifiers.add(scope.sourceColumn(resolved).map(Scope.Column::qualifiers).orElse(Set.of()));
        }

        List<AggregateExpression> aggregates = new ArrayList<>();
        for (StatsCommand.Aggregation aggregation : stats.aggregations()) {
            aggregates.add(aggregate(aggregation, scope));
            qualifiers.add(Set.of());
        }

        Set<String> names = new HashSet<>();
        for (Expression key : groupBy) {
            requireUniqueName(names, Aggregate.groupingName(key), "stats");
        }
        for (AggregateExpression aggregate : aggregates) {
            requireUniqueName(names, aggregate.alias(), "stats");
        }

        Aggregate plan = new Aggregate(step.plan(), groupBy, aggregates);
        return Step.of(plan, projectedScope(scope, plan, qualifiers));
    }

    private AggregateExpression aggregate(StatsCommand.Aggregation aggregation, Scope scope) {
        AstExpression expr = aggregation.expression();
        if (!(expr instanceof FunctionInvocation call)) {
            throw new AnalysisException(
                "stats expects aggregate function calls, got '" + expr.canonicalName() + "'");
        }
        FunctionSignature signature = FunctionRegistry.lookup(call.name()).orElseThrow(() ->
            new AnalysisException("Unsupported function: " + call.name(), call.name()));
        if (!signature.isAggregate()) {
            throw new AnalysisException(
                "stats expects aggregate function calls, but '" + call.name() + "' is not an aggregate function",
                call.name());
        }
        if (!signature.acceptsArgumentCount(call.arguments().size())) {
            throw new AnalysisException(String.format("Function %s expects %s argument(s), got %d",
                call.name(), signature.arityDescription(), call.arguments().size()), call.name());
        }
        List<Expression> args = expressions.analyzeArguments(call, scope);
        return new AggregateExpression(
            call.name(),
            args.isEmpty() ? null : args.get(0),
            aggregation.outputName(),
            FunctionRegistry.isDistinctAggregate(call.name()),
            ExpressionAnalyzer.resolveReturnType(signature, call, args));
    }

    // ==================== eval ====================

    private Step eval(EvalCommand eval, Step step) {
        Scope scope = step.scope();
        List<Scope.Column> visible = new ArrayList<>(scope.columns());
        List<Expression> projections = new ArrayList<>();
        List<String> names = new ArrayList<>();
        List<Set<String>> qualifiers = new ArrayList<>();
        for (Scope.Column column : visible) {
            projections.add(scope.requireRenderable(column, column.displayName()).reference());
            names.add(column.name());
            qualifiers.add(column.qualifiers());
        }

        for (EvalCommand.Assignment assignment : eval.assignments()) {
            // earlier assignments of this eval resolve to their defining expressions
            Expression value = expressions.analyze(assignment.expression(), scope.withColumns(visible));
            Scope.Column defined = new Scope.Column(
                assignment.name(), value.dataType(), value.nullable(), Set.of(), null, value);
            int index = names.indexOf(assignment.name());
            if (index != names.lastIndexOf(assignment.name())) {
                throw new AnalysisException(String.format(
                    "eval: '%s' names more than one column; rename one of them before assigning it",
                    assignment.name()), assignment.name());
            }
            if (index >= 0) {
                projections.set(index, value);
                visible.set(index, defined);
                qualifiers.set(index, Set.of());
            } else {
                projections.add(value);
                names.add(assignment.name());
                visible.add(defined);
                qualifiers.add(Set.of());
            }
        }

        Project plan = project(step.plan(), projections, names, "eval");
        return Step.of(plan, projectedScope(scope, plan, qualifiers));
    }

    // ==================== sort ====================

    private Step sort(SortCommand sort, Step step) {
        List<Sort.SortOrder> orders = new ArrayList<>();
        for (SortCommand.SortKey key : sort.keys()) {
            Expression expression = expressions.analyze(key.field(), step.scope());
            Sort.SortDirection direction = key.ascending() ? Sort.SortDirection.ASCENDING : Sort.SortDirection.DESCENDING;
            orders.add(new Sort.SortOrder(expression, direction));
        }
        return Step.of(new Sort(step.plan(), orders), step.scope());
    }

    // ==================== head ====================

    private Step head(HeadCommand head, Step step) {
        long size = head.size() != null ? head.size() : options.defaultHeadSize();
        if (size < 0) {
            throw new AnalysisException("head size must be a non-negative integer, got " + size);
        }
        if (head.offset() < 0) {
            throw new AnalysisException("head offset must be a non-negative integer, got " + head.offset());
        }
        return Step.of(new Limit(step.plan(), size, head.offset()), step.scope());
    }

    // ==================== fields ====================

    private Step fields(FieldsCommand fields, Step step) {
        Scope scope = step.scope();
        List<Expression> projections = new ArrayList<>();
        List<String> names = new ArrayList<>();
        List<Set<String>> qualifiers = new ArrayList<>();

        if (fields.exclude()) {
            Set<Scope.Column> excluded = new HashSet<>();
            for (UnresolvedField field : fields.fields()) {
                if (!excluded.add(scope.resolveColumn(field))) {
                    throw new AnalysisException("Duplicate field '" + field.canonicalName() + "' in fields",
                        field.canonicalName());
                }
            }
            for (Scope.Column column : scope.columns()) {
                if (!excluded.contains(column)) {
                    projections.add(scope.requireRenderable(column, column.displayName()).reference());
                    names.add(column.name());
                    qualifiers.add(column.qualifiers());
                }
            }
            if (projections.isEmpty()) {
                throw new AnalysisException("fields - removes every column of the pipeline");
            }
        } else {
            Set<String> seen = new HashSet<>();
            for (UnresolvedField field : fields.fields()) {
                Expression expression = scope.resolve(field);
                if (isOuter(expression)) {
                    throw new AnalysisException(
                        "'" + field.canonicalName() + "' is not a column of the current pipeline", field.canonicalName());
                }
                String name = outputName(expression, field);
                requireUniqueName(seen, name, "fields");
                projections.add(expression);
                names.add(name);
                qualifiers.add(scope.sourceColumn(expression).map(Scope.Column::qualifiers).orElse(Set.of()));
            }
        }

        Project plan = project(step.plan(), projections, names, "fields");
        return Step.of(plan, projectedScope(scope, plan, qualifiers));
    }

    private static String outputName(Expression expression, UnresolvedField field) {
        if (expression instanceof ColumnReference column) {
            return column.columnName();
        }
        if (expression instanceof StructFieldAccess access) {
            return access.path();
        }
        return field.canonicalName();
    }

    private static boolean isOuter(Expression expression) {
        if (expression instanceof ColumnReference column) {
            return column.isOuter();
        }
        if (expression instanceof StructFieldAccess access) {
            return isOuter(access.child());
        }
        return false;
    }

    // ==================== rename ====================

    private Step rename(RenameCommand rename, Step step) {
        Scope scope = step.scope();
        List<Scope.Column> columns = scope.columns();
        List<String> names = new ArrayList<>();
        for (Scope.Column column : columns) {
            names.add(column.name());
        }

        Set<Integer> renamed = new HashSet<>();
        for (RenameCommand.Rename r : rename.renames()) {
            int index = columns.indexOf(scope.resolveColumn(r.field()));
            if (!renamed.add(index)) {
                throw new AnalysisException("Column '" + r.field().canonicalName() + "' is renamed twice",
                    r.field().canonicalName());
            }
            names.set(index, r.newName());
        }

        List<Expression> projections = new ArrayList<>();
        List<Set<String>> qualifiers = new ArrayList<>();
        for (Scope.Column column : columns) {
            projections.add(scope.requireRenderable(column, column.displayName()).reference());
            qualifiers.add(column.qualifiers());
        }
        Project plan = project(step.plan(), projections, names, "rename");
        return Step.of(plan, projectedScope(scope, plan, qualifiers));
    }

    // ==================== join ====================

    private Step join(JoinCommand join, Step step) {
        LogicalPlan left = step.plan();
        Scope leftScope = step.scope();
        if (join.leftAlias() != null) {
            left = new AliasedRelation(left, join.leftAlias());
            leftScope = leftScope.qualifiedBy(join.leftAlias()).rebase(left);
        }

        Step right = joinRight(join, leftScope.parent());
        Join.JoinType joinType = joinType(join);
        Scope combined = leftScope.concat(right.scope());

        Expression condition = null;
        if (join.condition() != null) {
            condition = expressions.analyzePredicate(join.condition(), combined, "join");
        }

        Join plan = new Join(left, right.plan(), joinType, condition);
        return new Step(plan, joinType.isLeftOnly() ? leftScope : combined);
    }

    private Step joinRight(JoinCommand join, Scope parent) {
        Relation relation = join.right();
        String alias = rightAlias(join);

        if (relation instanceof TableRelation table) {
            TableScan scan = scanTable(table.name());
            Set<String> qualifiers = new LinkedHashSet<>();
            qualifiers.add(scan.relationQualifier());
            LogicalPlan plan = scan;
            if (alias != null) {
                plan = new AliasedRelation(scan, alias);
                qualifiers.add(alias);
            }
            return new Step(plan, Scope.ofRelation(plan, qualifiers, parent, catalog));
        }

        SubqueryRelation subquery = (SubqueryRelation) relation;
        // independent scope: a join subquery cannot see the left side
        Step inner = analyzeQuery(subquery.query(), null);
        LogicalPlan plan = inner.plan();
        Scope scope = inner.scope();
        if (alias != null) {
            plan = new AliasedRelation(plan, alias);
            scope = scope.qualifiedBy(alias);
        }
        return new Step(plan, scope.rebase(plan).withParent(parent));
    }

    private static String rightAlias(JoinCommand join) {
        String fromOption = join.rightAlias();
        String fromRelation = join.right().alias();
        if (fromOption != null && fromRelation != null && !fromOption.equals(fromRelation)) {
            throw new AnalysisException(String.format(
                "join right side has two aliases: right = %s and as %s", fromOption, fromRelation), fromRelation);
        }
        return fromOption != null ? fromOption : fromRelation;
    }

    private static Join.JoinType joinType(JoinCommand join) {
        JoinCommand.JoinKind kind = join.joinType();
        if (kind == null) {
            return join.condition() == null ? Join.JoinType.CROSS : Join.JoinType.INNER;
        }
        if (kind == JoinCommand.JoinKind.CROSS && join.condition() != null) {
            throw new AnalysisException("cross join does not take an ON condition");
        }
        return switch (kind) {
            case INNER -> Join.JoinType.INNER;
            case LEFT -> Join.JoinType.LEFT;
            case RIGHT -> Join.JoinType.RIGHT;
            case FULL -> Join.JoinType.FULL;
            case CROSS -> Join.JoinType.CROSS;
            case SEMI -> Join.JoinType.LEFT_SEMI;
            case ANTI -> Join.JoinType.LEFT_ANTI;
        };
    }

    // ==================== Helpers ====================

    private static Project project(LogicalPlan child, List<Expression> projections, List<String> names,
                                   String command) {
        try {
            return new Project(child, projections, names);
        } catch (IllegalArgumentException e) {
            throw new AnalysisException(command + ": " + e.getMessage());
        }
    }

    /**
     * Builds the scope of a projection or aggregation: its output columns, each keeping
     * the qualifiers it had before when it passes an input column through.
     */
    private static Scope projectedScope(Scope input, LogicalPlan plan, List<Set<String>> qualifiers) {
        List<Scope.Column> columns = new ArrayList<>();
        List<StructField> fields = plan.schema().fields();
        for (int i = 0; i < fields.size(); i++) {
            StructField field = fields.get(i);
            columns.add(new Scope.Column(field.name(), field.dataType(), field.nullable(),
                qualifiers.get(i), plan.relationQualifier(), null));
        }
        return input.withColumns(columns);
    }

    private static void requireUniqueName(Set<String> seen, String name, String command) {
        if (!seen.add(name)) {
            throw new AnalysisException(
                String.format("%s produces column '%s' more than once", command, name), name);
        }
    }
}
