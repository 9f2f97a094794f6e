package com.pipeduck.analyzer;

import com.pipeduck.catalog.Catalog;
import com.pipeduck.exception.AnalysisException;
import com.pipeduck.expression.ColumnReference;
import com.pipeduck.expression.Expression;
import com.pipeduck.expression.StructFieldAccess;
import com.pipeduck.logical.Join;
import com.pipeduck.logical.LogicalPlan;
import com.pipeduck.ppl.ast.UnresolvedField;
import com.pipeduck.types.DataType;
import com.pipeduck.types.StructField;
import com.pipeduck.types.StructType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The columns visible to the next command of a pipeline, in output order.
 *
 * <p>Each column records the qualifiers it may be referenced by ({@code orders.status},
 * {@code o.status}) and the qualifier its SQL rendering must carry. The two differ
 * because a qualifier stays valid for name resolution across the whole pipeline while
 * the rendered SQL can only use the name of the immediately enclosing relation.
 *
 * <p>A scope built for a subquery in expression position has a parent; names not found
 * locally are resolved there and become outer references. Scopes are immutable.
 */
final class Scope {

    /**
     * A visible column.
     *
     * @param name the column name
     * @param type the column type
     * @param nullable whether the column may be null
     * @param qualifiers the relation names the column may be qualified with
     * @param sqlQualifier the qualifier to render, or null to render the bare name
     * @param definition for a column assigned earlier in the same {@code eval}, the
     *                   expression it stands for; null otherwise
     */
    record Column(String name, DataType type, boolean nullable, Set<String> qualifiers,
                  String sqlQualifier, Expression definition) {

        Column {
            qualifiers = Collections.unmodifiableSet(new LinkedHashSet<>(qualifiers));
        }

        Column withSqlQualifier(String newSqlQualifier) {
            return new Column(name, type, nullable, qualifiers, newSqlQualifier, definition);
        }

        Column withQualifier(String qualifier) {
            Set<String> extended = new LinkedHashSet<>(qualifiers);
            extended.add(qualifier);
            return new Column(name, type, nullable, extended, sqlQualifier, definition);
        }

        Column withName(String newName) {
            return new Column(newName, type, nullable, qualifiers, sqlQualifier, definition);
        }

        /**
         * Returns the expression a reference to this column resolves to.
         */
        Expression reference() {
            if (definition != null) {
                return definition;
            }
            return new ColumnReference(name, sqlQualifier, type, nullable);
        }

        String displayName() {
            return qualifiers.isEmpty() ? name : qualifiers.iterator().next() + "." + name;
        }
    }

    private final List<Column> columns;
    private final Scope parent;
    private final Catalog catalog;

    Scope(List<Column> columns, Scope parent, Catalog catalog) {
        this.columns = List.copyOf(columns);
        this.parent = parent;
        this.catalog = catalog;
    }

    /**
     * Creates the scope of a relation: every output column of the plan, qualified by the
     * given names and rendered with the plan's relation qualifier.
     */
    static Scope ofRelation(LogicalPlan plan, Set<String> qualifiers, Scope parent, Catalog catalog) {
        String sqlQualifier = plan instanceof Join ? null : plan.relationQualifier();
        List<Column> columns = new ArrayList<>();
        for (StructField field : plan.schema().fields()) {
            columns.add(new Column(field.name(), field.dataType(), field.nullable(), qualifiers, sqlQualifier, null));
        }
        return new Scope(columns, parent, catalog);
    }

    List<Column> columns() {
        return columns;
    }

    Scope parent() {
        return parent;
    }

    List<String> columnNames() {
        return columns.stream().map(Column::name).collect(Collectors.toList());
    }

    Scope withColumns(List<Column> newColumns) {
        return new Scope(newColumns, parent, catalog);
    }

    Scope withParent(Scope newParent) {
        return new Scope(columns, newParent, catalog);
    }

    /**
     * Returns this scope as seen by a command placed on top of {@code plan}: columns of a
     * join keep their per-side qualifiers, any other plan is referenced through its
     * relation qualifier, or unqualified when it has none.
     */
    Scope rebase(LogicalPlan plan) {
        if (plan instanceof Join) {
            return this;
        }
        String sqlQualifier = plan.relationQualifier();
        List<Column> rebased = new ArrayList<>(columns.size());
        for (Column column : columns) {
            rebased.add(column.withSqlQualifier(sqlQualifier));
        }
        return withColumns(rebased);
    }

    /**
     * Adds a qualifier to every column, as {@code as <alias>} does.
     */
    Scope qualifiedBy(String qualifier) {
        List<Column> qualified = new ArrayList<>(columns.size());
        for (Column column : columns) {
            qualified.add(column.withQualifier(qualifier));
        }
        return withColumns(qualified);
    }

    /**
     * Concatenates the columns of two scopes, left first, keeping this scope's parent.
     */
    Scope concat(Scope right) {
        List<Column> all = new ArrayList<>(columns);
        all.addAll(right.columns);
        return withColumns(all);
    }

    /**
     * Returns {@code column} if a reference to it renders unambiguously in SQL.
     *
     * <p>Once a command has wrapped a join in a subquery, same-named columns of the two
     * sides both render as the bare name; they stay visible but can no longer be
     * referenced or passed through.
     *
     * @throws AnalysisException if another column renders the same way
     */
    Column requireRenderable(Column column, String display) {
        if (column.definition() != null) {
            return column;
        }
        long renderedAlike = columns.stream()
            .filter(c -> c.definition() == null
                && c.name().equals(column.name())
                && Objects.equals(c.sqlQualifier(), column.sqlQualifier()))
            .count();
        if (renderedAlike > 1) {
            throw new AnalysisException(String.format(
                "Reference '%s' is ambiguous: %d columns named '%s' reach this command through a subquery; "
                    + "rename them directly after the join", display, renderedAlike, column.name()), display);
        }
        return column;
    }

    /**
     * Returns the column a resolved expression refers to directly, if it is a plain
     * reference to a column of this scope.
     */
    Optional<Column> sourceColumn(Expression expression) {
        if (!(expression instanceof ColumnReference ref) || ref.isOuter()) {
            return Optional.empty();
        }
        for (Column column : columns) {
            if (column.definition() == null
                    && column.name().equals(ref.columnName())
                    && Objects.equals(column.sqlQualifier(), ref.qualifier())) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a field reference.
     *
     * <p>For {@code a.b.c} the candidates are tried in order: column {@code b} qualified
     * by {@code a} with nested path {@code c}; column {@code a} with nested path
     * {@code b.c}; a column literally named {@code a.b.c}. Names missing here are looked
     * up in the parent scope and returned as outer references.
     *
     * @throws AnalysisException if the name is unknown or matches several columns
     */
    Expression resolve(UnresolvedField field) {
        Optional<Expression> resolved = lookup(field, false);
        if (resolved.isPresent()) {
            return resolved.get();
        }
        String name = field.canonicalName();
        throw new AnalysisException(
            String.format("Column '%s' cannot be resolved; available columns: %s", name, columnNames()), name);
    }

    /**
     * Resolves a field reference that must name a whole column of this scope (not a
     * nested field, not an outer column).
     *
     * @throws AnalysisException if the name is unknown, ambiguous or not a column
     */
    Column resolveColumn(UnresolvedField field) {
        List<String> parts = field.parts();
        String display = field.canonicalName();
        if (parts.size() == 2) {
            Optional<Column> qualified = single(columns.stream()
                .filter(c -> c.name().equals(parts.get(1)) && c.qualifiers().contains(parts.get(0)))
                .collect(Collectors.toList()), display);
            if (qualified.isPresent()) {
                return requireRenderable(qualified.get(), display);
            }
        }
        Optional<Column> byName = single(columns.stream()
            .filter(c -> c.name().equals(display))
            .collect(Collectors.toList()), display);
        if (byName.isPresent()) {
            return requireRenderable(byName.get(), display);
        }
        // fails for unknown names; anything it does resolve is nested or outer
        resolve(field);
        throw new AnalysisException(
            String.format("'%s' is not a column of the current pipeline", display), display);
    }

    private Optional<Expression> lookup(UnresolvedField field, boolean outer) {
        Optional<Expression> local = lookupLocal(field.parts());
        if (local.isPresent()) {
            Expression expression = local.get();
            if (outer) {
                return Optional.of(markOuter(expression));
            }
            return local;
        }
        if (parent != null) {
            return parent.lookup(field, true);
        }
        return Optional.empty();
    }

    private Optional<Expression> lookupLocal(List<String> parts) {
        String display = String.join(".", parts);

        if (parts.size() >= 2) {
            String qualifier = parts.get(0);
            List<Column> matches = columns.stream()
                .filter(c -> c.name().equals(parts.get(1)) && c.qualifiers().contains(qualifier))
                .collect(Collectors.toList());
            Optional<Expression> found = single(matches, display)
                .flatMap(c -> descend(requireRenderable(c, display).reference(), parts.subList(2, parts.size())));
            if (found.isPresent()) {
                return found;
            }
        }

        List<Column> byName = columns.stream()
            .filter(c -> c.name().equals(parts.get(0)))
            .collect(Collectors.toList());
        Optional<Expression> found = single(byName, display)
            .flatMap(c -> descend(requireRenderable(c, display).reference(), parts.subList(1, parts.size())));
        if (found.isPresent()) {
            return found;
        }

        if (parts.size() >= 2) {
            List<Column> exact = columns.stream()
                .filter(c -> c.name().equals(display))
                .collect(Collectors.toList());
            return single(exact, display).map(c -> requireRenderable(c, display).reference());
        }
        return Optional.empty();
    }

    private static Optional<Column> single(List<Column> matches, String display) {
        if (matches.size() > 1) {
            List<String> candidates = matches.stream().map(Column::displayName).collect(Collectors.toList());
            throw new AnalysisException(
                String.format("Reference '%s' is ambiguous, could be: %s", display, candidates), display);
        }
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    private Optional<Expression> descend(Expression root, List<String> path) {
        Expression current = root;
        for (String part : path) {
            if (!(current.dataType() instanceof StructType struct)) {
                return Optional.empty();
            }
            Optional<DataType> fieldType = resolveNested(struct, part);
            if (fieldType.isEmpty()) {
                return Optional.empty();
            }
            current = new StructFieldAccess(current, part, fieldType.get());
        }
        return Optional.of(current);
    }

    private Optional<DataType> resolveNested(StructType struct, String name) {
        try {
            return catalog.resolveColumn(struct, name);
        } catch (AnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalysisException("Catalog failed to resolve column '" + name + "'", e);
        }
    }

    private static Expression markOuter(Expression expression) {
        if (expression instanceof ColumnReference ref) {
            return ref.asOuter();
        }
        if (expression instanceof StructFieldAccess access) {
            return new StructFieldAccess(markOuter(access.child()), access.fieldName(), access.dataType());
        }
        return expression;
    }
}
