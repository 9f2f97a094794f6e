package com.pipeduck.expression;

import com.pipeduck.generator.SQLQuoting;
import com.pipeduck.types.DataType;
import java.util.Objects;

/**
 * Access to a field of a struct-typed expression, produced for dotted references into
 * nested object fields ({@code address.city}).
 */
public final class StructFieldAccess implements Expression {

    private final Expression child;
    private final String fieldName;
    private final DataType dataType;

    public StructFieldAccess(Expression child, String fieldName, DataType dataType) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public Expression child() {
        return child;
    }

    public String fieldName() {
        return fieldName;
    }

    /**
     * Returns the dotted path from the root column, e.g. {@code address.city}.
     */
    public String path() {
        String prefix = child instanceof StructFieldAccess access ? access.path()
            : child instanceof ColumnReference column ? column.columnName()
            : child.toSQL();
        return prefix + "." + fieldName;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public String toSQL() {
        return child.toSQL() + "." + SQLQuoting.quoteIdentifierIfNeeded(fieldName);
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StructFieldAccess that)) return false;
        return child.equals(that.child) && fieldName.equals(that.fieldName) && dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, fieldName, dataType);
    }
}
