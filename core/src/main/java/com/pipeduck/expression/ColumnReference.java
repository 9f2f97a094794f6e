package com.pipeduck.expression;

import com.pipeduck.generator.SQLQuoting;
import com.pipeduck.types.DataType;
import java.util.Objects;

/**
 * Expression representing a resolved reference to a column.
 *
 * <p>Column references can be:
 * <ul>
 *   <li>Simple: {@code status}</li>
 *   <li>Qualified by a table name or alias: {@code c.c_custkey}</li>
 *   <li>Outer: a reference from inside a subquery to a column of the enclosing
 *       query (a correlated reference)</li>
 * </ul>
 */
public final class ColumnReference implements Expression {

    private final String columnName;
    private final String qualifier; // Optional table/alias qualifier
    private final DataType dataType;
    private final boolean nullable;
    private final boolean outer;

    /**
     * Creates a column reference.
     *
     * @param columnName the column name
     * @param qualifier the table or alias qualifier (may be null)
     * @param dataType the data type of the column
     * @param nullable whether the column is nullable
     * @param outer whether the column belongs to an enclosing query
     */
    public ColumnReference(String columnName, String qualifier, DataType dataType,
                           boolean nullable, boolean outer) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.qualifier = qualifier;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
        this.outer = outer;
    }

    public ColumnReference(String columnName, String qualifier, DataType dataType, boolean nullable) {
        this(columnName, qualifier, dataType, nullable, false);
    }

    public ColumnReference(String columnName, DataType dataType) {
        this(columnName, null, dataType, true, false);
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Returns the qualifier (table or alias).
     *
     * @return the qualifier, or null if not qualified
     */
    public String qualifier() {
        return qualifier;
    }

    /**
     * Returns whether this reference points into an enclosing query.
     */
    public boolean isOuter() {
        return outer;
    }

    /**
     * Returns the fully qualified column name.
     *
     * @return the qualified name (e.g., "orders.status" or just "status")
     */
    public String qualifiedName() {
        if (qualifier != null) {
            return qualifier + "." + columnName;
        }
        return columnName;
    }

    /**
     * Returns this reference marked as an outer (correlated) reference.
     */
    public ColumnReference asOuter() {
        return outer ? this : new ColumnReference(columnName, qualifier, dataType, nullable, true);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toSQL() {
        if (qualifier != null) {
            return SQLQuoting.quoteIdentifierIfNeeded(qualifier) + "." +
                   SQLQuoting.quoteIdentifierIfNeeded(columnName);
        }
        return SQLQuoting.quoteIdentifierIfNeeded(columnName);
    }

    @Override
    public String toString() {
        return outer ? "outer(" + qualifiedName() + ")" : qualifiedName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return nullable == that.nullable &&
               outer == that.outer &&
               Objects.equals(columnName, that.columnName) &&
               Objects.equals(qualifier, that.qualifier) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, qualifier, dataType, nullable, outer);
    }

    // ==================== Factory Methods ====================

    public static ColumnReference qualified(String qualifier, String columnName, DataType dataType) {
        return new ColumnReference(columnName, qualifier, dataType, true);
    }
}
