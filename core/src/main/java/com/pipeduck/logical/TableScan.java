package com.pipeduck.logical;

import com.pipeduck.generator.SQLQuoting;
import com.pipeduck.types.StructType;
import java.util.Objects;

/**
 * Logical plan node representing a scan of a catalog table, the plan of a
 * {@code source = <table>} command.
 *
 * <p>The schema is the one the catalog resolved for the table.
 *
 * <p>SQL generation:
 * <pre>SELECT * FROM table</pre>
 */
public final class TableScan extends LogicalPlan {

    private final String tableName;
    private final StructType tableSchema;

    public TableScan(String tableName, StructType tableSchema) {
        super();
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.tableSchema = Objects.requireNonNull(tableSchema, "tableSchema must not be null");
        if (tableName.isEmpty()) {
            throw new IllegalArgumentException("tableName must not be empty");
        }
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Returns the last part of the table name: {@code orders} for {@code sales.orders}.
     */
    @Override
    public String relationQualifier() {
        int dot = tableName.lastIndexOf('.');
        return dot < 0 ? tableName : tableName.substring(dot + 1);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        return "SELECT * FROM " + SQLQuoting.quoteTableName(tableName);
    }

    @Override
    protected StructType inferSchema() {
        return tableSchema;
    }

    @Override
    public String toString() {
        return String.format("TableScan(%s)", tableName);
    }
}
