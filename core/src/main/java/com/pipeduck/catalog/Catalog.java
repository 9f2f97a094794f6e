package com.pipeduck.catalog;

import com.pipeduck.types.DataType;
import com.pipeduck.types.StructField;
import com.pipeduck.types.StructType;

import java.util.Optional;

/**
 * Table and column metadata consulted by the PPL analyzer.
 *
 * <p>Calls are synchronous. An implementation that cannot answer (backend unavailable,
 * malformed metadata) throws; the analyzer reports any such failure as an
 * {@link com.pipeduck.exception.AnalysisException}. Caching, if any, belongs to the
 * implementation.
 */
public interface Catalog {

    /**
     * Resolves a table reference to its schema.
     *
     * @param name the table name as written, possibly dotted ({@code db.orders})
     * @return the schema, or empty if the table does not exist
     */
    Optional<StructType> resolveTable(String name);

    /**
     * Resolves a column name within a schema. A dotted name descends into nested structs
     * ({@code address.city}).
     *
     * @param scope the schema to search
     * @param name the column name
     * @return the column type, or empty if there is no such column
     */
    default Optional<DataType> resolveColumn(StructType scope, String name) {
        StructField direct = scope.fieldByName(name);
        if (direct != null) {
            return Optional.of(direct.dataType());
        }
        String[] parts = name.split("\\.");
        DataType current = scope;
        for (String part : parts) {
            if (!(current instanceof StructType struct)) {
                return Optional.empty();
            }
            StructField field = struct.fieldByName(part);
            if (field == null) {
                return Optional.empty();
            }
            current = field.dataType();
        }
        return Optional.of(current);
    }
}
