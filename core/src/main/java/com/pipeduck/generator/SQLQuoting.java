package com.pipeduck.generator;

import java.util.Locale;
import java.util.Set;

/**
 * Utilities for quoting Spark SQL identifiers and literals.
 *
 * <p>Identifiers are quoted with backticks, literals with single quotes; embedded
 * quote characters are doubled.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("order")         // `order`
 *   SQLQuoting.quoteIdentifierIfNeeded("region") // region
 *   SQLQuoting.quoteLiteral("O'Reilly")         // 'O''Reilly'
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private static final Set<String> RESERVED_WORDS = Set.of(
        "SELECT", "FROM", "WHERE", "GROUP", "BY", "ORDER", "HAVING", "JOIN", "LEFT", "RIGHT",
        "INNER", "OUTER", "FULL", "CROSS", "SEMI", "ANTI", "ON", "USING", "AS", "AND", "OR",
        "NOT", "IN", "EXISTS", "CASE", "WHEN", "THEN", "ELSE", "END", "NULL", "TRUE", "FALSE",
        "UNION", "INTERSECT", "EXCEPT", "LIMIT", "OFFSET", "ALL", "DISTINCT", "IS", "BETWEEN",
        "LIKE", "ASC", "DESC", "NULLS", "FIRST", "LAST", "INTERVAL", "DATE", "TIMESTAMP");

    private SQLQuoting() {}

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * @param identifier the identifier to quote
     * @return quoted identifier
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "`" + identifier.replace("`", "``") + "`";
    }

    /**
     * Quotes an identifier only if it is not a plain name: it starts with a digit,
     * contains anything other than letters, digits and underscores, or is a
     * reserved word.
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return needsQuoting(identifier) ? quoteIdentifier(identifier) : identifier;
    }

    /**
     * Quotes a table name. Dotted names ({@code catalog.db.table}) are quoted per part.
     *
     * @throws IllegalArgumentException if the name is null or has an empty part
     */
    public static String quoteTableName(String tableName) {
        if (tableName == null) {
            throw new IllegalArgumentException("Table name cannot be null");
        }
        String[] parts = tableName.split("\\.", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(quoteIdentifierIfNeeded(parts[i]));
        }
        return sb.toString();
    }

    /**
     * Quotes a string literal value; returns NULL (without quotes) for null.
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
    }

    private static boolean needsQuoting(String identifier) {
        char first = identifier.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return true;
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return true;
            }
        }
        return RESERVED_WORDS.contains(identifier.toUpperCase(Locale.ROOT));
    }
}
