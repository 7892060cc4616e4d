package com.datachain.generator;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utilities for safely quoting SQL identifiers and literals.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("order");          // "order"
 *   SQLQuoting.quoteIdentifierIfNeeded("orders"); // orders
 *   SQLQuoting.quoteIdentifierIfNeeded("order");  // "order"
 *   SQLQuoting.quoteLiteral("O'Reilly");          // 'O''Reilly'
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Keywords that cannot appear as bare column or table names in DuckDB.
     */
    private static final Set<String> RESERVED_WORDS = Set.of(
        "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric",
        "both", "case", "cast", "check", "collate", "column", "constraint", "create",
        "default", "deferrable", "desc", "distinct", "do", "else", "end", "except",
        "false", "fetch", "for", "foreign", "from", "grant", "group", "having", "in",
        "initially", "intersect", "into", "lateral", "leading", "limit", "not", "null",
        "offset", "on", "only", "or", "order", "pivot", "placing", "primary", "qualify",
        "references", "returning", "select", "some", "symmetric", "table", "then", "to",
        "trailing", "true", "union", "unique", "unpivot", "using", "variadic", "when",
        "where", "window", "with"
    );

    private SQLQuoting() {
    }

    /**
     * Quotes an identifier with double quotes, doubling embedded quotes.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes an identifier only when it is not a plain name or is reserved.
     *
     * @param identifier the identifier
     * @return the identifier, quoted if required
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return needsQuoting(identifier) ? quoteIdentifier(identifier) : identifier;
    }

    public static boolean needsQuoting(String identifier) {
        return !SIMPLE_IDENTIFIER.matcher(identifier).matches()
            || RESERVED_WORDS.contains(identifier.toLowerCase());
    }

    /**
     * Quotes a string literal with single quotes, doubling embedded quotes.
     * Returns {@code NULL} for a null value.
     *
     * @param value the string value
     * @return SQL literal
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }
}
