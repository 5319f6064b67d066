package com.tributary.util;

/**
 * Utilities for safely quoting SQL identifiers, literals and file paths
 * before they are spliced into DuckDB queries.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("users");          // "users"
 *   SQLQuoting.quoteLiteral("O'Reilly");          // 'O''Reilly'
 *   SQLQuoting.quoteFilePath("/data/a.parquet");  // '/data/a.parquet'
 * </pre>
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /**
     * Quotes an identifier (table or column name) with double quotes,
     * doubling any embedded double quotes.
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
     * Quotes a string literal, or returns NULL for a null value.
     *
     * @param value the string value to quote
     * @return quoted literal, or NULL
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Quotes a file path for DuckDB table functions such as read_parquet.
     *
     * @param path the file path to quote
     * @return quoted path
     * @throws IllegalArgumentException if path is null, empty, or contains
     *         statement separators or comment markers
     */
    public static String quoteFilePath(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("File path cannot be null or empty");
        }
        if (path.contains(";") || path.contains("--") ||
            path.contains("/*") || path.contains("*/")) {
            throw new IllegalArgumentException(
                "Invalid characters in file path (possible SQL injection): " + path);
        }
        return quoteLiteral(path);
    }
}
