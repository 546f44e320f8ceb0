package org.carball.reducer.engine;

import java.nio.file.Path;

/**
 * Quoting rules of the query engine. Identifiers are the only user-influenced text that ever
 * becomes part of a statement, and only through {@link #quoteIdentifier(String)}.
 */
public final class SqlDialect {

    private SqlDialect() {
        // Utility class - prevent instantiation
    }

    /**
     * Wraps an identifier in double quotes, doubling any embedded double quote.
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        if (identifier.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Identifier must not contain NUL characters");
        }
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /**
     * Quotes a string literal. Only used for server-side storage paths, never for user values.
     */
    static String quoteLiteral(String value) {
        return '\'' + value.replace("'", "''") + '\'';
    }

    /**
     * The table function that reads a canonical CSV dataset file.
     */
    static String csvSource(Path path, boolean ignoreErrors) {
        return "read_csv_auto(" + quoteLiteral(path.toAbsolutePath().toString())
                + ", header = true"
                + (ignoreErrors ? ", ignore_errors = true" : "")
                + ")";
    }
}
