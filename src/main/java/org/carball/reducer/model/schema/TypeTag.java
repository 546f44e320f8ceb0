package org.carball.reducer.model.schema;

import java.util.Locale;

/**
 * Engine-neutral classification of a column's declared type.
 */
public enum TypeTag {
    INTEGER,
    FLOAT,
    BOOLEAN,
    STRING,
    TIMESTAMP,
    UNKNOWN;

    /**
     * Maps a DuckDB type name (as reported by {@code DESCRIBE}) to a tag.
     */
    public static TypeTag fromEngineType(String engineType) {
        if (engineType == null || engineType.isBlank()) {
            return UNKNOWN;
        }
        String type = engineType.trim().toUpperCase(Locale.ROOT);

        if (type.startsWith("DECIMAL") || type.startsWith("NUMERIC")) {
            return FLOAT;
        }
        if (type.startsWith("TIMESTAMP") || type.equals("DATE") || type.startsWith("TIME")) {
            return TIMESTAMP;
        }

        switch (type) {
            case "BIGINT":
            case "INTEGER":
            case "INT":
            case "SMALLINT":
            case "TINYINT":
            case "HUGEINT":
            case "UBIGINT":
            case "UINTEGER":
            case "USMALLINT":
            case "UTINYINT":
            case "UHUGEINT":
                return INTEGER;
            case "DOUBLE":
            case "FLOAT":
            case "REAL":
                return FLOAT;
            case "BOOLEAN":
            case "BOOL":
                return BOOLEAN;
            case "VARCHAR":
            case "TEXT":
            case "STRING":
                return STRING;
            default:
                return UNKNOWN;
        }
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
