package org.carball.reducer.model.filter;

/**
 * How compiled clauses are combined.
 */
public enum FilterLogic {
    AND(" AND "),
    OR(" OR ");

    private final String joiner;

    FilterLogic(String joiner) {
        this.joiner = joiner;
    }

    public String joiner() {
        return joiner;
    }

    /**
     * Anything other than {@code OR} (case-insensitive) means {@code AND}; so does null.
     */
    public static FilterLogic fromString(String logic) {
        if (logic != null && logic.trim().equalsIgnoreCase("OR")) {
            return OR;
        }
        return AND;
    }
}
