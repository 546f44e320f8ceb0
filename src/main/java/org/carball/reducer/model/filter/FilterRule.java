package org.carball.reducer.model.filter;

/**
 * A single user-supplied predicate. The operator is kept as received so that the
 * compiler, not the payload parser, decides whether it is supported.
 */
public record FilterRule(String column, String operator, FilterValue value) {

    public static FilterRule of(String column, FilterOperator operator, FilterValue value) {
        return new FilterRule(column, operator.getKey(), value);
    }

    public static FilterRule of(String column, FilterOperator operator, Object scalar) {
        return new FilterRule(column, operator.getKey(), FilterValue.scalar(scalar));
    }
}
