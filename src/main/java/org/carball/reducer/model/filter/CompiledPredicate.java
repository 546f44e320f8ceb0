package org.carball.reducer.model.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A filter clause made only of quoted identifiers, keywords and {@code ?} placeholders,
 * together with the values bound to those placeholders in order.
 */
public record CompiledPredicate(String clauseTemplate, List<Object> parameters) {

    private static final CompiledPredicate UNCONDITIONAL = new CompiledPredicate("", List.of());

    public CompiledPredicate {
        clauseTemplate = clauseTemplate == null ? "" : clauseTemplate;
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters == null ? List.of() : parameters));
    }

    /**
     * The always-true predicate: no WHERE filtering at all.
     */
    public static CompiledPredicate unconditional() {
        return UNCONDITIONAL;
    }

    public boolean isUnconditional() {
        return clauseTemplate.isBlank();
    }

    /**
     * Returns {@code " WHERE <clause>"}, or an empty string for the unconditional predicate.
     */
    public String whereClause() {
        return isUnconditional() ? "" : " WHERE " + clauseTemplate;
    }
}
