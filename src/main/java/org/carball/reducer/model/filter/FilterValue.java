package org.carball.reducer.model.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The operand of a filter rule: either a single scalar or an ordered list of scalars.
 */
public record FilterValue(Object scalar, List<Object> elements) {

    public FilterValue {
        if (elements != null) {
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }
    }

    public static FilterValue scalar(Object value) {
        return new FilterValue(value, null);
    }

    public static FilterValue list(List<?> values) {
        return new FilterValue(null, values == null ? List.of() : new ArrayList<>(values));
    }

    public static FilterValue of(Object... values) {
        return list(List.of(values));
    }

    public boolean isList() {
        return elements != null;
    }

    public int size() {
        return isList() ? elements.size() : 1;
    }

    @Override
    public String toString() {
        return isList() ? elements.toString() : String.valueOf(scalar);
    }
}
