package org.carball.reducer.model.filter;

import lombok.Getter;
import org.carball.reducer.exception.UnsupportedOperatorException;

import java.util.Locale;

@Getter
public enum FilterOperator {
    EQ("eq", "="),
    NE("ne", "!="),
    GT("gt", ">"),
    GE("ge", ">="),
    LT("lt", "<"),
    LE("le", "<="),
    CONTAINS("contains", null),
    BETWEEN("between", null),
    IN("in", null);

    private final String key;
    private final String symbol;

    FilterOperator(String key, String symbol) {
        this.key = key;
        this.symbol = symbol;
    }

    /**
     * Comparison operators take exactly one scalar operand.
     */
    public boolean isComparison() {
        return symbol != null;
    }

    public boolean takesScalar() {
        return this != BETWEEN && this != IN;
    }

    /**
     * Accepts the operator key ({@code ge}) or its comparison symbol ({@code >=}), case-insensitive.
     */
    public static FilterOperator fromString(String operator) {
        if (operator == null) {
            throw new UnsupportedOperatorException(null);
        }
        String normalized = operator.trim().toLowerCase(Locale.ROOT);
        if ("<>".equals(normalized)) {
            return NE;
        }
        for (FilterOperator candidate : values()) {
            if (candidate.key.equals(normalized) || normalized.equals(candidate.symbol)) {
                return candidate;
            }
        }
        throw new UnsupportedOperatorException(operator);
    }
}
