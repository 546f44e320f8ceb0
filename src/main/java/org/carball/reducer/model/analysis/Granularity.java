package org.carball.reducer.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Granularity {
    DAY("day", "%Y-%m-%d"),
    MONTH("month", "%Y-%m");

    private final String part;
    private final String pattern;

    Granularity(String part, String pattern) {
        this.part = part;
        this.pattern = pattern;
    }

    @JsonValue
    public String part() {
        return part;
    }

    /** strftime pattern used to label a bucket. */
    public String pattern() {
        return pattern;
    }

    public static Granularity fromString(String value) {
        if (value == null) {
            return DAY;
        }
        for (Granularity candidate : values()) {
            if (candidate.part.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("granularity must be 'day' or 'month'");
    }
}
