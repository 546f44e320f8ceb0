package org.carball.reducer.model.grain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    /** The analysis must be prevented. */
    BLOCK,
    /** The analysis may proceed but the risk must be surfaced. */
    WARNING;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
