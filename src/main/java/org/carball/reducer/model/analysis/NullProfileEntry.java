package org.carball.reducer.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NullProfileEntry(
        String column,
        @JsonProperty("null_count") long nullCount,
        @JsonProperty("null_ratio") Double nullRatio
) {}
