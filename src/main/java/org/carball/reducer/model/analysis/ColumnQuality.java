package org.carball.reducer.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Null ratio of a column, plus basic statistics when the column is numeric.
 */
public record ColumnQuality(
        @JsonProperty("null_ratio") Double nullRatio,
        Object min,
        Object max,
        Double avg,
        Double stddev
) {

    public static ColumnQuality nullRatioOnly(Double nullRatio) {
        return new ColumnQuality(nullRatio, null, null, null, null);
    }
}
