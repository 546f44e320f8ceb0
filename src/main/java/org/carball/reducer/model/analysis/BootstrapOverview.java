package org.carball.reducer.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Row count and, when one of the usual time columns holds values, its time range.
 */
public record BootstrapOverview(
        @JsonProperty("row_count") long rowCount,
        @JsonProperty("time_column") String timeColumn,
        @JsonProperty("time_range") TimeRange timeRange
) {

    public record TimeRange(String min, String max) {}
}
