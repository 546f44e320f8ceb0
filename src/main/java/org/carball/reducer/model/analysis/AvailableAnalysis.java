package org.carball.reducer.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Analysis families a dataset can support, inferred from the columns it carries.
 */
@Getter
public enum AvailableAnalysis {
    TOTAL_AMOUNT_BY_DIMENSION("total_amount_by_dimension", "order_total_amount"),
    TIME_SERIES_TREND("time_series_trend", "purchase_time"),
    MEMBER_RANKING("member_ranking", "member_id");

    private final String key;
    private final String requiredColumn;

    AvailableAnalysis(String key, String requiredColumn) {
        this.key = key;
        this.requiredColumn = requiredColumn;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
