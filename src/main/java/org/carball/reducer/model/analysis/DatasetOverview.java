package org.carball.reducer.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.reducer.model.schema.TypeTag;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Scale and quality signals of a dataset. Counts are null when the dataset has no column
 * to derive them from.
 */
public record DatasetOverview(
        @JsonProperty("dataset_id") String datasetId,
        @JsonProperty("row_count") long rowCount,
        @JsonProperty("column_count") int columnCount,
        @JsonProperty("file_size_bytes") Long fileSizeBytes,
        @JsonProperty("column_type_summary") Map<TypeTag, Long> columnTypeSummary,
        @JsonProperty("missing_value_top_columns") Map<String, Double> missingValueTopColumns,
        @JsonProperty("order_count") Long orderCount,
        @JsonProperty("order_item_count") Long orderItemCount,
        @JsonProperty("member_count") Long memberCount,
        @JsonProperty("product_count") Long productCount,
        @JsonProperty("datetime_columns") List<String> datetimeColumns,
        @JsonProperty("date_range") Map<String, DateRange> dateRange,
        @JsonProperty("generated_at") Instant generatedAt
) {

    public record DateRange(String start, String end) {}
}
