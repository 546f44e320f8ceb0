package org.carball.reducer.model.analysis;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import org.carball.reducer.model.grain.Grain;

import java.util.List;

/**
 * The fixed catalog of analyses a caller may run. Each one sums or counts a single metric
 * at a declared grain, which is what the blacklist gate is consulted with.
 */
@Getter
@JsonFormat(shape = JsonFormat.Shape.OBJECT)
@JsonIgnoreProperties({"declaringClass", "timeSeries", "ranking"})
public enum SafeAnalysis {
    TIME_TREND("time_trend", "Sales trend over time",
            "Sums order amounts by day or month to show the sales trend.", "line",
            Grain.ORDER, "order_total_amount", "purchase_time",
            List.of("purchase_time", "order_total_amount")),
    TOP_PRODUCTS("top_products", "Top products",
            "Sums item subtotals by product name and lists the best sellers.", "bar",
            Grain.ITEM, "item_subtotal", "product_name",
            List.of("product_name", "item_subtotal")),
    TOP_MEMBERS("top_members", "Top members",
            "Sums order amounts by member to find the highest contributing customers.", "bar",
            Grain.MEMBER, "order_total_amount", "member_id",
            List.of("member_id", "order_total_amount")),
    AOV("aov", "Average order value",
            "Average spend per order, by day or month.", "line",
            Grain.ORDER, "order_total_amount", "purchase_time",
            List.of("purchase_time", "order_total_amount", "order_id")),
    NEW_VS_RETURNING("new_vs_returning", "New vs returning customers",
            "Compares the number of orders placed by first-time and returning customers.", "pie",
            Grain.ORDER, "order_id", "customer_type",
            List.of("first_purchase_flag", "order_id"));

    private final String key;
    private final String label;
    private final String description;
    private final String chart;
    private final Grain grain;
    private final String metric;
    private final String dimension;
    private final List<String> requiredColumns;

    SafeAnalysis(String key, String label, String description, String chart,
                 Grain grain, String metric, String dimension, List<String> requiredColumns) {
        this.key = key;
        this.label = label;
        this.description = description;
        this.chart = chart;
        this.grain = grain;
        this.metric = metric;
        this.dimension = dimension;
        this.requiredColumns = requiredColumns;
    }

    public boolean isTimeSeries() {
        return this == TIME_TREND || this == AOV;
    }

    public boolean isRanking() {
        return this == TOP_PRODUCTS || this == TOP_MEMBERS;
    }

    public static SafeAnalysis fromKey(String key) {
        for (SafeAnalysis analysis : values()) {
            if (analysis.key.equalsIgnoreCase(key) || analysis.name().equalsIgnoreCase(key)) {
                return analysis;
            }
        }
        throw new IllegalArgumentException("Unknown analysis: " + key);
    }
}
