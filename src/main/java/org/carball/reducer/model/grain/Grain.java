package org.carball.reducer.model.grain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * The granularity one dataset row can represent, with the column whose presence marks it.
 */
@Getter
public enum Grain {
    ORDER("order", "order_id"),
    ITEM("item", "product_id"),
    MEMBER("member", "member_id");

    private final String key;
    private final String markerColumn;

    Grain(String key, String markerColumn) {
        this.key = key;
        this.markerColumn = markerColumn;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public static Grain fromKey(String key) {
        for (Grain grain : values()) {
            if (grain.key.equalsIgnoreCase(key)) {
                return grain;
            }
        }
        throw new IllegalArgumentException("Unknown grain: " + key);
    }
}
