package org.carball.reducer.model.analysis;

import java.util.List;
import java.util.Map;

/**
 * Per-column quality, distinct counts and null counts, all keyed in schema order.
 * Ratios are null for an empty dataset.
 */
public record ColumnProfile(
        Map<String, ColumnQuality> dataQuality,
        Map<String, Long> uniqueness,
        List<NullProfileEntry> nullProfile
) {}
