package org.carball.reducer.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.reducer.model.grain.BlacklistFinding;

import java.util.List;

public record AnalysisOutcome(
        @JsonProperty("dataset_id") String datasetId,
        String analysis,
        String metric,
        String dimension,
        Granularity granularity,
        Integer limit,
        List<AnalysisPoint> items,
        List<BlacklistFinding> warnings
) {}
