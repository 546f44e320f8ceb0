package org.carball.reducer.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.reducer.model.grain.BlacklistFinding;
import org.carball.reducer.model.grain.Grain;
import org.carball.reducer.model.schema.ColumnDescriptor;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the analysis selection screen needs after an upload.
 */
public record BootstrapReport(
        @JsonProperty("dataset_id") String datasetId,
        BootstrapOverview overview,
        List<ColumnDescriptor> schema,
        List<Map<String, Object>> preview,
        Set<Grain> grains,
        @JsonProperty("available_analyses") List<AvailableAnalysis> availableAnalyses,
        @JsonProperty("data_quality") Map<String, ColumnQuality> dataQuality,
        Map<String, Long> uniqueness,
        @JsonProperty("null_profile") List<NullProfileEntry> nullProfile,
        List<BlacklistFinding> blacklist
) {}
