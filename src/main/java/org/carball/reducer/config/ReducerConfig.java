package org.carball.reducer.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class ReducerConfig {

    // Storage
    @Builder.Default
    private String inputDirectory = "data/input";

    @Builder.Default
    private String outputDirectory = "data/output";

    // Engine
    @Builder.Default
    private String jdbcUrl = "jdbc:duckdb:";

    @Builder.Default
    private int queryTimeoutSeconds = 30;

    @Builder.Default
    private boolean ignoreCsvErrors = true;

    // Limits
    @Builder.Default
    private int bootstrapSampleRows = 100;

    @Builder.Default
    private int previewRowLimit = 200;

    @Builder.Default
    private int distinctValueLimit = 200;

    @Builder.Default
    private int maxErrorMessageLength = 300;

    public static ReducerConfig defaults() {
        return ReducerConfig.builder().build();
    }

    /**
     * Logs warnings for values that will not work well; never rejects the configuration.
     */
    public void validate() {
        if (queryTimeoutSeconds <= 0) {
            log.warn("Query timeout ({}) is not positive; queries will run without a time limit", queryTimeoutSeconds);
        }

        if (previewRowLimit < 10 || previewRowLimit > 1000) {
            log.warn("Preview row limit ({}) should be between 10 and 1000", previewRowLimit);
        }

        if (distinctValueLimit < 1 || distinctValueLimit > 1000) {
            log.warn("Distinct value limit ({}) should be between 1 and 1000", distinctValueLimit);
        }

        if (bootstrapSampleRows <= 0) {
            log.warn("Bootstrap sample rows ({}) should be positive", bootstrapSampleRows);
        }

        if (inputDirectory.equals(outputDirectory)) {
            log.warn("Input and output directories are the same ({}); exports will sit next to uploads", inputDirectory);
        }

        log.debug("Using storage input={}, output={}, timeout={}s", inputDirectory, outputDirectory, queryTimeoutSeconds);
    }

    public String getConfigurationSummary() {
        return String.format("Input: %s | Output: %s | Timeout: %ds | Preview rows: %d | Distinct values: %d",
                inputDirectory, outputDirectory, queryTimeoutSeconds, previewRowLimit, distinctValueLimit);
    }
}
