package org.carball.reducer.model.execution;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Non-throwing preview outcome for callers that render errors next to the filter form.
 */
public record PreviewReport(
        boolean ok,
        @JsonProperty("matched_rows") Long matchedRows,
        @JsonProperty("elapsed_ms") long elapsedMs,
        String error
) {

    public static PreviewReport success(PreviewResult result) {
        return new PreviewReport(true, result.matchedRows(), result.elapsedMs(), null);
    }

    public static PreviewReport failure(String error, long elapsedMs) {
        return new PreviewReport(false, null, elapsedMs, error);
    }
}
