package org.carball.reducer.model.analysis;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AnalysisRequest {

    private SafeAnalysis analysis;

    @Builder.Default
    private Granularity granularity = Granularity.DAY;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;

    public static final int DEFAULT_LIMIT = 10;

    /**
     * Ranking limit, falling back to the default when the caller sent zero or less.
     */
    public int effectiveLimit() {
        return limit <= 0 ? DEFAULT_LIMIT : limit;
    }
}
