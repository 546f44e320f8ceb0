package org.carball.reducer.model.execution;

import java.time.Duration;

/**
 * Outcome of a count-only execution.
 */
public record PreviewResult(long matchedRows, Duration elapsed) {

    public long elapsedMs() {
        return elapsed.toMillis();
    }
}
