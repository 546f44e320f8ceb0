package org.carball.reducer.exception;

import lombok.Getter;
import org.carball.reducer.model.grain.BlacklistFinding;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by the analysis layer when a requested metric/grain combination is blacklisted
 * with block severity.
 */
@Getter
public class AnalysisBlockedException extends RuntimeException {

    private final List<BlacklistFinding> findings;

    public AnalysisBlockedException(String analysis, List<BlacklistFinding> findings) {
        super("Analysis " + analysis + " is blocked: " + findings.stream()
                .map(BlacklistFinding::reason)
                .collect(Collectors.joining("; ")));
        this.findings = List.copyOf(findings);
    }
}
