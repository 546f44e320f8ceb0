package org.carball.reducer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.model.analysis.GateDecision;
import org.carball.reducer.model.grain.BlacklistFinding;
import org.carball.reducer.model.grain.Grain;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a requested grain/metric combination against blacklist findings.
 * Callers must refuse the request when the decision is not allowed.
 */
@Slf4j
public class AnalysisGate {

    public GateDecision evaluate(List<BlacklistFinding> findings, Grain grain, String metric) {
        List<BlacklistFinding> blocking = new ArrayList<>();
        List<BlacklistFinding> warnings = new ArrayList<>();

        for (BlacklistFinding finding : findings) {
            if (!finding.concerns(metric) || !finding.appliesTo(grain)) {
                continue;
            }
            if (finding.isBlocking()) {
                blocking.add(finding);
            } else {
                warnings.add(finding);
            }
        }

        if (!blocking.isEmpty()) {
            log.warn("Blocked metric {} at grain {}: {} blocking findings", metric, grain, blocking.size());
        }
        return new GateDecision(grain, metric, blocking, warnings);
    }
}
