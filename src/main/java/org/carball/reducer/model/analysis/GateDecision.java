package org.carball.reducer.model.analysis;

import org.carball.reducer.model.grain.BlacklistFinding;
import org.carball.reducer.model.grain.Grain;

import java.util.List;

/**
 * Verdict of the blacklist gate for one grain/metric combination.
 */
public record GateDecision(Grain grain, String metric, List<BlacklistFinding> blocking, List<BlacklistFinding> warnings) {

    public GateDecision {
        blocking = List.copyOf(blocking);
        warnings = List.copyOf(warnings);
    }

    public boolean allowed() {
        return blocking.isEmpty();
    }
}
