package org.carball.reducer.model.grain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A metric/grain combination that is wrong ({@link Severity#BLOCK}) or risky
 * ({@link Severity#WARNING}) for the inspected dataset.
 *
 * @param grain   the grain key the finding applies to, or {@value #ALL_GRAINS}
 * @param metrics the metric columns concerned; a single metric is written to JSON as a plain string
 */
@JsonPropertyOrder({"grain", "metric", "reason", "severity"})
public record BlacklistFinding(
        String grain,
        @JsonProperty("metric")
        @JsonFormat(with = JsonFormat.Feature.WRITE_SINGLE_ELEM_ARRAYS_UNWRAPPED)
        List<String> metrics,
        String reason,
        Severity severity
) {

    public static final String ALL_GRAINS = "all";

    public BlacklistFinding {
        metrics = List.copyOf(metrics);
    }

    public static BlacklistFinding of(Grain grain, List<String> metrics, String reason, Severity severity) {
        return new BlacklistFinding(grain == null ? ALL_GRAINS : grain.getKey(), metrics, reason, severity);
    }

    @JsonIgnore
    public boolean isBlocking() {
        return severity == Severity.BLOCK;
    }

    public boolean appliesToAllGrains() {
        return ALL_GRAINS.equals(grain);
    }

    public boolean appliesTo(Grain target) {
        return appliesToAllGrains() || (target != null && target.getKey().equals(grain));
    }

    public boolean concerns(String metric) {
        return metrics.contains(metric);
    }
}
