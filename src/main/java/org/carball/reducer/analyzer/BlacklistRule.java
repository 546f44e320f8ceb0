package org.carball.reducer.analyzer;

import org.carball.reducer.model.grain.BlacklistFinding;
import org.carball.reducer.model.grain.Grain;
import org.carball.reducer.model.grain.Severity;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One condition-to-finding mapping of the blacklist table.
 *
 * @param grain   the grain the finding is reported for; null for all grains
 * @param metrics resolves the metric columns concerned from the schema
 */
public record BlacklistRule(
        String name,
        Predicate<SchemaContext> condition,
        Grain grain,
        Function<SchemaContext, List<String>> metrics,
        String reason,
        Severity severity
) {

    public static BlacklistRule of(String name, Predicate<SchemaContext> condition, Grain grain,
                                   String metric, String reason, Severity severity) {
        return new BlacklistRule(name, condition, grain, ctx -> List.of(metric), reason, severity);
    }

    public Optional<BlacklistFinding> evaluate(SchemaContext context) {
        if (!condition.test(context)) {
            return Optional.empty();
        }
        return Optional.of(BlacklistFinding.of(grain, metrics.apply(context), reason, severity));
    }
}
