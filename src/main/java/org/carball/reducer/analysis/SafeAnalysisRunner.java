package org.carball.reducer.analysis;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.analyzer.AnalysisGate;
import org.carball.reducer.analyzer.BlacklistDeriver;
import org.carball.reducer.analyzer.GrainDetector;
import org.carball.reducer.engine.QueryEngine;
import org.carball.reducer.engine.SelectStatement;
import org.carball.reducer.exception.AnalysisBlockedException;
import org.carball.reducer.exception.ExecutionFailedException;
import org.carball.reducer.exception.UnknownColumnException;
import org.carball.reducer.executor.ErrorSanitizer;
import org.carball.reducer.model.analysis.AnalysisOutcome;
import org.carball.reducer.model.analysis.AnalysisPoint;
import org.carball.reducer.model.analysis.AnalysisRequest;
import org.carball.reducer.model.analysis.GateDecision;
import org.carball.reducer.model.analysis.Granularity;
import org.carball.reducer.model.analysis.SafeAnalysis;
import org.carball.reducer.model.filter.CompiledPredicate;
import org.carball.reducer.model.grain.BlacklistFinding;
import org.carball.reducer.model.grain.Grain;
import org.carball.reducer.model.schema.ColumnDescriptor;
import org.carball.reducer.model.schema.DatasetHandle;

import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.carball.reducer.engine.SqlDialect.quoteIdentifier;

/**
 * Runs the fixed analysis catalog. Every analysis is checked against the dataset's blacklist
 * first and refused when its metric is blocked at its grain; statements are built only from
 * the catalog's own column names.
 */
@Slf4j
public class SafeAnalysisRunner {

    private final QueryEngine engine;
    private final GrainDetector grainDetector;
    private final BlacklistDeriver blacklistDeriver;
    private final AnalysisGate gate;
    private final ErrorSanitizer sanitizer;

    public SafeAnalysisRunner(QueryEngine engine) {
        this(engine, new GrainDetector(), new BlacklistDeriver(), new AnalysisGate(), new ErrorSanitizer());
    }

    public SafeAnalysisRunner(QueryEngine engine, GrainDetector grainDetector, BlacklistDeriver blacklistDeriver,
                              AnalysisGate gate, ErrorSanitizer sanitizer) {
        this.engine = engine;
        this.grainDetector = grainDetector;
        this.blacklistDeriver = blacklistDeriver;
        this.gate = gate;
        this.sanitizer = sanitizer;
    }

    public AnalysisOutcome run(DatasetHandle handle, List<ColumnDescriptor> columns, AnalysisRequest request)
            throws ExecutionFailedException {
        SafeAnalysis analysis = request.getAnalysis();
        if (analysis == null) {
            throw new IllegalArgumentException("analysis is required");
        }

        for (String required : analysis.getRequiredColumns()) {
            if (!ColumnDescriptor.containsColumn(columns, required)) {
                throw new UnknownColumnException(required);
            }
        }

        Set<Grain> grains = grainDetector.detect(columns);
        List<BlacklistFinding> findings = blacklistDeriver.derive(grains, columns);
        GateDecision decision = gate.evaluate(findings, analysis.getGrain(), analysis.getMetric());
        if (!decision.allowed()) {
            throw new AnalysisBlockedException(analysis.getKey(), decision.blocking());
        }

        log.info("Running analysis {} on dataset {}", analysis.getKey(), handle.datasetId());
        try {
            List<AnalysisPoint> items = engine.select(handle, statementFor(request), cursor -> {
                List<AnalysisPoint> points = new ArrayList<>();
                while (cursor.next()) {
                    points.add(new AnalysisPoint(cursor.get(0), cursor.get(1)));
                }
                return points;
            });

            if (analysis == SafeAnalysis.NEW_VS_RETURNING) {
                items = fillCustomerTypes(items);
            }

            return new AnalysisOutcome(
                    handle.datasetId(),
                    analysis.getKey(),
                    analysis.getMetric(),
                    analysis.getDimension(),
                    analysis.isTimeSeries() ? request.getGranularity() : null,
                    analysis.isRanking() ? request.effectiveLimit() : null,
                    items,
                    decision.warnings()
            );
        } catch (SQLException | IOException e) {
            String message = sanitizer.sanitize(e.getMessage(), handle);
            log.warn("Analysis {} on dataset {} failed: {}", analysis.getKey(), handle.datasetId(), message);
            throw new ExecutionFailedException(handle.datasetId(), message, e);
        }
    }

    /**
     * Groups and orders by output position so that a dataset column named like an alias
     * never shadows it.
     */
    static SelectStatement statementFor(AnalysisRequest request) {
        SafeAnalysis analysis = request.getAnalysis();
        switch (analysis) {
            case TIME_TREND:
                return timeSeries(request.getGranularity(),
                        "SUM(" + quoteIdentifier("order_total_amount") + ")");
            case AOV:
                return timeSeries(request.getGranularity(),
                        "SUM(" + quoteIdentifier("order_total_amount") + ") * 1.0 / COUNT(DISTINCT "
                                + quoteIdentifier("order_id") + ")");
            case TOP_PRODUCTS:
                return ranking("product_name", "item_subtotal", request.effectiveLimit());
            case TOP_MEMBERS:
                return ranking("member_id", "order_total_amount", request.effectiveLimit());
            case NEW_VS_RETURNING:
                return SelectStatement.builder()
                        .projection("CASE WHEN " + quoteIdentifier("first_purchase_flag")
                                + " THEN 'new' ELSE 'returning' END AS \"customer_type\", COUNT(DISTINCT "
                                + quoteIdentifier("order_id") + ") AS \"value\"")
                        .groupBy("1")
                        .build();
            default:
                throw new IllegalArgumentException("Unsupported analysis: " + analysis);
        }
    }

    private static SelectStatement timeSeries(Granularity granularity, String valueExpression) {
        Granularity bucket = granularity == null ? Granularity.DAY : granularity;
        return SelectStatement.builder()
                .projection("strftime(date_trunc('" + bucket.part() + "', CAST("
                        + quoteIdentifier("purchase_time") + " AS TIMESTAMP)), '" + bucket.pattern()
                        + "') AS \"time\", " + valueExpression + " AS \"value\"")
                .groupBy("1")
                .orderBy("1")
                .build();
    }

    private static SelectStatement ranking(String dimension, String metric, int limit) {
        return SelectStatement.builder()
                .projection(quoteIdentifier(dimension) + " AS \"key\", SUM(" + quoteIdentifier(metric) + ") AS \"value\"")
                .predicate(new CompiledPredicate(quoteIdentifier(dimension) + " IS NOT NULL", List.of()))
                .groupBy(quoteIdentifier(dimension))
                .orderBy("2 DESC, 1")
                .limit(limit)
                .build();
    }

    private static List<AnalysisPoint> fillCustomerTypes(List<AnalysisPoint> points) {
        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("new", 0L);
        counts.put("returning", 0L);
        for (AnalysisPoint point : points) {
            counts.put(String.valueOf(point.key()), point.value());
        }

        List<AnalysisPoint> filled = new ArrayList<>();
        counts.forEach((key, value) -> filled.add(new AnalysisPoint(key, value)));
        return filled;
    }
}
