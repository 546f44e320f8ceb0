package org.carball.reducer.analysis;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.engine.QueryEngine;
import org.carball.reducer.engine.SelectStatement;
import org.carball.reducer.exception.ExecutionFailedException;
import org.carball.reducer.executor.ErrorSanitizer;
import org.carball.reducer.model.analysis.BootstrapOverview;
import org.carball.reducer.model.analysis.BootstrapOverview.TimeRange;
import org.carball.reducer.model.analysis.ColumnProfile;
import org.carball.reducer.model.analysis.ColumnQuality;
import org.carball.reducer.model.analysis.DatasetOverview;
import org.carball.reducer.model.analysis.DatasetOverview.DateRange;
import org.carball.reducer.model.analysis.NullProfileEntry;
import org.carball.reducer.model.filter.CompiledPredicate;
import org.carball.reducer.model.schema.ColumnDescriptor;
import org.carball.reducer.model.schema.DatasetHandle;
import org.carball.reducer.model.schema.TypeTag;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.carball.reducer.engine.SqlDialect.quoteIdentifier;

/**
 * Computes dataset profiles with a handful of aggregate queries: the {@link DatasetOverview},
 * and the overview and per-column profile that go into a bootstrap report. Every statement is
 * built from schema column names and fixed candidates only.
 */
@Slf4j
public class DatasetProfiler {

    static final List<String> ORDER_ID_CANDIDATES = List.of("order_id", "order_no");
    static final List<String> MEMBER_ID_CANDIDATES = List.of("member_id");
    static final List<String> PRODUCT_ID_CANDIDATES = List.of("product_id");
    static final List<String> DATETIME_CANDIDATES = List.of(
            "purchase_time", "order_time", "created_at", "created_time", "order_date");

    static final List<String> TIME_RANGE_CANDIDATES = List.of("purchase_time", "created_at", "paid_at");

    /** Order line statuses that do not count as order items. */
    static final List<String> EXCLUDED_ITEM_STATUSES = List.of("cancel", "cancelled", "refunded");

    private static final int TOP_MISSING_COLUMNS = 5;

    private final QueryEngine engine;
    private final ErrorSanitizer sanitizer;

    public DatasetProfiler(QueryEngine engine, ErrorSanitizer sanitizer) {
        this.engine = engine;
        this.sanitizer = sanitizer;
    }

    public DatasetOverview profile(DatasetHandle handle, List<ColumnDescriptor> columns) throws ExecutionFailedException {
        log.info("Profiling dataset {}", handle.datasetId());
        try {
            long rowCount = engine.count(handle, CompiledPredicate.unconditional());
            List<Long> nonNullCounts = nonNullCounts(handle, columns);

            Optional<String> orderColumn = firstPresent(columns, ORDER_ID_CANDIDATES);
            Long orderCount = orderColumn.isPresent() ? distinctCount(handle, orderColumn.get()) : null;
            Long orderItemCount = orderColumn.isPresent() ? orderItemCount(handle, columns) : null;
            Long memberCount = countDistinctFirst(handle, columns, MEMBER_ID_CANDIDATES);
            Long productCount = countDistinctFirst(handle, columns, PRODUCT_ID_CANDIDATES);

            Map<String, DateRange> dateRange = new LinkedHashMap<>();
            for (String candidate : DATETIME_CANDIDATES) {
                if (!ColumnDescriptor.containsColumn(columns, candidate)) {
                    continue;
                }
                DateRange range = dateRange(handle, candidate);
                if (range != null) {
                    dateRange.put(candidate, range);
                    break;
                }
            }

            return new DatasetOverview(
                    handle.datasetId(),
                    rowCount,
                    columns.size(),
                    fileSize(handle),
                    typeSummary(columns),
                    topMissing(columns, nonNullCounts, rowCount),
                    orderCount,
                    orderItemCount,
                    memberCount,
                    productCount,
                    new ArrayList<>(dateRange.keySet()),
                    dateRange,
                    Instant.now()
            );
        } catch (SQLException | IOException e) {
            throw failure(handle, e);
        }
    }

    public BootstrapOverview bootstrapOverview(DatasetHandle handle, List<ColumnDescriptor> columns)
            throws ExecutionFailedException {
        try {
            long rowCount = engine.count(handle, CompiledPredicate.unconditional());
            for (String candidate : TIME_RANGE_CANDIDATES) {
                if (!ColumnDescriptor.containsColumn(columns, candidate)) {
                    continue;
                }
                String column = quoteIdentifier(candidate);
                SelectStatement statement = SelectStatement.builder()
                        .projection("MIN(" + column + "), MAX(" + column + ")")
                        .build();
                TimeRange range = engine.select(handle, statement, cursor -> {
                    if (!cursor.next() || cursor.get(0) == null) {
                        return null;
                    }
                    return new TimeRange(isoString(cursor.get(0)), isoString(cursor.get(1)));
                });
                if (range != null) {
                    return new BootstrapOverview(rowCount, candidate, range);
                }
            }
            return new BootstrapOverview(rowCount, null, null);
        } catch (SQLException | IOException e) {
            throw failure(handle, e);
        }
    }

    /**
     * Null counts and ratios, distinct counts, and MIN/MAX/AVG/STDDEV_POP for numeric columns,
     * for every column of the schema.
     */
    public ColumnProfile columnProfile(DatasetHandle handle, List<ColumnDescriptor> columns)
            throws ExecutionFailedException {
        log.debug("Profiling {} columns of dataset {}", columns.size(), handle.datasetId());
        try {
            List<String> expressions = new ArrayList<>();
            expressions.add("COUNT(*)");
            for (ColumnDescriptor column : columns) {
                String name = quoteIdentifier(column.name());
                expressions.add("COUNT(" + name + ")");
                expressions.add("COUNT(DISTINCT " + name + ")");
            }
            SelectStatement counts = SelectStatement.builder()
                    .projection(String.join(", ", expressions))
                    .build();
            List<Long> values = engine.select(handle, counts, cursor -> {
                List<Long> row = new ArrayList<>();
                if (cursor.next()) {
                    for (int i = 0; i < expressions.size(); i++) {
                        row.add(((Number) cursor.get(i)).longValue());
                    }
                }
                return row;
            });
            if (values.isEmpty()) {
                return new ColumnProfile(Map.of(), Map.of(), List.of());
            }

            Map<String, List<Object>> numericStats = numericStats(handle, columns);

            long rowCount = values.get(0);
            Map<String, ColumnQuality> dataQuality = new LinkedHashMap<>();
            Map<String, Long> uniqueness = new LinkedHashMap<>();
            List<NullProfileEntry> nullProfile = new ArrayList<>();
            for (int i = 0; i < columns.size(); i++) {
                String name = columns.get(i).name();
                long nullCount = rowCount - values.get(1 + 2 * i);
                Double nullRatio = rowCount > 0 ? (double) nullCount / rowCount : null;

                List<Object> stats = numericStats.get(name);
                dataQuality.put(name, stats == null
                        ? ColumnQuality.nullRatioOnly(nullRatio)
                        : new ColumnQuality(nullRatio, stats.get(0), stats.get(1), toDouble(stats.get(2)), toDouble(stats.get(3))));
                uniqueness.put(name, values.get(2 + 2 * i));
                nullProfile.add(new NullProfileEntry(name, nullCount, nullRatio));
            }
            return new ColumnProfile(dataQuality, uniqueness, nullProfile);
        } catch (SQLException | IOException e) {
            throw failure(handle, e);
        }
    }

    private Map<String, List<Object>> numericStats(DatasetHandle handle, List<ColumnDescriptor> columns)
            throws SQLException, IOException {
        List<String> numeric = columns.stream()
                .filter(column -> column.declaredType() == TypeTag.INTEGER || column.declaredType() == TypeTag.FLOAT)
                .map(ColumnDescriptor::name)
                .toList();
        if (numeric.isEmpty()) {
            return Map.of();
        }

        List<String> expressions = new ArrayList<>();
        for (String column : numeric) {
            String name = quoteIdentifier(column);
            expressions.add("MIN(" + name + "), MAX(" + name + "), AVG(" + name + "), STDDEV_POP(" + name + ")");
        }
        SelectStatement statement = SelectStatement.builder()
                .projection(String.join(", ", expressions))
                .build();

        return engine.select(handle, statement, cursor -> {
            Map<String, List<Object>> stats = new LinkedHashMap<>();
            if (cursor.next()) {
                for (int i = 0; i < numeric.size(); i++) {
                    stats.put(numeric.get(i), Arrays.asList(
                            cursor.get(4 * i), cursor.get(4 * i + 1), cursor.get(4 * i + 2), cursor.get(4 * i + 3)));
                }
            }
            return stats;
        });
    }

    private static Double toDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    private ExecutionFailedException failure(DatasetHandle handle, Exception cause) {
        String message = sanitizer.sanitize(cause.getMessage(), handle);
        log.warn("Profiling dataset {} failed: {}", handle.datasetId(), message);
        return new ExecutionFailedException(handle.datasetId(), message, cause);
    }

    private List<Long> nonNullCounts(DatasetHandle handle, List<ColumnDescriptor> columns)
            throws SQLException, IOException {
        if (columns.isEmpty()) {
            return List.of();
        }
        List<String> expressions = new ArrayList<>();
        for (ColumnDescriptor column : columns) {
            expressions.add("COUNT(" + quoteIdentifier(column.name()) + ")");
        }
        SelectStatement statement = SelectStatement.builder()
                .projection(String.join(", ", expressions))
                .build();

        return engine.select(handle, statement, cursor -> {
            List<Long> counts = new ArrayList<>();
            if (cursor.next()) {
                for (int i = 0; i < columns.size(); i++) {
                    counts.add(((Number) cursor.get(i)).longValue());
                }
            }
            return counts;
        });
    }

    private Long distinctCount(DatasetHandle handle, String column) throws SQLException, IOException {
        SelectStatement statement = SelectStatement.builder()
                .projection("COUNT(DISTINCT " + quoteIdentifier(column) + ")")
                .build();
        return engine.select(handle, statement, cursor -> cursor.next() ? ((Number) cursor.get(0)).longValue() : 0L);
    }

    private Long countDistinctFirst(DatasetHandle handle, List<ColumnDescriptor> columns, List<String> candidates)
            throws SQLException, IOException {
        Optional<String> column = firstPresent(columns, candidates);
        return column.isPresent() ? distinctCount(handle, column.get()) : null;
    }

    private long orderItemCount(DatasetHandle handle, List<ColumnDescriptor> columns) throws SQLException {
        if (!ColumnDescriptor.containsColumn(columns, "status")) {
            return engine.count(handle, CompiledPredicate.unconditional());
        }
        String status = quoteIdentifier("status");
        String placeholders = String.join(", ", Collections.nCopies(EXCLUDED_ITEM_STATUSES.size(), "?"));
        CompiledPredicate notExcluded = new CompiledPredicate(
                "(" + status + " IS NULL OR lower(CAST(" + status + " AS VARCHAR)) NOT IN (" + placeholders + "))",
                new ArrayList<>(EXCLUDED_ITEM_STATUSES));
        return engine.count(handle, notExcluded);
    }

    private DateRange dateRange(DatasetHandle handle, String column) throws SQLException, IOException {
        String parsed = "TRY_CAST(" + quoteIdentifier(column) + " AS TIMESTAMP)";
        SelectStatement statement = SelectStatement.builder()
                .projection("MIN(" + parsed + "), MAX(" + parsed + ")")
                .build();
        return engine.select(handle, statement, cursor -> {
            if (!cursor.next() || cursor.get(0) == null) {
                return null;
            }
            return new DateRange(isoString(cursor.get(0)), isoString(cursor.get(1)));
        });
    }

    private static String isoString(Object value) {
        if (value instanceof Timestamp sqlTimestamp) {
            return sqlTimestamp.toLocalDateTime().toString();
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return String.valueOf(value);
    }

    private static Map<TypeTag, Long> typeSummary(List<ColumnDescriptor> columns) {
        Map<TypeTag, Long> summary = new EnumMap<>(TypeTag.class);
        for (ColumnDescriptor column : columns) {
            summary.merge(column.declaredType(), 1L, Long::sum);
        }
        return summary;
    }

    static Map<String, Double> topMissing(List<ColumnDescriptor> columns, List<Long> nonNullCounts, long rowCount) {
        Map<String, Double> top = new LinkedHashMap<>();
        if (rowCount == 0 || nonNullCounts.size() != columns.size()) {
            return top;
        }

        List<Map.Entry<String, Double>> ratios = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            double missing = (double) (rowCount - nonNullCounts.get(i)) / rowCount;
            if (missing > 0) {
                double rounded = BigDecimal.valueOf(missing).setScale(4, RoundingMode.HALF_UP).doubleValue();
                ratios.add(Map.entry(columns.get(i).name(), rounded));
            }
        }
        ratios.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));
        ratios.stream().limit(TOP_MISSING_COLUMNS).forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    private static Long fileSize(DatasetHandle handle) {
        try {
            return Files.size(handle.path());
        } catch (IOException e) {
            log.debug("Could not read size of dataset {}: {}", handle.datasetId(), e.getMessage());
            return null;
        }
    }

    private static Optional<String> firstPresent(List<ColumnDescriptor> columns, List<String> candidates) {
        return candidates.stream()
                .filter(candidate -> ColumnDescriptor.containsColumn(columns, candidate))
                .findFirst();
    }
}
