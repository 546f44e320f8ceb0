package org.carball.reducer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.analysis.DatasetProfiler;
import org.carball.reducer.analysis.SafeAnalysisRunner;
import org.carball.reducer.analyzer.AnalysisGate;
import org.carball.reducer.analyzer.AvailableAnalysisDetector;
import org.carball.reducer.analyzer.BlacklistDeriver;
import org.carball.reducer.analyzer.GrainDetector;
import org.carball.reducer.compiler.FilterCompiler;
import org.carball.reducer.config.ReducerConfig;
import org.carball.reducer.engine.DuckDbQueryEngine;
import org.carball.reducer.engine.QueryEngine;
import org.carball.reducer.engine.RowCursor;
import org.carball.reducer.engine.SelectStatement;
import org.carball.reducer.engine.SqlDialect;
import org.carball.reducer.exception.DatasetAccessException;
import org.carball.reducer.exception.DatasetNotFoundException;
import org.carball.reducer.exception.ExecutionFailedException;
import org.carball.reducer.exception.FilterCompileException;
import org.carball.reducer.exception.SchemaUnavailableException;
import org.carball.reducer.exception.UnknownColumnException;
import org.carball.reducer.executor.ErrorSanitizer;
import org.carball.reducer.executor.QueryExecutor;
import org.carball.reducer.model.analysis.AnalysisOutcome;
import org.carball.reducer.model.analysis.AnalysisRequest;
import org.carball.reducer.model.analysis.BootstrapOverview;
import org.carball.reducer.model.analysis.BootstrapReport;
import org.carball.reducer.model.analysis.ColumnProfile;
import org.carball.reducer.model.analysis.DatasetOverview;
import org.carball.reducer.model.execution.DatasetPreview;
import org.carball.reducer.model.execution.ExportFormat;
import org.carball.reducer.model.execution.ExportResult;
import org.carball.reducer.model.execution.PreviewReport;
import org.carball.reducer.model.execution.PreviewResult;
import org.carball.reducer.model.filter.CompiledPredicate;
import org.carball.reducer.model.filter.FilterLogic;
import org.carball.reducer.model.filter.FilterRule;
import org.carball.reducer.model.grain.BlacklistFinding;
import org.carball.reducer.model.grain.Grain;
import org.carball.reducer.model.schema.ColumnDescriptor;
import org.carball.reducer.model.schema.DatasetHandle;
import org.carball.reducer.schema.SchemaDescriptor;
import org.carball.reducer.storage.DatasetStorage;
import org.carball.reducer.storage.LocalDatasetStorage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point tying dataset storage, schema discovery, filter compilation, the semantic
 * guard and query execution together. Holds no per-dataset state; every call re-reads
 * the dataset's schema.
 */
@Slf4j
public class DatasetReducer {

    static final int MIN_PREVIEW_ROWS = 10;
    static final int MAX_PREVIEW_ROWS = 1000;
    static final int MIN_DISTINCT_VALUES = 1;
    static final int MAX_DISTINCT_VALUES = 1000;

    @Getter
    private final ReducerConfig config;
    private final DatasetStorage storage;
    private final QueryEngine engine;
    private final SchemaDescriptor schemaDescriptor;
    private final FilterCompiler filterCompiler;
    private final GrainDetector grainDetector;
    private final BlacklistDeriver blacklistDeriver;
    private final AvailableAnalysisDetector availableAnalysisDetector;
    private final QueryExecutor queryExecutor;
    private final SafeAnalysisRunner analysisRunner;
    private final DatasetProfiler profiler;
    private final ErrorSanitizer sanitizer;

    public DatasetReducer(ReducerConfig config) {
        this(config,
                new LocalDatasetStorage(Path.of(config.getInputDirectory())),
                new DuckDbQueryEngine(config.getJdbcUrl(), config.getQueryTimeoutSeconds(), config.isIgnoreCsvErrors()));
    }

    public DatasetReducer(ReducerConfig config, DatasetStorage storage, QueryEngine engine) {
        this.config = config;
        this.storage = storage;
        this.engine = engine;
        this.sanitizer = new ErrorSanitizer(config.getMaxErrorMessageLength());
        this.schemaDescriptor = new SchemaDescriptor(engine);
        this.filterCompiler = new FilterCompiler();
        this.grainDetector = new GrainDetector();
        this.blacklistDeriver = new BlacklistDeriver();
        this.availableAnalysisDetector = new AvailableAnalysisDetector();
        this.queryExecutor = new QueryExecutor(engine, Path.of(config.getOutputDirectory()), sanitizer);
        this.analysisRunner = new SafeAnalysisRunner(engine, grainDetector, blacklistDeriver, new AnalysisGate(), sanitizer);
        this.profiler = new DatasetProfiler(engine, sanitizer);
    }

    // Pure operations

    public CompiledPredicate compileFilters(List<FilterRule> rules, FilterLogic logic,
                                            Collection<ColumnDescriptor> knownColumns) {
        return filterCompiler.compile(rules, logic, knownColumns);
    }

    public Set<Grain> detectGrains(Collection<ColumnDescriptor> columns) {
        return grainDetector.detect(columns);
    }

    public List<BlacklistFinding> deriveBlacklist(Set<Grain> grains, List<ColumnDescriptor> columns) {
        return blacklistDeriver.derive(grains, columns);
    }

    // Dataset operations

    public DatasetHandle importDataset(String originalFilename, InputStream content) throws IOException {
        return storage.importFile(originalFilename, content);
    }

    public DatasetHandle resolve(String datasetId) throws DatasetNotFoundException {
        return storage.resolve(datasetId);
    }

    public List<ColumnDescriptor> describe(String datasetId)
            throws DatasetNotFoundException, SchemaUnavailableException {
        return schemaDescriptor.describe(storage.resolve(datasetId));
    }

    public PreviewResult runPreview(DatasetHandle handle, CompiledPredicate predicate)
            throws DatasetNotFoundException, ExecutionFailedException {
        return queryExecutor.previewCount(handle, predicate);
    }

    public ExportResult runExport(DatasetHandle handle, CompiledPredicate predicate, ExportFormat format)
            throws DatasetNotFoundException, ExecutionFailedException {
        return queryExecutor.export(handle, predicate, format);
    }

    /**
     * Compiles and counts in one step, reporting caller-correctable problems in the result
     * instead of throwing. A missing dataset is still thrown.
     */
    public PreviewReport previewQuery(String datasetId, List<FilterRule> rules, FilterLogic logic)
            throws DatasetNotFoundException, SchemaUnavailableException {
        long start = System.nanoTime();
        DatasetHandle handle = storage.resolve(datasetId);
        List<ColumnDescriptor> columns = schemaDescriptor.describe(handle);

        try {
            CompiledPredicate predicate = filterCompiler.compile(rules, logic, columns);
            return PreviewReport.success(queryExecutor.previewCount(handle, predicate));
        } catch (FilterCompileException | ExecutionFailedException e) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.info("Preview of dataset {} rejected: {}", datasetId, e.getMessage());
            return PreviewReport.failure(e.getMessage(), elapsedMs);
        }
    }

    public ExportResult exportFiltered(String datasetId, List<FilterRule> rules, FilterLogic logic,
                                       ExportFormat format) throws DatasetAccessException {
        DatasetHandle handle = storage.resolve(datasetId);
        List<ColumnDescriptor> columns = schemaDescriptor.describe(handle);
        CompiledPredicate predicate = filterCompiler.compile(rules, logic, columns);
        return queryExecutor.export(handle, predicate, format);
    }

    public BootstrapReport bootstrap(String datasetId) throws DatasetAccessException {
        log.info("Bootstrapping dataset {}", datasetId);
        DatasetHandle handle = storage.resolve(datasetId);
        List<ColumnDescriptor> columns = schemaDescriptor.describe(handle);

        Set<Grain> grains = grainDetector.detect(columns);
        List<BlacklistFinding> blacklist = blacklistDeriver.derive(grains, columns);
        List<Map<String, Object>> sample = readRows(handle, SelectStatement.builder()
                .limit(Math.max(config.getBootstrapSampleRows(), 0))
                .build());

        BootstrapOverview overview = profiler.bootstrapOverview(handle, columns);
        ColumnProfile columnProfile = profiler.columnProfile(handle, columns);

        log.info("Dataset {}: grains={}, {} blacklist findings", datasetId, grains, blacklist.size());
        return new BootstrapReport(
                datasetId,
                overview,
                columns,
                sample,
                grains,
                availableAnalysisDetector.availableAnalyses(columns),
                columnProfile.dataQuality(),
                columnProfile.uniqueness(),
                columnProfile.nullProfile(),
                blacklist
        );
    }

    public DatasetOverview overview(String datasetId) throws DatasetAccessException {
        DatasetHandle handle = storage.resolve(datasetId);
        return profiler.profile(handle, schemaDescriptor.describe(handle));
    }

    public DatasetPreview previewRows(String datasetId, Integer limit) throws DatasetAccessException {
        int rows = limit == null ? config.getPreviewRowLimit() : limit;
        requireRange("limit", rows, MIN_PREVIEW_ROWS, MAX_PREVIEW_ROWS);

        DatasetHandle handle = storage.resolve(datasetId);
        List<ColumnDescriptor> columns = schemaDescriptor.describe(handle);
        List<Map<String, Object>> sample = readRows(handle, SelectStatement.builder().limit(rows).build());

        long total;
        try {
            total = engine.count(handle, CompiledPredicate.unconditional());
        } catch (SQLException e) {
            throw executionFailure(handle, e);
        }
        return new DatasetPreview(columns, sample, total);
    }

    /**
     * Non-null distinct values of one column, in engine order.
     */
    public List<Object> distinctValues(String datasetId, String column, Integer limit) throws DatasetAccessException {
        int max = limit == null ? config.getDistinctValueLimit() : limit;
        requireRange("limit", max, MIN_DISTINCT_VALUES, MAX_DISTINCT_VALUES);

        DatasetHandle handle = storage.resolve(datasetId);
        List<ColumnDescriptor> columns = schemaDescriptor.describe(handle);
        if (column == null || !ColumnDescriptor.containsColumn(columns, column)) {
            throw new UnknownColumnException(column);
        }

        String quoted = SqlDialect.quoteIdentifier(column);
        SelectStatement statement = SelectStatement.builder()
                .projection("DISTINCT " + quoted)
                .predicate(new CompiledPredicate(quoted + " IS NOT NULL", List.of()))
                .limit(max)
                .build();

        try {
            return engine.select(handle, statement, cursor -> {
                List<Object> values = new ArrayList<>();
                while (cursor.next()) {
                    values.add(cursor.get(0));
                }
                return values;
            });
        } catch (SQLException | IOException e) {
            throw executionFailure(handle, e);
        }
    }

    public AnalysisOutcome runAnalysis(String datasetId, AnalysisRequest request) throws DatasetAccessException {
        DatasetHandle handle = storage.resolve(datasetId);
        List<ColumnDescriptor> columns = schemaDescriptor.describe(handle);
        return analysisRunner.run(handle, columns, request);
    }

    private List<Map<String, Object>> readRows(DatasetHandle handle, SelectStatement statement)
            throws ExecutionFailedException {
        try {
            return engine.select(handle, statement, DatasetReducer::toRowMaps);
        } catch (SQLException | IOException e) {
            throw executionFailure(handle, e);
        }
    }

    private static List<Map<String, Object>> toRowMaps(RowCursor cursor) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        List<String> names = cursor.columnNames();
        while (cursor.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++) {
                row.put(names.get(i), cursor.get(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private ExecutionFailedException executionFailure(DatasetHandle handle, Exception cause) {
        String message = sanitizer.sanitize(cause.getMessage(), handle);
        log.warn("Query on dataset {} failed: {}", handle.datasetId(), message);
        return new ExecutionFailedException(handle.datasetId(), message, cause);
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(String.format("%s must be between %d and %d", name, min, max));
        }
    }
}
