package org.carball.reducer.executor;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.engine.QueryEngine;
import org.carball.reducer.engine.SelectStatement;
import org.carball.reducer.exception.DatasetNotFoundException;
import org.carball.reducer.exception.ExecutionFailedException;
import org.carball.reducer.model.execution.ExportFormat;
import org.carball.reducer.model.execution.ExportResult;
import org.carball.reducer.model.execution.PreviewResult;
import org.carball.reducer.model.filter.CompiledPredicate;
import org.carball.reducer.model.schema.DatasetHandle;
import org.carball.reducer.output.ExportWriter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Drives the query engine with compiled predicates: count-only previews and filtered exports.
 * No retries; a failed execution is reported once with a sanitized message.
 */
@Slf4j
public class QueryExecutor {

    private final QueryEngine engine;
    private final Path outputDirectory;
    private final ErrorSanitizer sanitizer;

    public QueryExecutor(QueryEngine engine, Path outputDirectory) {
        this(engine, outputDirectory, new ErrorSanitizer());
    }

    public QueryExecutor(QueryEngine engine, Path outputDirectory, ErrorSanitizer sanitizer) {
        this.engine = engine;
        this.outputDirectory = outputDirectory;
        this.sanitizer = sanitizer;
    }

    public PreviewResult previewCount(DatasetHandle handle, CompiledPredicate predicate)
            throws DatasetNotFoundException, ExecutionFailedException {
        requireDataset(handle);
        long start = System.nanoTime();

        try {
            long matchedRows = engine.count(handle, predicate);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("Preview of dataset {} matched {} rows in {} ms", handle.datasetId(), matchedRows, elapsed.toMillis());
            return new PreviewResult(matchedRows, elapsed);
        } catch (SQLException e) {
            throw failure(handle, "Preview", e);
        }
    }

    public ExportResult export(DatasetHandle handle, CompiledPredicate predicate, ExportFormat format)
            throws DatasetNotFoundException, ExecutionFailedException {
        requireDataset(handle);
        if (format == null) {
            throw new IllegalArgumentException("export format must be csv or xlsx");
        }

        String filename = handle.datasetId() + "_filtered." + format.getExtension();
        Path target = outputDirectory.resolve(filename);
        ExportWriter writer = ExportWriter.forFormat(format);

        if (!format.isRowStreamable()) {
            log.debug("Export of dataset {} as {} is materialized in memory before writing", handle.datasetId(), format);
        }

        try {
            Files.createDirectories(outputDirectory);
            SelectStatement statement = SelectStatement.builder()
                    .predicate(predicate)
                    .build();
            long rows = engine.select(handle, statement, cursor -> writer.write(cursor, target));

            log.info("Exported {} rows of dataset {} to {}", rows, handle.datasetId(), target);
            return new ExportResult(target, filename, format, rows);
        } catch (SQLException | IOException e) {
            deletePartialFile(target);
            throw failure(handle, "Export", e);
        }
    }

    private void requireDataset(DatasetHandle handle) throws DatasetNotFoundException {
        if (handle == null || handle.path() == null || !Files.isRegularFile(handle.path())) {
            throw new DatasetNotFoundException(handle == null ? null : handle.datasetId());
        }
    }

    private ExecutionFailedException failure(DatasetHandle handle, String operation, Exception cause) {
        String message = sanitizer.sanitize(cause.getMessage(), handle);
        log.warn("{} of dataset {} failed: {}", operation, handle.datasetId(), message);
        log.debug("{} failure details", operation, cause);
        return new ExecutionFailedException(handle.datasetId(), message, cause);
    }

    private static void deletePartialFile(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Could not remove partial export {}: {}", target, e.getMessage());
        }
    }
}
