package org.carball.reducer.storage;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.exception.DatasetNotFoundException;
import org.carball.reducer.model.schema.DatasetHandle;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Keeps datasets as {@code <datasetId>.csv} files in a local input directory.
 */
@Slf4j
public class LocalDatasetStorage implements DatasetStorage {

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".csv", ".xls", ".xlsx");

    private static final Pattern DATASET_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final Path inputDirectory;
    private final SpreadsheetConverter spreadsheetConverter;

    public LocalDatasetStorage(Path inputDirectory) {
        this(inputDirectory, new SpreadsheetConverter());
    }

    public LocalDatasetStorage(Path inputDirectory, SpreadsheetConverter spreadsheetConverter) {
        this.inputDirectory = inputDirectory;
        this.spreadsheetConverter = spreadsheetConverter;
    }

    @Override
    public DatasetHandle resolve(String datasetId) throws DatasetNotFoundException {
        if (datasetId == null || !DATASET_ID.matcher(datasetId).matches()) {
            throw new DatasetNotFoundException(datasetId);
        }

        Path exact = inputDirectory.resolve(datasetId + ".csv");
        if (Files.isRegularFile(exact)) {
            return new DatasetHandle(datasetId, exact);
        }

        return findByPrefix(datasetId)
                .map(path -> new DatasetHandle(datasetId, path))
                .orElseThrow(() -> new DatasetNotFoundException(datasetId));
    }

    @Override
    public DatasetHandle importFile(String originalFilename, InputStream content) throws IOException {
        String extension = extensionOf(originalFilename);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new IllegalArgumentException("Only csv / xlsx / xls files are supported");
        }

        Files.createDirectories(inputDirectory);
        String datasetId = UUID.randomUUID().toString();
        Path target = inputDirectory.resolve(datasetId + ".csv");

        if (".csv".equals(extension)) {
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        } else {
            long rows = spreadsheetConverter.convertToCsv(content, target);
            log.debug("Converted {} rows from {}", rows, originalFilename);
        }

        log.info("Stored upload {} as dataset {}", originalFilename, datasetId);
        return new DatasetHandle(datasetId, target);
    }

    private Optional<Path> findByPrefix(String datasetId) {
        if (!Files.isDirectory(inputDirectory)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(inputDirectory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(datasetId + "."))
                    .filter(p -> ".csv".equals(extensionOf(p.getFileName().toString())))
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            log.warn("Could not list input directory {}: {}", inputDirectory, e.getMessage());
            return Optional.empty();
        }
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot).toLowerCase(Locale.ROOT);
    }
}
