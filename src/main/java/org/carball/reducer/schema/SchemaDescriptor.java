package org.carball.reducer.schema;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.engine.EngineColumn;
import org.carball.reducer.engine.QueryEngine;
import org.carball.reducer.exception.DatasetNotFoundException;
import org.carball.reducer.exception.SchemaUnavailableException;
import org.carball.reducer.model.schema.ColumnDescriptor;
import org.carball.reducer.model.schema.DatasetHandle;
import org.carball.reducer.model.schema.TypeTag;

import java.nio.file.Files;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fetches the ordered column list of a dataset from the query engine.
 */
@Slf4j
public class SchemaDescriptor {

    private final QueryEngine engine;

    public SchemaDescriptor(QueryEngine engine) {
        this.engine = engine;
    }

    public List<ColumnDescriptor> describe(DatasetHandle handle)
            throws DatasetNotFoundException, SchemaUnavailableException {
        if (handle == null || handle.path() == null || !Files.isRegularFile(handle.path())) {
            throw new DatasetNotFoundException(handle == null ? null : handle.datasetId());
        }

        List<EngineColumn> engineColumns;
        try {
            engineColumns = engine.describe(handle);
        } catch (SQLException e) {
            log.warn("Could not describe dataset {}: {}", handle.datasetId(), e.getMessage());
            throw new SchemaUnavailableException(handle.datasetId(),
                    "Could not read the structure of dataset " + handle.datasetId(), e);
        }

        if (engineColumns.isEmpty()) {
            throw new SchemaUnavailableException(handle.datasetId(),
                    "Dataset " + handle.datasetId() + " has no columns", null);
        }

        List<ColumnDescriptor> columns = engineColumns.stream()
                .map(SchemaDescriptor::toDescriptor)
                .collect(Collectors.toUnmodifiableList());

        log.info("Dataset {} has {} columns", handle.datasetId(), columns.size());
        return columns;
    }

    static ColumnDescriptor toDescriptor(EngineColumn column) {
        return new ColumnDescriptor(
                column.name(),
                TypeTag.fromEngineType(column.type()),
                column.nullable(),
                column.type()
        );
    }
}
