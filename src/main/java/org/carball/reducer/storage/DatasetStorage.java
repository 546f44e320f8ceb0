package org.carball.reducer.storage;

import org.carball.reducer.exception.DatasetNotFoundException;
import org.carball.reducer.model.schema.DatasetHandle;

import java.io.IOException;
import java.io.InputStream;

/**
 * Where uploaded datasets live. Every stored dataset is a canonical CSV file.
 */
public interface DatasetStorage {

    DatasetHandle resolve(String datasetId) throws DatasetNotFoundException;

    /**
     * Stores an upload under a fresh dataset id, converting spreadsheets to CSV.
     */
    DatasetHandle importFile(String originalFilename, InputStream content) throws IOException;
}
