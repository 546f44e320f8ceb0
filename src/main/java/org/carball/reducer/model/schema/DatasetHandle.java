package org.carball.reducer.model.schema;

import java.nio.file.Path;

/**
 * A dataset resolved to its canonical file on storage.
 */
public record DatasetHandle(String datasetId, Path path) {

    @Override
    public String toString() {
        return datasetId;
    }
}
