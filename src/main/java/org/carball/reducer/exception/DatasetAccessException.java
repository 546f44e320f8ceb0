package org.carball.reducer.exception;

import lombok.Getter;

/**
 * Base for failures that happen while reaching a dataset through storage or the query engine.
 */
@Getter
public abstract class DatasetAccessException extends Exception {

    private final String datasetId;

    protected DatasetAccessException(String datasetId, String message) {
        super(message);
        this.datasetId = datasetId;
    }

    protected DatasetAccessException(String datasetId, String message, Throwable cause) {
        super(message, cause);
        this.datasetId = datasetId;
    }
}
