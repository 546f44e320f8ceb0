package org.carball.reducer.exception;

/**
 * The engine could not work out the structure of the dataset's file.
 */
public class SchemaUnavailableException extends DatasetAccessException {

    public SchemaUnavailableException(String datasetId, String message, Throwable cause) {
        super(datasetId, message, cause);
    }
}
