package org.carball.reducer.exception;

/**
 * A compiled query failed inside the engine. The message is already sanitized and safe to
 * show to the caller; the original engine error is only kept as the cause for logging.
 */
public class ExecutionFailedException extends DatasetAccessException {

    public ExecutionFailedException(String datasetId, String sanitizedMessage, Throwable cause) {
        super(datasetId, sanitizedMessage, cause);
    }
}
