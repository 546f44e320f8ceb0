package org.carball.reducer.exception;

public class DatasetNotFoundException extends DatasetAccessException {

    public DatasetNotFoundException(String datasetId) {
        super(datasetId, "Dataset " + datasetId + " not found");
    }
}
