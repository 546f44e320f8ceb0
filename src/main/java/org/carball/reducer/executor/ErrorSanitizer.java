package org.carball.reducer.executor;

import org.carball.reducer.model.schema.DatasetHandle;

/**
 * Turns raw engine error text into something safe to hand to an untrusted caller:
 * first line only, storage paths replaced by the dataset id, bounded length.
 */
public class ErrorSanitizer {

    static final String GENERIC_MESSAGE = "Query execution failed";
    static final int DEFAULT_MAX_LENGTH = 300;

    private final int maxLength;

    public ErrorSanitizer() {
        this(DEFAULT_MAX_LENGTH);
    }

    public ErrorSanitizer(int maxLength) {
        this.maxLength = Math.max(maxLength, 20);
    }

    public String sanitize(String engineMessage, DatasetHandle handle) {
        if (engineMessage == null || engineMessage.isBlank()) {
            return GENERIC_MESSAGE;
        }

        String message = engineMessage.strip();
        int lineBreak = message.indexOf('\n');
        if (lineBreak >= 0) {
            message = message.substring(0, lineBreak).strip();
        }

        if (handle != null && handle.path() != null) {
            String dataset = "dataset " + handle.datasetId();
            message = message.replace(handle.path().toAbsolutePath().toString(), dataset);
            message = message.replace(handle.path().toString(), dataset);
        }

        if (message.length() > maxLength) {
            message = message.substring(0, maxLength - 3) + "...";
        }
        return message.isEmpty() ? GENERIC_MESSAGE : message;
    }
}
