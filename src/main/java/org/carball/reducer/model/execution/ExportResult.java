package org.carball.reducer.model.execution;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A written export file. Each export call produces a new file; nothing is reused.
 */
public record ExportResult(Path path, String suggestedFilename, ExportFormat format, long rowCount) {

    /**
     * Opens the exported bytes for streaming back to the caller, who must close the stream.
     */
    public InputStream openStream() throws IOException {
        return Files.newInputStream(path);
    }
}
