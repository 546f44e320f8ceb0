package org.carball.reducer.output;

import org.carball.reducer.engine.RowCursor;
import org.carball.reducer.model.execution.ExportFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;

/**
 * Encodes the rows of an open cursor into an export file.
 */
public interface ExportWriter {

    ExportFormat format();

    /**
     * Writes a header row followed by every remaining row of the cursor.
     *
     * @return the number of data rows written
     */
    long write(RowCursor cursor, Path target) throws SQLException, IOException;

    static ExportWriter forFormat(ExportFormat format) {
        switch (format) {
            case CSV:
                return new CsvExportWriter();
            case XLSX:
                return new XlsxExportWriter();
            default:
                throw new IllegalArgumentException("Unsupported export format: " + format);
        }
    }
}
