package org.carball.reducer.output;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.carball.reducer.engine.RowCursor;
import org.carball.reducer.model.execution.ExportFormat;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Comma-delimited, header row, UTF-8. Rows go to disk as they are read from the cursor.
 * Dates and timestamps keep the text form the engine reads and prints.
 */
public class CsvExportWriter implements ExportWriter {

    @Override
    public ExportFormat format() {
        return ExportFormat.CSV;
    }

    @Override
    public long write(RowCursor cursor, Path target) throws SQLException, IOException {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader(cursor.columnNames().toArray(new String[0]))
                .build();

        long rows = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, csvFormat)) {
            while (cursor.next()) {
                List<Object> row = cursor.currentRow();
                List<Object> values = new ArrayList<>(row.size());
                for (Object value : row) {
                    values.add(TemporalValues.toCsvValue(value));
                }
                printer.printRecord(values);
                rows++;
            }
        }
        return rows;
    }
}
