package org.carball.reducer.output;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.carball.reducer.engine.RowCursor;
import org.carball.reducer.model.execution.ExportFormat;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Single sheet with a header row. XLSX is not a streaming format: the whole workbook is held
 * in memory until it is written, so memory use grows with the number of exported rows.
 * Dates and timestamps become date-formatted cells.
 */
public class XlsxExportWriter implements ExportWriter {

    static final String SHEET_NAME = "data";
    static final String DATE_FORMAT = "yyyy-mm-dd";
    static final String TIMESTAMP_FORMAT = "yyyy-mm-dd hh:mm:ss";

    private static final int MAX_DATA_ROWS = SpreadsheetVersion.EXCEL2007.getMaxRows() - 1;

    @Override
    public ExportFormat format() {
        return ExportFormat.XLSX;
    }

    @Override
    public long write(RowCursor cursor, Path target) throws SQLException, IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            CellStyles styles = new CellStyles(workbook);

            List<String> columns = cursor.columnNames();
            Row header = sheet.createRow(0);
            for (int i = 0; i < columns.size(); i++) {
                header.createCell(i).setCellValue(columns.get(i));
            }

            int rowIndex = 0;
            while (cursor.next()) {
                if (rowIndex >= MAX_DATA_ROWS) {
                    throw new IOException("Result exceeds the " + MAX_DATA_ROWS + " rows an XLSX sheet can hold");
                }
                Row row = sheet.createRow(++rowIndex);
                for (int i = 0; i < columns.size(); i++) {
                    setCellValue(row.createCell(i), cursor.get(i), styles);
                }
            }

            try (OutputStream out = Files.newOutputStream(target)) {
                workbook.write(out);
            }
            return rowIndex;
        }
    }

    private static void setCellValue(Cell cell, Object value, CellStyles styles) {
        Object normalized = TemporalValues.normalize(value);
        if (value == null) {
            cell.setBlank();
        } else if (normalized instanceof LocalDateTime dateTime) {
            cell.setCellValue(dateTime);
            cell.setCellStyle(styles.timestamp);
        } else if (normalized instanceof LocalDate date) {
            cell.setCellValue(date);
            cell.setCellStyle(styles.date);
        } else if (TemporalValues.isTemporal(value)) {
            cell.setCellValue(TemporalValues.toCsvValue(value).toString());
        } else if (value instanceof Boolean bool) {
            cell.setCellValue(bool);
        } else if (value instanceof BigInteger || value instanceof BigDecimal) {
            // Excel numbers are doubles; keep full precision as text
            cell.setCellValue(value.toString());
        } else if (value instanceof Number number) {
            cell.setCellValue(number.doubleValue());
        } else {
            cell.setCellValue(value.toString());
        }
    }

    private static final class CellStyles {

        private final CellStyle date;
        private final CellStyle timestamp;

        private CellStyles(Workbook workbook) {
            CreationHelper helper = workbook.getCreationHelper();
            date = workbook.createCellStyle();
            date.setDataFormat(helper.createDataFormat().getFormat(DATE_FORMAT));
            timestamp = workbook.createCellStyle();
            timestamp.setDataFormat(helper.createDataFormat().getFormat(TIMESTAMP_FORMAT));
        }
    }
}
