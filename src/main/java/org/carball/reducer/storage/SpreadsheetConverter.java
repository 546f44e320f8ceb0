package org.carball.reducer.storage;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.CellValue;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the first sheet of an XLS or XLSX workbook into a CSV file with a header row.
 */
public class SpreadsheetConverter {

    /**
     * @return the number of data rows written
     */
    public long convertToCsv(InputStream workbookStream, Path target) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(workbookStream)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IOException("Workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null || header.getLastCellNum() <= 0) {
                throw new IOException("Workbook has no header row");
            }

            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            int width = header.getLastCellNum();

            long rows = 0;
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {

                printer.printRecord(readRow(header, width, evaluator));
                for (int r = header.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                    Row row = sheet.getRow(r);
                    if (isEmptyRow(row)) {
                        continue;
                    }
                    printer.printRecord(readRow(row, width, evaluator));
                    rows++;
                }
            }
            return rows;
        }
    }

    private static List<Object> readRow(Row row, int width, FormulaEvaluator evaluator) {
        List<Object> values = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            values.add(readCell(row.getCell(i, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL), evaluator));
        }
        return values;
    }

    private static boolean isEmptyRow(Row row) {
        if (row == null) {
            return true;
        }
        for (Cell cell : row) {
            if (cell != null && cell.getCellType() != CellType.BLANK) {
                return false;
            }
        }
        return true;
    }

    private static Object readCell(Cell cell, FormulaEvaluator evaluator) {
        if (cell == null) {
            return null;
        }
        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return formatNumber(cell.getNumericCellValue());
            case FORMULA:
                return readFormula(evaluator.evaluate(cell));
            default:
                return null;
        }
    }

    private static Object readFormula(CellValue value) {
        if (value == null) {
            return null;
        }
        switch (value.getCellType()) {
            case STRING:
                return value.getStringValue();
            case BOOLEAN:
                return value.getBooleanValue();
            case NUMERIC:
                return formatNumber(value.getNumberValue());
            default:
                return null;
        }
    }

    private static Object formatNumber(double number) {
        if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
            return (long) number;
        }
        return number;
    }
}
