package org.carball.reducer.storage;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.carball.reducer.exception.DatasetNotFoundException;
import org.carball.reducer.model.schema.DatasetHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LocalDatasetStorageTest {

    @TempDir
    Path tempDir;

    private Path inputDir;
    private LocalDatasetStorage storage;

    @BeforeEach
    void setUp() {
        inputDir = tempDir.resolve("input");
        storage = new LocalDatasetStorage(inputDir);
    }

    @Test
    void shouldImportCsvUnderFreshId() throws IOException {
        // Given
        byte[] content = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);

        // When
        DatasetHandle handle = storage.importFile("Sales.CSV", new ByteArrayInputStream(content));

        // Then
        assertThat(handle.datasetId()).matches("[A-Za-z0-9_-]+");
        assertThat(handle.path()).isEqualTo(inputDir.resolve(handle.datasetId() + ".csv"));
        assertThat(Files.readString(handle.path())).isEqualTo("a,b\n1,2\n");
    }

    @Test
    void shouldGiveEveryImportItsOwnId() throws IOException {
        DatasetHandle first = storage.importFile("a.csv", new ByteArrayInputStream("x\n1\n".getBytes()));
        DatasetHandle second = storage.importFile("a.csv", new ByteArrayInputStream("x\n2\n".getBytes()));

        assertThat(first.datasetId()).isNotEqualTo(second.datasetId());
    }

    @Test
    void shouldConvertXlsxFirstSheetToCsv() throws IOException {
        // Given
        byte[] workbook = workbook();

        // When
        DatasetHandle handle = storage.importFile("orders.xlsx", new ByteArrayInputStream(workbook));

        // Then
        List<String> lines = Files.readAllLines(handle.path());
        assertThat(lines).containsExactly(
                "order_id,product_name,order_total_amount",
                "1,apple,12.5",
                "2,\"banana, ripe\",20");
    }

    @Test
    void shouldRejectUnsupportedExtensions() {
        assertThatThrownBy(() -> storage.importFile("notes.txt", new ByteArrayInputStream(new byte[0])))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Only csv / xlsx / xls files are supported");
        assertThatThrownBy(() -> storage.importFile("noextension", new ByteArrayInputStream(new byte[0])))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldResolveImportedDataset() throws Exception {
        DatasetHandle imported = storage.importFile("a.csv", new ByteArrayInputStream("x\n1\n".getBytes()));

        DatasetHandle resolved = storage.resolve(imported.datasetId());

        assertThat(resolved).isEqualTo(imported);
    }

    @Test
    void shouldResolveByPrefix() throws Exception {
        // Given
        Files.createDirectories(inputDir);
        Files.writeString(inputDir.resolve("legacy.upload.csv"), "x\n1\n");

        // When
        DatasetHandle handle = storage.resolve("legacy");

        // Then
        assertThat(handle.path().getFileName().toString()).isEqualTo("legacy.upload.csv");
    }

    @Test
    void shouldFailForUnknownOrInvalidIds() {
        assertThatThrownBy(() -> storage.resolve("missing"))
                .isInstanceOf(DatasetNotFoundException.class);
        assertThatThrownBy(() -> storage.resolve("../etc/passwd"))
                .isInstanceOf(DatasetNotFoundException.class);
        assertThatThrownBy(() -> storage.resolve(null))
                .isInstanceOf(DatasetNotFoundException.class);
    }

    @Test
    void shouldLowerCaseExtensions() {
        assertThat(LocalDatasetStorage.extensionOf("DATA.XLS")).isEqualTo(".xls");
        assertThat(LocalDatasetStorage.extensionOf("archive.tar.gz")).isEqualTo(".gz");
        assertThat(LocalDatasetStorage.extensionOf("README")).isEmpty();
    }

    private static byte[] workbook() throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("orders");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("order_id");
            header.createCell(1).setCellValue("product_name");
            header.createCell(2).setCellValue("order_total_amount");

            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue(1);
            first.createCell(1).setCellValue("apple");
            first.createCell(2).setCellValue(12.5);

            Row second = sheet.createRow(2);
            second.createCell(0).setCellValue(2);
            second.createCell(1).setCellValue("banana, ripe");
            second.createCell(2).setCellValue(20);

            // trailing empty row is skipped
            sheet.createRow(3);

            workbook.createSheet("ignored").createRow(0).createCell(0).setCellValue("x");
            workbook.write(out);
            return out.toByteArray();
        }
    }
}
