package org.carball.reducer.cli;

import org.carball.reducer.config.ConfigurationLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class DatasetReducerCLITest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private DatasetReducerCLI cli;
    private Path inputDir;
    private Path outputDir;

    @BeforeEach
    void setUp() throws Exception {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new DatasetReducerCLI(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                new ConfigurationLoader(Map.of()));

        inputDir = tempDir.resolve("input");
        outputDir = tempDir.resolve("output");
        Files.createDirectories(inputDir);
        Files.writeString(inputDir.resolve("sales.csv"), """
                order_id,product_id,member_id,order_total_amount,purchase_time
                1,p1,m1,30,2024-01-01 09:00:00
                2,p2,m2,70,2024-01-02 09:00:00
                """);
    }

    @Test
    void shouldPrintUsageWithoutCommand() {
        int exitCode = cli.run(new String[0]);

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout()).contains("Usage:", "bootstrap <dataset-id>");
    }

    @Test
    void shouldExitCleanlyForHelp() {
        assertThat(cli.run(new String[]{"--help"})).isZero();
    }

    @Test
    void shouldBootstrapAsJson() {
        int exitCode = cli.run(args("bootstrap", "sales"));

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("\"dataset_id\" : \"sales\"", "\"grains\"", "🚫");
    }

    @Test
    void shouldWriteMarkdownReportToFile() throws Exception {
        Path report = tempDir.resolve("report.md");

        int exitCode = cli.run(args("bootstrap", "sales", "--format", "markdown", "--output", report.toString()));

        assertThat(exitCode).isZero();
        assertThat(Files.readString(report)).startsWith("# Dataset Report: sales");
    }

    @Test
    void shouldPreviewWithFilterFile() throws Exception {
        // Given
        Path filters = tempDir.resolve("filters.json");
        Files.writeString(filters, "{\"filters\": [{\"column\": \"order_total_amount\", \"op\": \">\", \"value\": 50}]}");

        // When
        int exitCode = cli.run(args("preview", "sales", "--filters", filters.toString()));

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("\"matched_rows\" : 1");
    }

    @Test
    void shouldFailPreviewWithUnknownColumn() throws Exception {
        Path filters = tempDir.resolve("filters.json");
        Files.writeString(filters, "{\"filters\": [{\"column\": \"secret\", \"op\": \"eq\", \"value\": 1}]}");

        int exitCode = cli.run(args("preview", "sales", "--filters", filters.toString()));

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout()).contains("Unknown column: secret");
    }

    @Test
    void shouldExportWithoutFiltersAsXlsx() {
        int exitCode = cli.run(args("export", "sales", "--format", "xlsx"));

        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("sales_filtered.xlsx")).exists();
        assertThat(stdout()).contains("Rows: 2");
    }

    @Test
    void shouldListDistinctValues() {
        int exitCode = cli.run(args("distinct", "sales", "member_id", "--limit", "5"));

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("\"m1\"", "\"m2\"");
    }

    @Test
    void shouldRunAnalysis() {
        int exitCode = cli.run(args("analyze", "sales", "time_trend", "--granularity", "month"));

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("\"2024-01\"");
    }

    @Test
    void shouldReportErrorsWithExitCode() {
        assertThat(cli.run(args("analyze", "sales", "churn"))).isEqualTo(1);
        assertThat(stderr()).contains("Unknown analysis: churn");

        assertThat(cli.run(args("bootstrap", "missing"))).isEqualTo(1);
        assertThat(stderr()).contains("Dataset missing not found");

        assertThat(cli.run(args("frobnicate"))).isEqualTo(1);
        assertThat(stderr()).contains("Unknown command");
    }

    @Test
    void shouldSeparateOptionsFromPositionalArguments() {
        List<String> positional = DatasetReducerCLI.positionalArguments(
                new String[]{"--config", "x.yml", "distinct", "-h", "sales", "--limit", "3", "name"});

        assertThat(positional).containsExactly("distinct", "sales", "name");
    }

    private String[] args(String... command) {
        List<String> all = new ArrayList<>(Arrays.asList(command));
        all.addAll(List.of(
                "--reducer.input-dir", inputDir.toString(),
                "--reducer.output-dir", outputDir.toString()));
        return all.toArray(new String[0]);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
