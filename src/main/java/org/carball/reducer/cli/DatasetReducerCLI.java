package org.carball.reducer.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.DatasetReducer;
import org.carball.reducer.compiler.FilterRuleParser;
import org.carball.reducer.compiler.FilterRuleParser.FilterRequest;
import org.carball.reducer.config.ConfigurationLoader;
import org.carball.reducer.config.ReducerConfig;
import org.carball.reducer.exception.AnalysisBlockedException;
import org.carball.reducer.exception.DatasetAccessException;
import org.carball.reducer.exception.FilterCompileException;
import org.carball.reducer.model.analysis.AnalysisOutcome;
import org.carball.reducer.model.analysis.AnalysisRequest;
import org.carball.reducer.model.analysis.BootstrapReport;
import org.carball.reducer.model.analysis.Granularity;
import org.carball.reducer.model.analysis.SafeAnalysis;
import org.carball.reducer.model.execution.DatasetPreview;
import org.carball.reducer.model.execution.ExportFormat;
import org.carball.reducer.model.execution.ExportResult;
import org.carball.reducer.model.execution.PreviewReport;
import org.carball.reducer.model.filter.FilterLogic;
import org.carball.reducer.model.grain.BlacklistFinding;
import org.carball.reducer.model.schema.DatasetHandle;
import org.carball.reducer.output.ReducerReport;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Slf4j
public class DatasetReducerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          Dataset Reducer: Safe Query & Semantic Guard v%s     ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigurationLoader configurationLoader;
    private final ReducerReport report = new ReducerReport();

    public DatasetReducerCLI(PrintStream out, PrintStream err, ConfigurationLoader configurationLoader) {
        this.out = out;
        this.err = err;
        this.configurationLoader = configurationLoader;
    }

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);
        int exitCode = new DatasetReducerCLI(System.out, System.err, new ConfigurationLoader()).run(args);
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        List<String> positional = positionalArguments(args);

        if (positional.isEmpty() || isHelpRequested(args)) {
            printUsage();
            return positional.isEmpty() && !isHelpRequested(args) ? 1 : 0;
        }

        String command = positional.get(0);
        List<String> operands = positional.subList(1, positional.size());

        try {
            ReducerConfig config = configurationLoader.loadConfiguration(args);
            DatasetReducer reducer = new DatasetReducer(config);

            switch (command) {
                case "import":
                    return importDataset(reducer, requireOperand(operands, 0, "file"));
                case "bootstrap":
                    return bootstrap(reducer, requireOperand(operands, 0, "dataset-id"), args);
                case "overview":
                    emit(report.toJson(reducer.overview(requireOperand(operands, 0, "dataset-id"))), args);
                    return 0;
                case "rows":
                    return rows(reducer, requireOperand(operands, 0, "dataset-id"), args);
                case "preview":
                    return preview(reducer, requireOperand(operands, 0, "dataset-id"), args);
                case "export":
                    return export(reducer, requireOperand(operands, 0, "dataset-id"), args);
                case "distinct":
                    return distinct(reducer, requireOperand(operands, 0, "dataset-id"),
                            requireOperand(operands, 1, "column"), args);
                case "analyze":
                    return analyze(reducer, requireOperand(operands, 0, "dataset-id"),
                            requireOperand(operands, 1, "analysis"), args);
                case "analyses":
                    emit(report.toJson(SafeAnalysis.values()), args);
                    return 0;
                default:
                    throw new IllegalArgumentException("Unknown command: " + command);
            }

        } catch (AnalysisBlockedException e) {
            err.println("\n🚫 Analysis blocked: " + e.getMessage());
            log.debug("Blocked analysis details", e);
            return 1;
        } catch (FilterCompileException e) {
            err.println("\n❌ Invalid request: " + e.getMessage());
            log.debug("Request error details", e);
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (DatasetAccessException e) {
            err.println("\n❌ Dataset error: " + e.getMessage());
            log.debug("Dataset error details", e);
            return 1;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private int importDataset(DatasetReducer reducer, String file) throws IOException {
        Path path = Paths.get(file);
        if (!Files.isRegularFile(path)) {
            throw new IOException("File not found: " + file);
        }

        out.print("📥 Importing " + path.getFileName() + "... ");
        DatasetHandle handle;
        try (InputStream content = Files.newInputStream(path)) {
            handle = reducer.importDataset(path.getFileName().toString(), content);
        }
        out.println("✓");
        out.println("   Dataset id: " + handle.datasetId());
        return 0;
    }

    private int bootstrap(DatasetReducer reducer, String datasetId, String[] args)
            throws DatasetAccessException, IOException {
        out.print("🔍 Inspecting dataset " + datasetId + "... ");
        BootstrapReport result = reducer.bootstrap(datasetId);
        out.println("✓");

        String format = optionValue(args, "--format", "json");
        switch (format) {
            case "json":
                emit(report.toJson(result), args);
                break;
            case "markdown":
            case "md":
                emit(report.toMarkdown(result), args);
                break;
            default:
                throw new IllegalArgumentException("format must be json or markdown");
        }

        printBlacklistSummary(result.blacklist());
        return 0;
    }

    private int rows(DatasetReducer reducer, String datasetId, String[] args)
            throws DatasetAccessException, IOException {
        Integer limit = intOption(args, "--limit");
        DatasetPreview preview = reducer.previewRows(datasetId, limit);
        emit(report.toJson(preview), args);
        return 0;
    }

    private int preview(DatasetReducer reducer, String datasetId, String[] args)
            throws DatasetAccessException, IOException {
        FilterRequest filters = readFilters(args);

        out.print("📊 Counting matching rows... ");
        PreviewReport result = reducer.previewQuery(datasetId, filters.rules(), filters.logic());
        out.println(result.ok() ? "✓" : "✗");

        emit(report.toJson(result), args);
        return result.ok() ? 0 : 1;
    }

    private int export(DatasetReducer reducer, String datasetId, String[] args)
            throws DatasetAccessException, IOException {
        FilterRequest filters = readFilters(args);
        ExportFormat format = ExportFormat.fromString(optionValue(args, "--format", "csv"));

        out.print("📝 Exporting filtered rows as " + format.getExtension() + "... ");
        ExportResult result = reducer.exportFiltered(datasetId, filters.rules(), filters.logic(), format);
        out.println("✓");

        out.println("\n✅ Export complete!");
        out.println("   Rows: " + result.rowCount());
        out.println("   Output file: " + result.path());
        return 0;
    }

    private int distinct(DatasetReducer reducer, String datasetId, String column, String[] args)
            throws DatasetAccessException, IOException {
        Integer limit = intOption(args, "--limit");
        List<Object> values = reducer.distinctValues(datasetId, column, limit);
        emit(report.toJson(Map.of("column", column, "values", values)), args);
        return 0;
    }

    private int analyze(DatasetReducer reducer, String datasetId, String analysisKey, String[] args)
            throws DatasetAccessException, IOException {
        AnalysisRequest.AnalysisRequestBuilder request = AnalysisRequest.builder()
                .analysis(SafeAnalysis.fromKey(analysisKey))
                .granularity(Granularity.fromString(optionValue(args, "--granularity", null)));
        Integer limit = intOption(args, "--limit");
        if (limit != null) {
            request.limit(limit);
        }

        out.print("📈 Running " + analysisKey + "... ");
        AnalysisOutcome outcome = reducer.runAnalysis(datasetId, request.build());
        out.println("✓");

        emit(report.toJson(outcome), args);
        printBlacklistSummary(outcome.warnings());
        return 0;
    }

    private FilterRequest readFilters(String[] args) throws IOException {
        String filtersFile = optionValue(args, "--filters", null);
        if (filtersFile == null) {
            return new FilterRequest(List.of(), FilterLogic.AND);
        }
        return new FilterRuleParser(report.getObjectMapper()).parse(Paths.get(filtersFile));
    }

    private void emit(String content, String[] args) throws IOException {
        String outputFile = optionValue(args, "--output", null);
        if (outputFile == null) {
            out.println(content);
            return;
        }
        Files.writeString(Paths.get(outputFile), content);
        out.println("   Output file: " + outputFile);
    }

    private void printBlacklistSummary(List<BlacklistFinding> findings) {
        for (BlacklistFinding finding : findings) {
            out.println((finding.isBlocking() ? "🚫 " : "⚠️  ") + finding.reason());
        }
    }

    private void printUsage() {
        out.println("\nUsage: java -jar dataset-reducer.jar <command> [arguments] [options]");
        out.println();
        out.println("Commands:");
        out.println("  import <file>                         Store a csv / xlsx / xls file as a new dataset");
        out.println("  bootstrap <dataset-id>                Schema, sample rows, grains and blacklist");
        out.println("  overview <dataset-id>                 Row, order, member and product counts, missing values");
        out.println("  rows <dataset-id>                     First rows and total row count");
        out.println("  preview <dataset-id>                  Count rows matching --filters");
        out.println("  export <dataset-id>                   Write rows matching --filters to a file");
        out.println("  distinct <dataset-id> <column>        Distinct non-null values of a column");
        out.println("  analyze <dataset-id> <analysis>       Run a safe analysis (see 'analyses')");
        out.println("  analyses                              List the analysis catalog");
        out.println();
        out.println("Options:");
        out.println("  --filters <file>      JSON filter payload: {\"logic\": \"AND\", \"filters\": [...]}");
        out.println("  --format <fmt>        bootstrap: json|markdown, export: csv|xlsx");
        out.println("  --granularity <g>     analyze: day|month (default: day)");
        out.println("  --limit <n>           Row / value / ranking limit");
        out.println("  --output <file>       Write the result to a file instead of stdout");
        out.println("  --help, -h            Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    /**
     * Arguments that are neither options nor option values. Every option except help takes a value.
     */
    static List<String> positionalArguments(String[] args) {
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--help".equals(arg) || "-h".equals(arg) || "help".equals(arg)) {
                continue;
            }
            if (arg.startsWith("-")) {
                i++;
                continue;
            }
            positional.add(arg);
        }
        return positional;
    }

    static String optionValue(String[] args, String option, String defaultValue) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return defaultValue;
    }

    private static Integer intOption(String[] args, String option) {
        String value = optionValue(args, option, null);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " must be a number: " + value);
        }
    }

    private static String requireOperand(List<String> operands, int index, String name) {
        if (operands.size() <= index) {
            throw new IllegalArgumentException("Missing argument: <" + name + ">");
        }
        return operands.get(index);
    }
}
