package org.carball.reducer.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String CONFIG_FILE_OPTION = "--config";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public ReducerConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        ReducerConfig.ReducerConfigBuilder builder = ReducerConfig.builder();

        // 1. YAML file named by --config, if any
        String configPath = extractConfigPath(args);
        if (configPath != null) {
            applyYamlFile(builder, configPath);
        }

        // 2. Environment variables
        applyEnvironmentVariables(builder);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        ReducerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyYamlFile(ReducerConfig.ReducerConfigBuilder builder, String configPath) {
        File configFile = new File(configPath);
        if (!configFile.exists()) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            JsonNode root = mapper.readTree(configFile);
            if (root == null || !root.isObject()) {
                log.warn("Config file {} is empty or not a mapping, using defaults", configPath);
                return;
            }

            JsonNode storage = root.path("storage");
            if (storage.hasNonNull("input_directory")) {
                builder.inputDirectory(storage.get("input_directory").asText());
            }
            if (storage.hasNonNull("output_directory")) {
                builder.outputDirectory(storage.get("output_directory").asText());
            }

            JsonNode engine = root.path("engine");
            if (engine.hasNonNull("jdbc_url")) {
                builder.jdbcUrl(engine.get("jdbc_url").asText());
            }
            if (engine.hasNonNull("query_timeout_seconds")) {
                builder.queryTimeoutSeconds(engine.get("query_timeout_seconds").asInt());
            }
            if (engine.hasNonNull("ignore_csv_errors")) {
                builder.ignoreCsvErrors(engine.get("ignore_csv_errors").asBoolean());
            }

            JsonNode limits = root.path("limits");
            if (limits.hasNonNull("bootstrap_sample_rows")) {
                builder.bootstrapSampleRows(limits.get("bootstrap_sample_rows").asInt());
            }
            if (limits.hasNonNull("preview_rows")) {
                builder.previewRowLimit(limits.get("preview_rows").asInt());
            }
            if (limits.hasNonNull("distinct_values")) {
                builder.distinctValueLimit(limits.get("distinct_values").asInt());
            }
            if (limits.hasNonNull("max_error_message_length")) {
                builder.maxErrorMessageLength(limits.get("max_error_message_length").asInt());
            }

            log.info("Loaded configuration file: {}", configPath);
        } catch (IOException e) {
            log.error("Failed to load config file {}: {}, using defaults", configPath, e.getMessage());
        }
    }

    private void applyEnvironmentVariables(ReducerConfig.ReducerConfigBuilder builder) {
        if (environment.containsKey("REDUCER_INPUT_DIR")) {
            builder.inputDirectory(environment.get("REDUCER_INPUT_DIR"));
        }
        if (environment.containsKey("REDUCER_OUTPUT_DIR")) {
            builder.outputDirectory(environment.get("REDUCER_OUTPUT_DIR"));
        }
        if (environment.containsKey("REDUCER_JDBC_URL")) {
            builder.jdbcUrl(environment.get("REDUCER_JDBC_URL"));
        }
        try {
            if (environment.containsKey("REDUCER_QUERY_TIMEOUT")) {
                builder.queryTimeoutSeconds(Integer.parseInt(environment.get("REDUCER_QUERY_TIMEOUT")));
            }
            if (environment.containsKey("REDUCER_PREVIEW_ROWS")) {
                builder.previewRowLimit(Integer.parseInt(environment.get("REDUCER_PREVIEW_ROWS")));
            }
            if (environment.containsKey("REDUCER_DISTINCT_VALUES")) {
                builder.distinctValueLimit(Integer.parseInt(environment.get("REDUCER_DISTINCT_VALUES")));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric environment value: {}", e.getMessage());
        }
    }

    private void applyCLIArguments(ReducerConfig.ReducerConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--reducer.input-dir":
                        builder.inputDirectory(value);
                        break;
                    case "--reducer.output-dir":
                        builder.outputDirectory(value);
                        break;
                    case "--reducer.jdbc-url":
                        builder.jdbcUrl(value);
                        break;
                    case "--reducer.query-timeout":
                        builder.queryTimeoutSeconds(Integer.parseInt(value));
                        break;
                    case "--reducer.preview-rows":
                        builder.previewRowLimit(Integer.parseInt(value));
                        break;
                    case "--reducer.distinct-values":
                        builder.distinctValueLimit(Integer.parseInt(value));
                        break;
                    case "--reducer.sample-rows":
                        builder.bootstrapSampleRows(Integer.parseInt(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    static String extractConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if (CONFIG_FILE_OPTION.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --config <file>                  YAML configuration file
              --reducer.input-dir <dir>        Directory holding uploaded datasets
              --reducer.output-dir <dir>       Directory receiving exports
              --reducer.jdbc-url <url>         DuckDB JDBC URL (default jdbc:duckdb:)
              --reducer.query-timeout <sec>    Per-statement query timeout
              --reducer.preview-rows <num>     Default number of preview rows
              --reducer.distinct-values <num>  Default number of distinct values
              --reducer.sample-rows <num>      Sample rows included in bootstrap reports

            Environment Variables:
              REDUCER_INPUT_DIR                Same as --reducer.input-dir
              REDUCER_OUTPUT_DIR               Same as --reducer.output-dir
              REDUCER_JDBC_URL                 Same as --reducer.jdbc-url
              REDUCER_QUERY_TIMEOUT            Same as --reducer.query-timeout
              REDUCER_PREVIEW_ROWS             Same as --reducer.preview-rows
              REDUCER_DISTINCT_VALUES          Same as --reducer.distinct-values

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML configuration file
              4. Built-in defaults
            """;
    }
}
