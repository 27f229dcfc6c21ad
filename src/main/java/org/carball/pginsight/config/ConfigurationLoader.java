package org.carball.pginsight.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_EXPLAIN_CAP = "PGINSIGHT_EXPLAIN_CAP";
    static final String ENV_TIMEOUT = "PGINSIGHT_TIMEOUT";
    static final String ENV_PGURL = "PGURL";
    static final String ENV_DATABASE_URL = "DATABASE_URL";

    private final Map<String, String> env;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> env) {
        this.env = env;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > thresholds file > defaults
     */
    public InsightConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        InsightConfig config = new InsightConfig();

        // 1. Thresholds file
        config.setThresholds(loadThresholds(extractOption(args, "--thresholds")));

        // 2. Environment variables
        applyEnvironmentVariables(config);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(config, args);

        applyOutputExtension(config);
        validate(config);
        config.getThresholds().validate();

        log.info("Configuration loaded: {}", config.getThresholds().getConfigurationSummary());
        return config;
    }

    /**
     * Loads thresholds from a YAML file, or defaults when no file is given or it cannot be read.
     */
    public InsightThresholds loadThresholds(String path) {
        if (path == null || path.trim().isEmpty()) {
            log.debug("No thresholds file provided, using defaults");
            return InsightThresholds.defaults();
        }

        File file = new File(path);
        if (!file.exists()) {
            log.warn("Thresholds file not found: {}, using defaults", path);
            return InsightThresholds.defaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            InsightThresholds thresholds = mapper.readValue(file, InsightThresholds.class);
            log.info("Loaded thresholds from: {}", path);
            return thresholds;
        } catch (IOException e) {
            log.error("Failed to load thresholds from {}: {}, using defaults", path, e.getMessage());
            return InsightThresholds.defaults();
        }
    }

    private void applyEnvironmentVariables(InsightConfig config) {
        String url = firstNonBlank(env.get(ENV_PGURL), env.get(ENV_DATABASE_URL));
        if (url != null) {
            config.setUrl(url);
        }

        if (env.containsKey(ENV_EXPLAIN_CAP)) {
            try {
                config.getThresholds().setExplainListCap(Integer.parseInt(env.get(ENV_EXPLAIN_CAP).trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", ENV_EXPLAIN_CAP, env.get(ENV_EXPLAIN_CAP));
            }
        }
        if (env.containsKey(ENV_TIMEOUT)) {
            try {
                config.setTimeout(Durations.parse(env.get(ENV_TIMEOUT)));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid duration for {}: {}", ENV_TIMEOUT, env.get(ENV_TIMEOUT));
            }
        }
    }

    private void applyCLIArguments(InsightConfig config, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--url":
                    config.setUrl(requireValue(args, i++, "Connection URL not specified"));
                    break;

                case "--out":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--timeout":
                    config.setTimeout(Durations.parse(requireValue(args, i++, "Timeout not specified")));
                    break;

                case "--stats-since":
                    config.setStatsSince(Durations.parse(requireValue(args, i++, "Stats window not specified")));
                    break;

                case "--dbs":
                    config.setDatabases(splitList(requireValue(args, i++, "Database list not specified")));
                    break;

                case "--suppress":
                    config.setSuppress(splitList(requireValue(args, i++, "Suppression codes not specified")));
                    break;

                case "--thresholds":
                    // loaded before environment overrides
                    requireValue(args, i++, "Thresholds file not specified");
                    break;

                case "--explain-cap":
                    String cap = requireValue(args, i++, "Explain cap not specified");
                    try {
                        config.getThresholds().setExplainListCap(Integer.parseInt(cap));
                    } catch (NumberFormatException e) {
                        log.warn("Invalid numeric value for {}: {}", arg, cap);
                    }
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    config.setUrl(arg);
                    break;
            }
        }
    }

    private static void applyOutputExtension(InsightConfig config) {
        String baseFileName = removeFileExtension(config.getOutputFile());
        if (config.getOutputFormat() == OutputFormat.MARKDOWN) {
            config.setOutputFile(baseFileName + ".md");
        } else {
            config.setOutputFile(baseFileName + ".json");
        }
    }

    private static void validate(InsightConfig config) {
        if (config.getUrl() == null || config.getUrl().isBlank()) {
            throw new IllegalArgumentException(
                    "Connection URL required. Use --url, a positional argument, or set PGURL / DATABASE_URL");
        }
        if (config.getTimeout().compareTo(InsightConfig.MIN_TIMEOUT) < 0) {
            throw new IllegalArgumentException("Timeout must be at least "
                    + Durations.format(InsightConfig.MIN_TIMEOUT));
        }
        if (config.getTimeout().compareTo(InsightConfig.MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException("Timeout exceeds maximum of "
                    + Durations.format(InsightConfig.MAX_TIMEOUT));
        }
        if (config.getStatsSince() != null && (config.getStatsSince().isNegative() || config.getStatsSince().isZero())) {
            throw new IllegalArgumentException("Stats window must be positive");
        }
    }

    public static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static String requireValue(String[] args, int optionIndex, String message) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[optionIndex + 1];
    }

    private static String extractOption(String[] args, String option) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    /**
     * Returns help text for configuration sources.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Sources:

            Thresholds file (--thresholds <file.yml>):
              explain_list_cap: 10        Statements explained per ranked list
              seq_scan_tables_shown: 8    Tables listed in the seq scan recommendation
              ranked_list_limit: 20       Rows fetched per ranked list

            Environment Variables:
              PGURL, DATABASE_URL         Connection URL when --url is not given
              PGINSIGHT_EXPLAIN_CAP       Same as --explain-cap
              PGINSIGHT_TIMEOUT           Same as --timeout

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Thresholds file
              4. Built-in defaults
            """;
    }
}
