package org.carball.materializer.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "MATCOL_";
    static final String CLI_PREFIX = "--config.";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > profile > defaults.
     * A null profile name or config file skips that layer.
     */
    public MaterializerConfig loadConfiguration(String profileName, Path configFile, String[] args) throws IOException {
        log.debug("Loading configuration");

        MaterializerConfig.MaterializerConfigBuilder builder = profileName != null
                ? loadProfile(profileName).toBuilder()
                : MaterializerConfig.builder();

        if (configFile != null) {
            applyConfigFile(builder, configFile);
        }
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        MaterializerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    public MaterializerConfig loadConfiguration(String[] args) {
        try {
            return loadConfiguration(null, null, args);
        } catch (IOException e) {
            // unreachable without a config file
            throw new IllegalStateException(e);
        }
    }

    public MaterializerConfig loadProfile(String profileName) {
        try {
            MaterializationProfile profile = MaterializationProfile.fromName(profileName);
            MaterializerConfig config = profile.buildConfig();
            log.info("Loaded profile '{}': {}", profileName, config.getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    private void applyConfigFile(MaterializerConfig.MaterializerConfigBuilder builder, Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IOException("Configuration file not found: " + configFile);
        }

        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        JsonNode root = yamlMapper.readTree(configFile.toFile());
        if (root == null || !root.isObject()) {
            log.warn("Configuration file {} is empty or not a mapping, ignoring it", configFile);
            return;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            applySetting(builder, field.getKey(), field.getValue().asText(), "file " + configFile.getFileName());
        }
    }

    private void applyEnvironmentVariables(MaterializerConfig.MaterializerConfigBuilder builder) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (entry.getKey().startsWith(ENV_PREFIX)) {
                String name = entry.getKey().substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT);
                applySetting(builder, name, entry.getValue(), "environment");
            }
        }
    }

    private void applyCLIArguments(MaterializerConfig.MaterializerConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].startsWith(CLI_PREFIX)) {
                String name = args[i].substring(CLI_PREFIX.length()).replace('-', '_');
                applySetting(builder, name, args[i + 1], "command line");
                i++;
            }
        }
    }

    private void applySetting(MaterializerConfig.MaterializerConfigBuilder builder, String name, String value, String source) {
        try {
            switch (name) {
                case "trailing_window_days" -> builder.trailingWindowDays(Integer.parseInt(value));
                case "top_n" -> builder.topN(Integer.parseInt(value));
                case "min_usage_threshold" -> builder.minUsageThreshold(Long.parseLong(value));
                case "savings_ratio" -> builder.savingsRatio(Double.parseDouble(value));
                case "bytes_per_ms" -> builder.bytesPerMs(Double.parseDouble(value));
                case "chunk_size" -> builder.chunkSize(Integer.parseInt(value));
                case "max_retries" -> builder.maxRetries(Integer.parseInt(value));
                case "backoff_initial_ms" -> builder.backoffInitialMs(Long.parseLong(value));
                case "backoff_max_ms" -> builder.backoffMaxMs(Long.parseLong(value));
                case "backfill_parallelism" -> builder.backfillParallelism(Integer.parseInt(value));
                case "statement_timeout_seconds" -> builder.statementTimeoutSeconds(Integer.parseInt(value));
                case "raw_column" -> builder.rawColumn(value);
                case "column_prefix" -> builder.columnPrefix(value);
                case "lease_ttl_minutes" -> builder.leaseTtlMinutes(Integer.parseInt(value));
                default -> log.warn("Ignoring unknown setting '{}' from {}", name, source);
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {} from {}: {}", name, source, value);
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            Settings (YAML key / CLI argument / environment variable):
              trailing_window_days       --config.trailing-window-days       MATCOL_TRAILING_WINDOW_DAYS
              top_n                      --config.top-n                      MATCOL_TOP_N
              min_usage_threshold        --config.min-usage-threshold        MATCOL_MIN_USAGE_THRESHOLD
              savings_ratio              --config.savings-ratio              MATCOL_SAVINGS_RATIO
              bytes_per_ms               --config.bytes-per-ms               MATCOL_BYTES_PER_MS
              chunk_size                 --config.chunk-size                 MATCOL_CHUNK_SIZE
              max_retries                --config.max-retries                MATCOL_MAX_RETRIES
              backoff_initial_ms         --config.backoff-initial-ms         MATCOL_BACKOFF_INITIAL_MS
              backoff_max_ms             --config.backoff-max-ms             MATCOL_BACKOFF_MAX_MS
              backfill_parallelism       --config.backfill-parallelism       MATCOL_BACKFILL_PARALLELISM
              statement_timeout_seconds  --config.statement-timeout-seconds  MATCOL_STATEMENT_TIMEOUT_SECONDS
              raw_column                 --config.raw-column                 MATCOL_RAW_COLUMN
              column_prefix              --config.column-prefix              MATCOL_COLUMN_PREFIX
              lease_ttl_minutes          --config.lease-ttl-minutes          MATCOL_LEASE_TTL_MINUTES

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file (--config)
              4. Profile (--profile) or built-in defaults
            """;
    }
}
