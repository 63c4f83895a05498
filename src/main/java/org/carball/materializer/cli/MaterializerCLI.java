package org.carball.materializer.cli;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.config.ConfigurationLoader;
import org.carball.materializer.config.MaterializationProfile;
import org.carball.materializer.config.MaterializerConfig;
import org.carball.materializer.config.OutputFormat;
import org.carball.materializer.database.DatabaseClient;
import org.carball.materializer.database.JdbcDatabaseClient;
import org.carball.materializer.model.backfill.BackfillJob;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.output.CycleReport;
import org.carball.materializer.pipeline.CycleResult;
import org.carball.materializer.pipeline.MaterializationCycle;
import org.carball.materializer.querylog.DatabaseQueryLogReader;
import org.carball.materializer.querylog.QueryLogFileReader;
import org.carball.materializer.querylog.QueryLogReader;
import org.carball.materializer.state.FileCycleLease;
import org.carball.materializer.state.JsonFileStateStore;
import org.carball.materializer.state.StateStore;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class MaterializerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║                  Column Materializer v%s                   ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(2);

    public static void main(String[] args) {
        System.exit(execute(args, System.out, System.err));
    }

    static int execute(String[] args, PrintStream out, PrintStream err) {
        out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage(out);
            return args.length < 1 ? 1 : 0;
        }

        try {
            CliOptions options = parseArgs(args);
            MaterializerConfig config = new ConfigurationLoader()
                    .loadConfiguration(options.getProfile(), options.getConfigFile(), args);
            StateStore stateStore = new JsonFileStateStore(options.getStateDirectory());

            return switch (options.getCommand()) {
                case "status" -> {
                    printStatus(stateStore, out);
                    yield 0;
                }
                case "plan" -> runPlan(options, config, stateStore, out);
                default -> runCycle(options, config, stateStore, out);
            };

        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
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

    private static int runPlan(CliOptions options, MaterializerConfig config, StateStore stateStore,
                               PrintStream out) throws IOException {
        out.println("\n🔍 Planning materialization...");
        DatabaseClient databaseClient = options.getJdbcUrl() != null ? new JdbcDatabaseClient(options.getJdbcUrl()) : null;
        QueryLogReader reader = createQueryLogReader(options, databaseClient, config);
        printSources(options, reader, config, out);

        MaterializationCycle cycle = new MaterializationCycle(config, reader, databaseClient, stateStore,
                new FileCycleLease(options.getStateDirectory(), config.getLeaseTtl()));
        CycleResult result = cycle.plan();

        writeReport(result, config, options, out);
        printSummary(result, out);
        return result.status() == CycleResult.Status.FAILED ? 1 : 0;
    }

    private static int runCycle(CliOptions options, MaterializerConfig config, StateStore stateStore,
                                PrintStream out) throws IOException {
        if (options.getJdbcUrl() == null) {
            throw new IllegalArgumentException("The run command needs --jdbc-url to change the schema");
        }

        out.println("\n🔍 Starting materialization cycle...");
        DatabaseClient databaseClient = new JdbcDatabaseClient(options.getJdbcUrl());
        QueryLogReader reader = createQueryLogReader(options, databaseClient, config);
        printSources(options, reader, config, out);

        MaterializationCycle cycle = new MaterializationCycle(config, reader, databaseClient, stateStore,
                new FileCycleLease(options.getStateDirectory(), config.getLeaseTtl()));

        Thread shutdownHook = new Thread(() -> {
            cycle.getCoordinator().abort();
            try {
                if (!cycle.getCoordinator().awaitIdle(SHUTDOWN_GRACE)) {
                    log.warn("Backfills still running after {}, exiting anyway", SHUTDOWN_GRACE);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "materializer-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        CycleResult result;
        try {
            result = cycle.run();
        } finally {
            removeShutdownHook(shutdownHook);
        }

        writeReport(result, config, options, out);
        printSummary(result, out);

        if (result.status() == CycleResult.Status.SKIPPED) {
            out.println("\n⏭️  Another cycle holds the lease, nothing to do.");
            return 0;
        }
        return result.status() == CycleResult.Status.FAILED ? 1 : 0;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is already shutting down, shutdown hook stays registered");
        }
    }

    private static QueryLogReader createQueryLogReader(CliOptions options, DatabaseClient databaseClient,
                                                       MaterializerConfig config) throws IOException {
        if (options.getQueryLogFile() != null) {
            if (!Files.exists(options.getQueryLogFile())) {
                throw new IllegalArgumentException("Query log export file not found: " + options.getQueryLogFile());
            }
            return new QueryLogFileReader(options.getQueryLogFile());
        }
        if (databaseClient == null) {
            throw new IllegalArgumentException("Either --jdbc-url or --query-log-file is required");
        }
        return new DatabaseQueryLogReader(databaseClient, config.getStatementTimeout());
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream out) {
        out.println("\nUsage: java -jar column-materializer.jar <run|plan|status> [options]");
        out.println();
        out.println("Commands:");
        out.println("  run                 Select hot properties, add their columns and backfill them");
        out.println("  plan                Show which properties would be selected, without changing anything");
        out.println("  status              Show recorded candidates and backfill jobs");
        out.println();
        out.println("Options:");
        out.println("  --jdbc-url          ClickHouse JDBC URL (e.g. " + JdbcDatabaseClient.createLocalConnectionString() + ")");
        out.println("  --query-log-file    JSON query log export to analyze instead of system.query_log");
        out.println("  --state-dir         Directory for state and lease files (default: .materializer)");
        out.println("  --config            YAML configuration file");
        out.println("  --profile           Settings profile: " + MaterializationProfile.getAvailableProfiles());
        out.println("  --output, -o        Report file (default: materialization-report.json)");
        out.println("  --format, -f        Report format: json|markdown|both (default: json)");
        out.println("  --config.<name>     Override one setting, e.g. --config.top-n 5");
        out.println("  --verbose, -v       Enable verbose output");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  # Preview the selection from an exported query log");
        out.println("  java -jar column-materializer.jar plan --query-log-file query-log.json");
        out.println();
        out.println("  # Run a cycle against a local server with the aggressive profile");
        out.println("  java -jar column-materializer.jar run --jdbc-url jdbc:clickhouse://localhost:8123/default --profile aggressive");
        out.println();
        out.println(MaterializationProfile.getProfileHelp());
        out.println(ConfigurationLoader.getConfigurationHelp());
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();

        String command = args[0].toLowerCase();
        if (!List.of("run", "plan", "status").contains(command)) {
            throw new IllegalArgumentException("Unknown command: " + args[0] + ". Use run, plan or status");
        }
        options.setCommand(command);

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--jdbc-url":
                    options.setJdbcUrl(requireValue(args, i++, "JDBC URL not specified"));
                    break;

                case "--query-log-file":
                    options.setQueryLogFile(Paths.get(requireValue(args, i++, "Query log export file not specified")));
                    break;

                case "--state-dir":
                    options.setStateDirectory(Paths.get(requireValue(args, i++, "State directory not specified")));
                    break;

                case "--config":
                    options.setConfigFile(Paths.get(requireValue(args, i++, "Configuration file not specified")));
                    break;

                case "--profile":
                    options.setProfile(requireValue(args, i++, "Profile not specified"));
                    break;

                case "--output":
                case "-o":
                    options.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        options.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--verbose":
                case "-v":
                    options.setVerbose(true);
                    break;

                default:
                    if (args[i].startsWith("--config.")) {
                        // Value is picked up by ConfigurationLoader
                        String setting = args[i];
                        requireValue(args, i++, "Value not specified for " + setting);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        String baseFileName = removeFileExtension(options.getOutputFile());
        options.setOutputFile(baseFileName + (options.getOutputFormat() == OutputFormat.MARKDOWN ? ".md" : ".json"));

        Path outputDir = Paths.get(options.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }

        return options;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void printSources(CliOptions options, QueryLogReader reader, MaterializerConfig config,
                                     PrintStream out) {
        out.println("   Query log: " + reader.describe());
        out.println("   State directory: " + options.getStateDirectory());
        if (options.getOutputFormat() == OutputFormat.BOTH) {
            String baseFileName = removeFileExtension(options.getOutputFile());
            out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
        } else {
            out.println("   Output: " + options.getOutputFile());
        }
        if (options.isVerbose()) {
            out.println("   Settings: " + config.getConfigurationSummary());
        }
        out.println();
    }

    private static void writeReport(CycleResult result, MaterializerConfig config, CliOptions options,
                                    PrintStream out) throws IOException {
        out.print("📝 Writing report... ");
        CycleReport report = new CycleReport(result, config);
        String baseFileName = removeFileExtension(options.getOutputFile());

        if (options.getOutputFormat() == OutputFormat.JSON || options.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        }
        if (options.getOutputFormat() == OutputFormat.MARKDOWN || options.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        }
        out.println("✓");
    }

    private static void printSummary(CycleResult result, PrintStream out) {
        out.println("\n" + "=".repeat(60));
        out.println("📊 CYCLE SUMMARY (" + result.status() + ")");
        out.println("=".repeat(60));

        if (result.summary() != null) {
            out.println("\nQueries analyzed: " + result.summary().recordsAnalyzed()
                    + " of " + result.summary().recordsScanned());
            out.println("Parse errors: " + result.summary().parseErrors());
            out.println("Properties seen: " + result.summary().usages().size());
        }
        if (result.message() != null) {
            out.println("\n" + result.message());
        }

        out.println("\n🎯 Selected properties:");
        out.println("-".repeat(60));
        for (MaterializationCandidate candidate : result.candidates()) {
            out.printf("%-40s → %-20s %s%n",
                    candidate.getKey(), candidate.getColumnName(), candidate.getState());
        }
        if (result.candidates().isEmpty()) {
            out.println("\n💡 No property crossed the usage threshold.");
        }

        if (!result.schemaFailures().isEmpty()) {
            out.println("\n⚠️  Needs manual review:");
            result.schemaFailures().forEach((column, reason) -> out.println("  └─ " + column + ": " + reason));
        }
    }

    private static void printStatus(StateStore stateStore, PrintStream out) {
        List<MaterializationCandidate> candidates = stateStore.candidates();
        List<BackfillJob> jobs = stateStore.jobs();

        out.println("\n📋 Candidates (" + candidates.size() + ")");
        out.println("-".repeat(60));
        for (MaterializationCandidate candidate : candidates) {
            out.printf("%-40s %-20s %s%n", candidate.getKey(), candidate.getColumnName(), candidate.getState());
            if (candidate.getFailureReason() != null) {
                out.println("  └─ " + candidate.getFailureReason());
            }
        }

        out.println("\n🔄 Backfill jobs (" + jobs.size() + ")");
        out.println("-".repeat(60));
        for (BackfillJob job : jobs) {
            out.printf("%-40s %-10s %d/%d partitions%n", job.getKey(), job.getState(),
                    job.getNextPartitionIndex(), job.getPartitions().size());
            if (job.getLastError() != null) {
                out.println("  └─ " + job.getLastError());
            }
        }
    }

    @Data
    static class CliOptions {
        private String command;
        private String jdbcUrl;
        private Path queryLogFile;
        private Path stateDirectory = Paths.get(".materializer");
        private Path configFile;
        private String profile;
        private String outputFile = "materialization-report.json";
        private OutputFormat outputFormat = OutputFormat.JSON;
        private boolean verbose;
    }
}
