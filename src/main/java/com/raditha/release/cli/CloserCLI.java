package com.raditha.release.cli;

import com.raditha.release.config.ReleaseAnalysisConfig;
import com.raditha.release.config.ReleaseAnalysisSettings;
import com.raditha.release.report.ReportExporter;
import com.raditha.release.scan.LeakScanner;
import com.raditha.release.scan.ScanReport;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the resource release checker.
 * <p>
 * Usage:
 * java -jar closer.jar [options] <file-or-directory>...
 * <p>
 * Configuration priority: CLI arguments > closer.yml > defaults
 */
@Command(name = "closer", mixinStandardHelpOptions = true, version = "Closer v1.0.0",
        description = "Checks that every resource is released on all execution paths")
public class CloserCLI implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "<path>", description = "Java source files or directories to scan")
    private List<Path> paths;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--output", description = "Directory for exported reports (default: .)", paramLabel = "<path>")
    private Path outputPath;

    @Option(names = "--max-depth", description = "Longest execution path to enumerate (default: 100)",
            paramLabel = "<n>")
    private int maxDepth = 0; // 0 = use YAML/default

    @Option(names = "--threads", description = "Worker threads for scanning", paramLabel = "<n>")
    private int threads = 0; // 0 = use YAML/default

    @Option(names = "--thorough", description = "Thorough preset (symbol solver, more path evidence)")
    private boolean thorough = false;

    @Option(names = "--fast", description = "Fast preset (little path evidence, all processors)")
    private boolean fast = false;

    @Option(names = "--symbols", description = "Resolve names and types with the symbol solver")
    private boolean symbols = false;

    @Option(names = "--json", description = "Print the report as JSON")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export the report (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--fail-on-leak", description = "Exit with status 1 when a leak is found")
    private boolean failOnLeak = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, 1 when leaks were found and --fail-on-leak is set)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        ReleaseAnalysisConfig config = loadConfig();
        LeakScanner scanner = new LeakScanner(config);
        ScanReport report = scanner.scan(paths);

        ReportExporter exporter = new ReportExporter();
        PrintWriter out = spec.commandLine().getOut();
        if (jsonOutput) {
            out.println(exporter.toJson(report));
        } else {
            out.print(exporter.formatText(report));
        }
        if (exportFormat != null && !exportFormat.isEmpty()) {
            // keep stdout parseable when it carries JSON
            PrintWriter notices = jsonOutput ? spec.commandLine().getErr() : out;
            exportReport(exporter, report, notices);
            notices.flush();
        }
        out.flush();

        return failOnLeak && report.hasLeaks() ? 1 : 0;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * The configured command line with the exit code mapping installed.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new CloserCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            failed.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.getErr().print(failed.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Max-depth must be positive, got: " + maxDepth);
        }
        if (threads < 0) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase(Locale.ROOT);
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
            exportFormat = format;
        }

        if (thorough && fast) {
            throw new IllegalArgumentException("Cannot use both --thorough and --fast presets simultaneously");
        }

        if (configFile != null && !Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null && Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
        }
    }

    private ReleaseAnalysisConfig loadConfig() throws IOException {
        String preset = null;
        if (thorough) {
            preset = "thorough";
        } else if (fast) {
            preset = "fast";
        }

        ReleaseAnalysisConfig config = ReleaseAnalysisSettings.loadConfig(configFile, maxDepth, preset);
        if (threads != 0) {
            config = config.withThreads(threads);
        }
        if (symbols) {
            config = config.withSymbolSolver(true);
        }
        return config;
    }

    private void exportReport(ReportExporter exporter, ScanReport report, PrintWriter out) throws IOException {
        Path outputDir = outputPath != null ? outputPath : Path.of(".");

        if ("csv".equals(exportFormat) || "both".equals(exportFormat)) {
            Path csvPath = outputDir.resolve("closer-report.csv");
            exporter.exportToCsv(report, csvPath);
            out.println("✓ Report exported to: " + csvPath.toAbsolutePath());
        }

        if ("json".equals(exportFormat) || "both".equals(exportFormat)) {
            Path jsonPath = outputDir.resolve("closer-report.json");
            exporter.exportToJson(report, jsonPath);
            out.println("✓ Report exported to: " + jsonPath.toAbsolutePath());
        }
    }
}
