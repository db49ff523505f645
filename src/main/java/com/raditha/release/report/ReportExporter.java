package com.raditha.release.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.release.scan.LeakFinding;
import com.raditha.release.scan.ScanReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders a {@link ScanReport} as text for the console and exports it as
 * JSON or CSV for dashboards and CI.
 */
public class ReportExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * JSON layout of an exported report. Keeps the AST out of the output.
     */
    public record ReportDTO(String tool, LocalDateTime timestamp, SummaryDTO summary,
                            List<LeakFinding> findings, List<String> skippedFiles) {
    }

    public record SummaryDTO(int filesScanned, int proceduresAnalyzed, int variablesAnalyzed,
                             long leaks, long undetermined) {
    }

    public ReportDTO toDTO(ScanReport report) {
        SummaryDTO summary = new SummaryDTO(report.filesScanned(), report.proceduresAnalyzed(),
                report.variablesAnalyzed(), report.leakCount(), report.undeterminedCount());
        return new ReportDTO("closer", report.timestamp(), summary, report.findings(), report.skippedFiles());
    }

    public String toJson(ScanReport report) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDTO(report));
    }

    public void exportToJson(ScanReport report, Path outputPath) throws IOException {
        createParent(outputPath);
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), toDTO(report));
    }

    /**
     * Export findings to CSV: a summary section followed by one row per
     * finding.
     */
    public void exportToCsv(ScanReport report, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Summary\n");
        csv.append("timestamp,files_scanned,procedures_analyzed,variables_analyzed,leaks,undetermined\n");
        csv.append(String.format("%s,%d,%d,%d,%d,%d\n",
                report.timestamp().format(TIMESTAMP_FORMAT),
                report.filesScanned(),
                report.proceduresAnalyzed(),
                report.variablesAnalyzed(),
                report.leakCount(),
                report.undeterminedCount()));

        csv.append("\n");

        csv.append("# Findings\n");
        csv.append("file,procedure,variable,line,pattern,determined,syntactic_fallback,total_paths,"
                + "problematic_paths,reason\n");
        for (LeakFinding finding : report.findings()) {
            csv.append(String.format("%s,%s,%s,%d,%s,%b,%b,%d,%d,%s\n",
                    csvField(finding.file()),
                    csvField(finding.procedure()),
                    csvField(finding.variable()),
                    finding.line(),
                    finding.pattern(),
                    finding.determined(),
                    finding.syntacticFallback(),
                    finding.totalPaths(),
                    finding.problematicPaths().size(),
                    csvField(finding.reason())));
        }

        createParent(outputPath);
        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Human readable report for the console.
     */
    public String formatText(ScanReport report) {
        StringBuilder out = new StringBuilder();
        out.append("=".repeat(80)).append('\n');
        out.append("RESOURCE RELEASE REPORT").append('\n');
        out.append("=".repeat(80)).append('\n');
        out.append('\n');
        out.append(String.format("Files scanned: %d\n", report.filesScanned()));
        out.append(String.format("Procedures with resources: %d\n", report.proceduresAnalyzed()));
        out.append(String.format("Resource variables analyzed: %d\n", report.variablesAnalyzed()));
        out.append(String.format("Possible leaks: %d\n", report.leakCount()));
        out.append(String.format("Undetermined: %d\n", report.undeterminedCount()));
        out.append('\n');

        if (report.findings().isEmpty()) {
            out.append("✓ Every resource is released on all paths").append('\n');
        }

        String currentFile = null;
        for (LeakFinding finding : report.findings()) {
            if (!finding.file().equals(currentFile)) {
                currentFile = finding.file();
                out.append("-".repeat(80)).append('\n');
                out.append("File: ").append(currentFile).append('\n');
                out.append("-".repeat(80)).append('\n');
            }
            out.append(String.format("  %s '%s' (line %d) in %s()\n",
                    finding.determined() ? "✗ LEAK" : "? UNDETERMINED",
                    finding.variable(), finding.line(), finding.procedure()));
            out.append("    ").append(finding.reason()).append('\n');
            if (!finding.releaseLines().isEmpty()) {
                out.append("    Released at lines: ").append(finding.releaseLines()).append('\n');
            }
            for (String path : finding.problematicPaths()) {
                out.append("    → ").append(path).append('\n');
            }
            for (String callee : finding.calleeAdvice()) {
                out.append("    ⚠ May be released by ").append(callee).append('\n');
            }
            if (finding.syntacticFallback()) {
                out.append("    (statement-order scan, no control flow graph)").append('\n');
            }
        }

        if (!report.skippedFiles().isEmpty()) {
            out.append('\n');
            out.append("Skipped files:").append('\n');
            for (String skipped : report.skippedFiles()) {
                out.append("  ").append(skipped).append('\n');
            }
        }
        return out.toString();
    }

    static String csvField(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static void createParent(Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
