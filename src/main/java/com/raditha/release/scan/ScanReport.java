package com.raditha.release.scan;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of scanning a set of source files.
 *
 * @param findings           leaks and undetermined verdicts, ordered by file and line
 * @param filesScanned       files parsed successfully
 * @param proceduresAnalyzed procedures that had at least one candidate
 * @param variablesAnalyzed  candidate variables analysed
 * @param skippedFiles       files that could not be read or parsed
 * @param timestamp          when the scan finished
 */
public record ScanReport(
        List<LeakFinding> findings,
        int filesScanned,
        int proceduresAnalyzed,
        int variablesAnalyzed,
        List<String> skippedFiles,
        LocalDateTime timestamp) {

    public ScanReport {
        findings = List.copyOf(findings);
        skippedFiles = List.copyOf(skippedFiles);
    }

    public boolean hasLeaks() {
        return findings.stream().anyMatch(LeakFinding::determined);
    }

    public long leakCount() {
        return findings.stream().filter(LeakFinding::determined).count();
    }

    public long undeterminedCount() {
        return findings.stream().filter(f -> !f.determined()).count();
    }
}
