package com.raditha.release.scan;

import com.raditha.release.cfg.ExecutionPath;
import com.raditha.release.model.InterproceduralInfo;
import com.raditha.release.model.ReleaseVerdict;

import java.nio.file.Path;
import java.util.List;

/**
 * A variable that is not released on every path, flattened for reports.
 * Holds plain values only so it serializes without touching the AST.
 *
 * @param file              source file
 * @param procedure         procedure name
 * @param procedureLine     line of the procedure declaration
 * @param variable          variable name
 * @param line              line of the variable declaration
 * @param pattern           verdict pattern
 * @param reason            verdict reason
 * @param determined        false when the engine could not decide
 * @param syntacticFallback whether statement-order scanning produced the verdict
 * @param totalPaths        number of enumerated paths
 * @param problematicPaths  enumerated paths that miss a release, as block sequences
 * @param releaseLines      lines of the release calls that do exist
 * @param calleeAdvice      calls that might release the variable
 */
public record LeakFinding(
        String file,
        String procedure,
        int procedureLine,
        String variable,
        int line,
        String pattern,
        String reason,
        boolean determined,
        boolean syntacticFallback,
        int totalPaths,
        List<String> problematicPaths,
        List<Integer> releaseLines,
        List<String> calleeAdvice) {

    public LeakFinding {
        problematicPaths = List.copyOf(problematicPaths);
        releaseLines = List.copyOf(releaseLines);
        calleeAdvice = List.copyOf(calleeAdvice);
    }

    public static LeakFinding from(Path file, String procedure, int procedureLine, ReleaseVerdict verdict) {
        InterproceduralInfo callees = verdict.interproceduralInfo();
        return new LeakFinding(
                file.toString(),
                procedure,
                procedureLine,
                verdict.variable().name(),
                verdict.variable().line(),
                verdict.pattern().name(),
                verdict.reason(),
                verdict.succeeded(),
                verdict.syntacticFallback(),
                verdict.totalPaths(),
                verdict.problematicPaths().stream().map(ExecutionPath::describe).toList(),
                verdict.releaseEvents().stream().map(e -> e.line()).toList(),
                callees == null ? List.of() : callees.potentialReleasingCallees());
    }

    /**
     * Format as "Foo.java:12 in read(): 'in' Not released ...".
     */
    public String toDisplayString() {
        String name = Path.of(file).getFileName().toString();
        return name + ":" + line + " in " + procedure + "(): '" + variable + "' " + reason;
    }
}
