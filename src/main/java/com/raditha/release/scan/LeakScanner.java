package com.raditha.release.scan;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import com.raditha.release.analysis.MethodNameReleaseClassifier;
import com.raditha.release.analysis.ReleaseFlowAnalyzer;
import com.raditha.release.cfg.ControlFlowGraphCache;
import com.raditha.release.config.ReleaseAnalysisConfig;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ReleaseVerdict;
import com.raditha.release.resolve.LexicalResolutionContext;
import com.raditha.release.resolve.ResolutionContext;
import com.raditha.release.resolve.SymbolSolverResolutionContext;
import com.raditha.release.util.JavaSources;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Finds resource leaks in Java source files.
 * <p>
 * Every procedure is searched for locals that receive a resource, and each
 * one is run through {@link ReleaseFlowAnalyzer}. Files are scanned in
 * parallel on a fixed pool. Each task parses with its own parser while all
 * of them share one graph cache, which is cleared when the scan ends.
 */
public class LeakScanner {
    private static final Logger logger = LoggerFactory.getLogger(LeakScanner.class);
    private static final String JAVA_EXTENSION = ".java";

    private final ReleaseAnalysisConfig config;
    private final ControlFlowGraphCache cache = new ControlFlowGraphCache();
    private final ReleaseFlowAnalyzer analyzer;
    private final ProcedureCollector procedureCollector = new ProcedureCollector();
    private final ResourceCandidateFinder candidateFinder;

    public LeakScanner(ReleaseAnalysisConfig config) {
        this.config = config;
        this.analyzer = new ReleaseFlowAnalyzer(MethodNameReleaseClassifier.from(config), cache, config);
        this.candidateFinder = new ResourceCandidateFinder(new ResourceTypeClassifier(config));
    }

    /**
     * Per-file outcome, merged into the report.
     */
    public record FileResult(List<LeakFinding> findings, int procedures, int variables, @Nullable String skipped) {

        static FileResult skipped(Path file, String why) {
            return new FileResult(List.of(), 0, 0, file + ": " + why);
        }
    }

    public ScanReport scan(List<Path> paths) throws IOException, InterruptedException {
        return scan(paths, AbortSignal.NONE);
    }

    /**
     * Scan files and directories.
     *
     * @param paths source files or directories to walk
     * @param abort checked between and inside analyses
     * @throws IOException if a path does not exist or a directory cannot be walked
     */
    public ScanReport scan(List<Path> paths, AbortSignal abort) throws IOException, InterruptedException {
        List<Path> files = collectFiles(paths);
        List<Path> sourceRoots = paths.stream().filter(Files::isDirectory).toList();
        int threads = config.useSymbolSolver() ? 1 : Math.min(config.threads(), Math.max(1, files.size()));
        logger.info("Scanning {} files on {} thread(s)", files.size(), threads);

        List<FileResult> results = new ArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileResult>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(pool.submit(() -> scanFile(file, newParser(sourceRoots), abort)));
            }
            for (Future<FileResult> future : futures) {
                results.add(await(future));
            }
        } finally {
            pool.shutdownNow();
            cache.clear();
        }
        return merge(results);
    }

    private static FileResult await(Future<FileResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Scan task failed", e.getCause());
        }
    }

    private JavaParser newParser(List<Path> sourceRoots) {
        return config.useSymbolSolver() ? JavaSources.symbolParser(sourceRoots) : JavaSources.syntaxParser();
    }

    /**
     * Expand directories into the Java files under them, dropping excluded
     * paths. Files named explicitly are kept even when excluded.
     */
    List<Path> collectFiles(List<Path> paths) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isRegularFile(path)) {
                files.add(path);
            } else if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    walk.filter(Files::isRegularFile)
                            .filter(p -> p.toString().endsWith(JAVA_EXTENSION))
                            .filter(p -> !config.shouldExclude(p.toString()))
                            .sorted()
                            .forEach(files::add);
                }
            } else {
                throw new IOException("Path not found: " + path);
            }
        }
        return files;
    }

    FileResult scanFile(Path file, JavaParser parser, AbortSignal abort) {
        abort.throwIfAborted();
        ParseResult<CompilationUnit> parsed;
        try {
            parsed = parser.parse(file);
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", file, e.getMessage());
            return FileResult.skipped(file, "unreadable");
        }
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            logger.warn("Could not parse {}: {}", file, parsed.getProblems());
            return FileResult.skipped(file, "parse error");
        }
        return scanCompilationUnit(parsed.getResult().get(), file, abort);
    }

    /**
     * Analyse every resource local of an already parsed compilation unit.
     */
    public FileResult scanCompilationUnit(CompilationUnit cu, Path file, AbortSignal abort) {
        ResolutionContext context = config.useSymbolSolver()
                ? new SymbolSolverResolutionContext()
                : new LexicalResolutionContext();
        List<LeakFinding> findings = new ArrayList<>();
        int procedures = 0;
        int variables = 0;

        for (Procedure procedure : procedureCollector.collect(cu)) {
            abort.throwIfAborted();
            List<ResourceCandidate> candidates = candidateFinder.find(procedure, context);
            if (candidates.isEmpty()) {
                continue;
            }
            procedures++;
            for (ResourceCandidate candidate : candidates) {
                variables++;
                ReleaseVerdict verdict = analyzer.analyze(procedure, candidate.variable(), context, abort);
                logger.debug("{} in {}: {} ({})", candidate.variable(), procedure, verdict.pattern(),
                        verdict.reason());
                if (!verdict.releasedOnAllPaths()) {
                    findings.add(LeakFinding.from(file, procedure.name(), procedure.line(), verdict));
                }
            }
        }
        return new FileResult(findings, procedures, variables, null);
    }

    private static ScanReport merge(List<FileResult> results) {
        List<LeakFinding> findings = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int files = 0;
        int procedures = 0;
        int variables = 0;
        for (FileResult result : results) {
            if (result.skipped() != null) {
                skipped.add(result.skipped());
                continue;
            }
            files++;
            procedures += result.procedures();
            variables += result.variables();
            findings.addAll(result.findings());
        }
        findings.sort(Comparator.comparing(LeakFinding::file).thenComparingInt(LeakFinding::line));
        return new ScanReport(findings, files, procedures, variables, skipped, LocalDateTime.now());
    }

    public ControlFlowGraphCache getCache() {
        return cache;
    }
}
