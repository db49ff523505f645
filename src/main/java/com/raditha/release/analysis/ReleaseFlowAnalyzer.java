package com.raditha.release.analysis;

import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.raditha.release.cfg.BasicBlock;
import com.raditha.release.cfg.ControlFlowGraph;
import com.raditha.release.cfg.ControlFlowGraphCache;
import com.raditha.release.cfg.ExecutionPath;
import com.raditha.release.cfg.PathEnumerator;
import com.raditha.release.config.ReleaseAnalysisConfig;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.InterproceduralInfo;
import com.raditha.release.model.LoopReleaseInfo;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ReleaseEvent;
import com.raditha.release.model.ReleasePattern;
import com.raditha.release.model.ReleaseVerdict;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.LexicalResolutionContext;
import com.raditha.release.resolve.ResolutionContext;
import com.raditha.release.util.ASTUtility;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point of the release analysis: decides whether a tracked variable
 * is released on every path out of a procedure.
 * <p>
 * The checks run cheapest first and stop at the first conclusive one:
 * <ol>
 *     <li>try-with-resources owns the variable</li>
 *     <li>a finally block releases it</li>
 *     <li>the control-flow graph is built, or the statement-order fallback takes over</li>
 *     <li>every exit returns the variable to the caller</li>
 *     <li>there is no release at all</li>
 *     <li>the all-paths dataflow</li>
 * </ol>
 * The loop pass may then downgrade a positive verdict, and the callee pass
 * attaches advice to a negative one.
 * <p>
 * One instance may serve many threads. The graph cache is the only state it
 * shares between calls.
 */
public class ReleaseFlowAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(ReleaseFlowAnalyzer.class);

    static final String LOOP_MISMATCH_REASON = "Variable released inside a loop but created outside it";
    static final String CALLEE_SUFFIX = " (possibly released in called method)";

    private final ControlFlowGraphCache cache;
    private final PathEnumerator pathEnumerator;
    private final ReleaseEventLocator locator;
    private final CleanupPatterns cleanupPatterns = new CleanupPatterns();
    private final OwnershipTransferResolver ownership = new OwnershipTransferResolver();
    private final AllPathsReleaseChecker checker = new AllPathsReleaseChecker();
    private final LoopReleaseAnnotator loopAnnotator = new LoopReleaseAnnotator();
    private final InterproceduralAnnotator interproceduralAnnotator;
    private final SyntacticFallbackAnalyzer fallback;

    public ReleaseFlowAnalyzer(ReleaseClassifier classifier) {
        this(classifier, new ControlFlowGraphCache(), ReleaseAnalysisConfig.defaults());
    }

    public ReleaseFlowAnalyzer(ReleaseClassifier classifier, ControlFlowGraphCache cache,
                               ReleaseAnalysisConfig config) {
        Objects.requireNonNull(classifier, "classifier");
        this.cache = Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(config, "config");
        this.pathEnumerator = new PathEnumerator(config.maxPathDepth(), config.maxBlockRepeats(), config.maxPaths());
        this.locator = new ReleaseEventLocator(classifier);
        this.interproceduralAnnotator = InterproceduralAnnotator.from(config);
        this.fallback = new SyntacticFallbackAnalyzer(locator, cleanupPatterns, ownership);
    }

    public ReleaseVerdict analyze(Procedure procedure, TrackedVariable variable) {
        return analyze(procedure, variable, null, AbortSignal.NONE);
    }

    /**
     * Analyse one variable.
     *
     * @param context name resolution to use; lexical scoping when null
     * @param abort   polled throughout; raises {@code AnalysisAbortedException}
     */
    public ReleaseVerdict analyze(Procedure procedure, TrackedVariable variable,
                                  @Nullable ResolutionContext context, AbortSignal abort) {
        Objects.requireNonNull(procedure, "procedure");
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(abort, "abort");
        ResolutionContext resolution = context != null ? context : new LexicalResolutionContext();

        if (procedure.body().isEmpty() && procedure.expressionBody().isEmpty()) {
            return ReleaseVerdict.undetermined(variable, "Procedure has no body", List.of());
        }

        // 1. Scoped acquisition
        if (cleanupPatterns.isScopedAcquisition(procedure, variable, resolution)) {
            return ReleaseVerdict.released(variable, ReleasePattern.SCOPED_ACQUISITION,
                    "Managed by try-with-resources", List.of());
        }

        // 2. Guaranteed cleanup
        List<ReleaseEvent> events = locator.locate(procedure, variable, resolution, abort);
        Optional<ReleaseEvent> cleanup = cleanupPatterns.releaseInFinally(procedure, events);
        if (cleanup.isPresent()) {
            return ReleaseVerdict.released(variable, ReleasePattern.GUARANTEED_CLEANUP,
                    "Released in finally block: " + cleanup.get().describe(), events);
        }

        // 3. Graph, or statement order when there is none
        Optional<ControlFlowGraph> graph = cache.get(procedure, abort);
        if (graph.isEmpty()) {
            logger.debug("No control flow graph for {}, falling back to statement order", procedure);
            VariableFacts facts = new VariableFacts(procedure, variable, events, Set.of(), resolution, ownership);
            return fallback.scan(facts, resolution, abort);
        }
        ControlFlowGraph cfg = graph.get();
        VariableFacts facts = new VariableFacts(procedure, variable, events,
                locator.releaseBlocks(cfg, events), resolution, ownership);

        // 4. Ownership transfer
        if (ownership.isOwnershipTransferred(procedure, variable, resolution, cfg, abort)) {
            return ReleaseVerdict.released(variable, ReleasePattern.OWNERSHIP_TRANSFER,
                    "Ownership transferred to the caller", events);
        }

        // 5. Nothing releases it
        if (events.isEmpty()) {
            return annotateCallees(ReleaseVerdict.notReleased(variable, ReleasePattern.NONE,
                    "No release operations found", events), procedure, resolution, abort);
        }

        // 6. Dataflow, with enumerated paths as evidence
        List<ExecutionPath> paths = pathEnumerator.findAllPaths(cfg, abort);
        Optional<BasicBlock> violation = checker.findUnreleasedExit(cfg, facts, abort);
        ReleaseVerdict verdict;
        if (violation.isEmpty()) {
            verdict = ReleaseVerdict.released(variable, ReleasePattern.EXPLICIT_ALL_PATHS,
                    "Released on all execution paths", events).withPaths(paths.size(), List.of());
        } else {
            List<ExecutionPath> problematic = paths.stream().filter(p -> checker.violates(p, facts, abort)).toList();
            verdict = ReleaseVerdict.notReleased(variable, ReleasePattern.INCOMPLETE,
                    describeViolation(violation.get(), problematic.size(), paths.size()), events)
                    .withPaths(paths.size(), problematic);
        }

        // 7. Loop scope
        LoopReleaseInfo loopInfo = loopAnnotator.annotate(cfg, facts, abort);
        verdict = verdict.withLoopInfo(loopInfo);
        if (loopInfo.scopeMismatch()) {
            verdict = verdict.releasedOnAllPaths()
                    ? verdict.downgrade(LOOP_MISMATCH_REASON)
                    : verdict.downgrade(verdict.reason() + "; " + LOOP_MISMATCH_REASON.toLowerCase(Locale.ROOT));
        }

        // 8. Callees
        return annotateCallees(verdict, procedure, resolution, abort);
    }

    private ReleaseVerdict annotateCallees(ReleaseVerdict verdict, Procedure procedure, ResolutionContext context,
                                           AbortSignal abort) {
        InterproceduralInfo info = interproceduralAnnotator.annotate(procedure, verdict.variable(), context, abort);
        String reason = verdict.reason();
        if (!verdict.releasedOnAllPaths() && info.mayBeReleasedByCallee()) {
            reason = reason + CALLEE_SUFFIX;
        }
        return verdict.withInterproceduralInfo(info, reason);
    }

    private static String describeViolation(BasicBlock block, int problematic, int total) {
        String where = block.isExit()
                ? "the end of the procedure"
                : block.operations().stream()
                    .filter(op -> op instanceof ReturnStmt || op instanceof ThrowStmt)
                    .findFirst()
                    .map(op -> "the exit at line " + ASTUtility.lineOf(op))
                    .orElse("block " + block);
        if (total == 0) {
            return "Not released before " + where;
        }
        return "Not released before " + where + "; " + problematic + " of " + total
                + " enumerated paths lack a release";
    }

    public ControlFlowGraphCache getCache() {
        return cache;
    }
}
