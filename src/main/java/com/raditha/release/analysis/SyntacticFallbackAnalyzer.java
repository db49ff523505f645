package com.raditha.release.analysis;

import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ReleaseEvent;
import com.raditha.release.model.ReleasePattern;
import com.raditha.release.model.ReleaseVerdict;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.ResolutionContext;
import com.raditha.release.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Statement-order analysis for procedures without a control-flow graph.
 * <p>
 * Only the top level statements are read. Each explicit exit needs a release
 * somewhere before it, and so does the end of the body unless the last
 * statement already left. Nested if, loop, switch and try statements cannot
 * be seen into: an exit inside one, or one standing between the end of the
 * body and the last release, makes the result undetermined. Nothing is
 * reported released unless the scan proves it.
 */
public class SyntacticFallbackAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(SyntacticFallbackAnalyzer.class);

    private final ReleaseEventLocator locator;
    private final CleanupPatterns cleanupPatterns;
    private final OwnershipTransferResolver ownership;

    public SyntacticFallbackAnalyzer(ReleaseClassifier classifier) {
        this(new ReleaseEventLocator(classifier), new CleanupPatterns(), new OwnershipTransferResolver());
    }

    SyntacticFallbackAnalyzer(ReleaseEventLocator locator, CleanupPatterns cleanupPatterns,
                              OwnershipTransferResolver ownership) {
        this.locator = locator;
        this.cleanupPatterns = cleanupPatterns;
        this.ownership = ownership;
    }

    /**
     * Full fallback analysis including the scoped acquisition and finally
     * checks.
     */
    public ReleaseVerdict analyze(Procedure procedure, TrackedVariable variable, ResolutionContext context,
                                  AbortSignal abort) {
        Objects.requireNonNull(procedure, "procedure");
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(abort, "abort");
        if (cleanupPatterns.isScopedAcquisition(procedure, variable, context)) {
            return ReleaseVerdict.released(variable, ReleasePattern.SCOPED_ACQUISITION,
                    "Managed by try-with-resources", List.of()).asSyntacticFallback();
        }
        List<ReleaseEvent> events = locator.locate(procedure, variable, context, abort);
        Optional<ReleaseEvent> cleanup = cleanupPatterns.releaseInFinally(procedure, events);
        if (cleanup.isPresent()) {
            return ReleaseVerdict.released(variable, ReleasePattern.GUARANTEED_CLEANUP,
                    "Released in finally block: " + cleanup.get().describe(), events).asSyntacticFallback();
        }
        VariableFacts facts = new VariableFacts(procedure, variable, events, Set.of(), context, ownership);
        return scan(facts, context, abort);
    }

    /**
     * The backward scans alone. Callers have already ruled out the scoped
     * acquisition and finally patterns.
     */
    public ReleaseVerdict scan(VariableFacts facts, ResolutionContext context, AbortSignal abort) {
        Procedure procedure = facts.procedure();
        TrackedVariable variable = facts.variable();
        List<ReleaseEvent> events = facts.releaseEvents();
        logger.debug("Statement-order scan of {} in {}", variable, procedure);

        if (ownership.isOwnershipTransferred(procedure, variable, context, null, abort)) {
            return ReleaseVerdict.released(variable, ReleasePattern.OWNERSHIP_TRANSFER,
                    "Ownership transferred to the caller", events).asSyntacticFallback();
        }
        if (events.isEmpty()) {
            return ReleaseVerdict.notReleased(variable, ReleasePattern.NONE,
                    "No release operations found", events).asSyntacticFallback();
        }

        List<Statement> statements = procedure.statements();
        for (int i = 0; i < statements.size(); i++) {
            abort.throwIfAborted();
            Statement statement = statements.get(i);
            if (isExit(statement)) {
                if (statement instanceof ReturnStmt ret && facts.returnsVariable(ret)) {
                    continue;
                }
                if (!releasedBefore(statements, i, facts)) {
                    return ReleaseVerdict.notReleased(variable, ReleasePattern.INCOMPLETE,
                            "Exit at line " + ASTUtility.lineOf(statement) + " is not preceded by a release",
                            events).asSyntacticFallback();
                }
            } else if (containsNestedExit(statement) && !releasedBefore(statements, i, facts)) {
                return ReleaseVerdict.undetermined(variable,
                        "Exit nested in the statement at line " + ASTUtility.lineOf(statement)
                                + " cannot be checked without a control-flow graph", events)
                        .asSyntacticFallback();
            }
        }

        if (!statements.isEmpty() && isExit(statements.get(statements.size() - 1))) {
            return released(variable, events);
        }
        return scanImplicitExit(statements, facts, abort);
    }

    private ReleaseVerdict scanImplicitExit(List<Statement> statements, VariableFacts facts, AbortSignal abort) {
        TrackedVariable variable = facts.variable();
        List<ReleaseEvent> events = facts.releaseEvents();
        for (int i = statements.size() - 1; i >= 0; i--) {
            abort.throwIfAborted();
            Statement statement = statements.get(i);
            if (isRelease(statement, facts)) {
                return released(variable, events);
            }
            if (facts.acquires(statement)) {
                return ReleaseVerdict.notReleased(variable, ReleasePattern.INCOMPLETE,
                        "No release between the acquisition at line " + ASTUtility.lineOf(statement)
                                + " and the end of the body", events).asSyntacticFallback();
            }
            if (isCompound(statement)) {
                return ReleaseVerdict.undetermined(variable,
                        "Cannot see past the statement at line " + ASTUtility.lineOf(statement)
                                + " without a control-flow graph", events).asSyntacticFallback();
            }
        }
        return ReleaseVerdict.notReleased(variable, ReleasePattern.INCOMPLETE,
                "No release before the end of the body", events).asSyntacticFallback();
    }

    private boolean releasedBefore(List<Statement> statements, int index, VariableFacts facts) {
        for (int i = index - 1; i >= 0; i--) {
            Statement statement = statements.get(i);
            if (isRelease(statement, facts)) {
                return true;
            }
            if (isExit(statement) || facts.acquires(statement)) {
                return false;
            }
        }
        return facts.initiallyReleased();
    }

    private static ReleaseVerdict released(TrackedVariable variable, List<ReleaseEvent> events) {
        return ReleaseVerdict.released(variable, ReleasePattern.EXPLICIT_ALL_PATHS,
                "Released before every exit (statement-order scan)", events).asSyntacticFallback();
    }

    private static boolean isExit(Statement statement) {
        return statement instanceof ReturnStmt || statement instanceof ThrowStmt;
    }

    private static boolean isRelease(Statement statement, VariableFacts facts) {
        return statement instanceof ExpressionStmt && facts.releases(statement);
    }

    /**
     * If, loop, switch, try, labeled, synchronized and block statements.
     */
    private static boolean isCompound(Statement statement) {
        return statement.getChildNodes().stream().anyMatch(Statement.class::isInstance);
    }

    private static boolean containsNestedExit(Statement statement) {
        return !ASTUtility.findOutsideClosures(statement, ReturnStmt.class).isEmpty()
                || !ASTUtility.findOutsideClosures(statement, ThrowStmt.class).isEmpty();
    }
}
