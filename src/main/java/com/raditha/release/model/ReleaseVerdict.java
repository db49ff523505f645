package com.raditha.release.model;

import com.raditha.release.cfg.ExecutionPath;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of analysing one tracked variable in one procedure.
 *
 * @param variable            the variable that was analysed
 * @param succeeded           false when the engine could not reach a conclusion
 * @param releasedOnAllPaths  true only when every exit is covered
 * @param reason              human readable explanation
 * @param pattern             how the conclusion was reached
 * @param releaseEvents       every release of the variable found in the procedure
 * @param totalPaths          number of enumerated execution paths, 0 when none were enumerated
 * @param problematicPaths    enumerated paths that reach an exit unreleased
 * @param loopInfo            loop annotation, null when the loop pass did not run
 * @param interproceduralInfo callee annotation, null when the pass did not run
 * @param syntacticFallback   whether the verdict came from statement-order scanning
 */
public record ReleaseVerdict(
        TrackedVariable variable,
        boolean succeeded,
        boolean releasedOnAllPaths,
        String reason,
        ReleasePattern pattern,
        List<ReleaseEvent> releaseEvents,
        int totalPaths,
        List<ExecutionPath> problematicPaths,
        @Nullable LoopReleaseInfo loopInfo,
        @Nullable InterproceduralInfo interproceduralInfo,
        boolean syntacticFallback) {

    public ReleaseVerdict {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(pattern, "pattern");
        releaseEvents = List.copyOf(releaseEvents);
        problematicPaths = List.copyOf(problematicPaths);
        if (releasedOnAllPaths && (pattern == ReleasePattern.NONE || pattern == ReleasePattern.INCOMPLETE)) {
            throw new IllegalArgumentException("A released verdict needs a concrete pattern, got " + pattern);
        }
        if (releasedOnAllPaths && reason.isBlank()) {
            throw new IllegalArgumentException("A released verdict needs a reason");
        }
        if (totalPaths < 0) {
            throw new IllegalArgumentException("totalPaths must be non-negative");
        }
    }

    /**
     * A positive verdict reached through one of the fast paths or the dataflow.
     */
    public static ReleaseVerdict released(TrackedVariable variable, ReleasePattern pattern, String reason,
                                          List<ReleaseEvent> releaseEvents) {
        return new ReleaseVerdict(variable, true, true, reason, pattern, releaseEvents, 0, List.of(),
                null, null, false);
    }

    /**
     * A definite negative verdict.
     */
    public static ReleaseVerdict notReleased(TrackedVariable variable, ReleasePattern pattern, String reason,
                                             List<ReleaseEvent> releaseEvents) {
        return new ReleaseVerdict(variable, true, false, reason, pattern, releaseEvents, 0, List.of(),
                null, null, false);
    }

    /**
     * The engine could not decide.
     */
    public static ReleaseVerdict undetermined(TrackedVariable variable, String reason,
                                              List<ReleaseEvent> releaseEvents) {
        ReleasePattern pattern = releaseEvents.isEmpty() ? ReleasePattern.NONE : ReleasePattern.INCOMPLETE;
        return new ReleaseVerdict(variable, false, false, reason, pattern, releaseEvents, 0, List.of(),
                null, null, false);
    }

    public ReleaseVerdict withPaths(int totalPaths, List<ExecutionPath> problematicPaths) {
        return new ReleaseVerdict(variable, succeeded, releasedOnAllPaths, reason, pattern, releaseEvents,
                totalPaths, problematicPaths, loopInfo, interproceduralInfo, syntacticFallback);
    }

    public ReleaseVerdict withLoopInfo(LoopReleaseInfo info) {
        return new ReleaseVerdict(variable, succeeded, releasedOnAllPaths, reason, pattern, releaseEvents,
                totalPaths, problematicPaths, info, interproceduralInfo, syntacticFallback);
    }

    /**
     * Replace the conclusion with a negative one, keeping the evidence.
     */
    public ReleaseVerdict downgrade(String newReason) {
        return new ReleaseVerdict(variable, succeeded, false, newReason, ReleasePattern.INCOMPLETE,
                releaseEvents, totalPaths, problematicPaths, loopInfo, interproceduralInfo, syntacticFallback);
    }

    public ReleaseVerdict withInterproceduralInfo(InterproceduralInfo info, String newReason) {
        return new ReleaseVerdict(variable, succeeded, releasedOnAllPaths, newReason, pattern, releaseEvents,
                totalPaths, problematicPaths, loopInfo, info, syntacticFallback);
    }

    public ReleaseVerdict asSyntacticFallback() {
        return new ReleaseVerdict(variable, succeeded, releasedOnAllPaths, reason, pattern, releaseEvents,
                totalPaths, problematicPaths, loopInfo, interproceduralInfo, true);
    }

    /**
     * True for a definite verdict that the variable can leak.
     */
    public boolean isLeak() {
        return succeeded && !releasedOnAllPaths;
    }
}
