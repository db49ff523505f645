package com.raditha.release.model;

/**
 * Loop structure around a tracked variable.
 *
 * @param hasLoops        whether the procedure has any loop blocks
 * @param loopBlockCount  number of blocks inside loop regions
 * @param createdInLoop   whether the variable is acquired inside a loop
 * @param releasedInLoop  whether some release happens inside a loop
 * @param scopeMismatch   a release sits in a loop that does not also contain the acquisition
 */
public record LoopReleaseInfo(
        boolean hasLoops,
        int loopBlockCount,
        boolean createdInLoop,
        boolean releasedInLoop,
        boolean scopeMismatch) {

    public LoopReleaseInfo {
        if (loopBlockCount < 0) {
            throw new IllegalArgumentException("loopBlockCount must be non-negative");
        }
    }

    public static LoopReleaseInfo none() {
        return new LoopReleaseInfo(false, 0, false, false, false);
    }
}
