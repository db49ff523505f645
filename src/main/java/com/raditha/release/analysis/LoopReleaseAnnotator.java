package com.raditha.release.analysis;

import com.raditha.release.cfg.BasicBlock;
import com.raditha.release.cfg.ControlFlowGraph;
import com.raditha.release.cfg.ControlFlowRegion;
import com.raditha.release.cfg.RegionKind;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.LoopReleaseInfo;

import java.util.Optional;

/**
 * Compares the loop nesting of a variable's acquisition with that of its
 * releases.
 * <p>
 * A release inside a loop that does not also contain the acquisition runs
 * once per iteration against a resource that was acquired once. It may be
 * skipped on some iterations or repeated on others, so the pairing is
 * reported as a scope mismatch.
 */
public class LoopReleaseAnnotator {

    public LoopReleaseInfo annotate(ControlFlowGraph cfg, VariableFacts facts, AbortSignal abort) {
        int loopBlocks = 0;
        for (BasicBlock block : cfg.blocks()) {
            abort.throwIfAborted();
            if (block.isWithin(RegionKind.LOOP)) {
                loopBlocks++;
            }
        }
        if (loopBlocks == 0) {
            return LoopReleaseInfo.none();
        }

        ControlFlowRegion creation = facts.acquisitionBlock(cfg, abort)
                .map(BasicBlock::region)
                .orElse(cfg.entry().region());
        boolean releasedInLoop = false;
        boolean mismatch = false;
        for (BasicBlock block : facts.releaseBlocks()) {
            abort.throwIfAborted();
            Optional<ControlFlowRegion> loop = block.region().nearest(RegionKind.LOOP);
            if (loop.isPresent()) {
                releasedInLoop = true;
                if (!loop.get().encloses(creation)) {
                    mismatch = true;
                }
            }
        }
        return new LoopReleaseInfo(true, loopBlocks, creation.isWithin(RegionKind.LOOP), releasedInLoop, mismatch);
    }
}
