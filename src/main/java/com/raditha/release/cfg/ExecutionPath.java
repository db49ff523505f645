package com.raditha.release.cfg;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One bounded walk from the entry block to the exit block.
 *
 * @param blocks         visited blocks in order, repeats included
 * @param finallyRegions finally regions the path enters, first entry order, no duplicates
 */
public record ExecutionPath(List<BasicBlock> blocks, List<ControlFlowRegion> finallyRegions) {

    public ExecutionPath {
        blocks = List.copyOf(blocks);
        finallyRegions = List.copyOf(finallyRegions);
    }

    static ExecutionPath of(List<BasicBlock> blocks) {
        List<ControlFlowRegion> regions = new ArrayList<>();
        for (BasicBlock block : blocks) {
            block.region().nearest(RegionKind.FINALLY)
                    .filter(region -> regions.stream().noneMatch(r -> r == region))
                    .ifPresent(regions::add);
        }
        return new ExecutionPath(blocks, regions);
    }

    /**
     * Format as "B0 -> B1 -> B4".
     */
    public String describe() {
        return blocks.stream().map(BasicBlock::toString).collect(Collectors.joining(" -> "));
    }
}
