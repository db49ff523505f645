package com.raditha.release.cfg;

import com.raditha.release.model.AbortSignal;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Depth-first enumeration of entry-to-exit paths.
 * <p>
 * Cycles are cut by two bounds: a branch is dropped once the path grows past
 * {@code maxDepth} blocks or once a single block has recurred more than
 * {@code maxRepeats} times. Enumeration stops after {@code maxPaths} complete
 * paths. The result is evidence for reports; it never decides a verdict.
 */
public class PathEnumerator {
    public static final int DEFAULT_MAX_DEPTH = 100;
    public static final int DEFAULT_MAX_REPEATS = 3;
    public static final int DEFAULT_MAX_PATHS = 100;

    private final int maxDepth;
    private final int maxRepeats;
    private final int maxPaths;

    public PathEnumerator() {
        this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_REPEATS, DEFAULT_MAX_PATHS);
    }

    public PathEnumerator(int maxDepth, int maxRepeats, int maxPaths) {
        if (maxDepth < 1 || maxRepeats < 1 || maxPaths < 1) {
            throw new IllegalArgumentException("Path bounds must be positive");
        }
        this.maxDepth = maxDepth;
        this.maxRepeats = maxRepeats;
        this.maxPaths = maxPaths;
    }

    public List<ExecutionPath> findAllPaths(ControlFlowGraph cfg) {
        return findAllPaths(cfg, AbortSignal.NONE);
    }

    public List<ExecutionPath> findAllPaths(ControlFlowGraph cfg, AbortSignal abort) {
        List<ExecutionPath> paths = new ArrayList<>();
        walk(cfg.entry(), cfg.exit(), new ArrayList<>(), new HashMap<>(), paths, abort);
        return paths;
    }

    private void walk(BasicBlock block, BasicBlock target, List<BasicBlock> path,
                      Map<BasicBlock, Integer> visits, List<ExecutionPath> paths, AbortSignal abort) {
        abort.throwIfAborted();
        if (paths.size() >= maxPaths || path.size() > maxDepth) {
            return;
        }
        int seen = visits.getOrDefault(block, 0);
        if (seen > maxRepeats) {
            return;
        }

        path.add(block);
        visits.put(block, seen + 1);
        if (block == target) {
            paths.add(ExecutionPath.of(path));
        } else {
            for (BasicBlock successor : block.successors()) {
                walk(successor, target, path, visits, paths, abort);
            }
        }
        path.remove(path.size() - 1);
        visits.put(block, seen);
    }
}
