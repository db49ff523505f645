package com.raditha.release.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.raditha.release.cfg.BasicBlock;
import com.raditha.release.cfg.ControlFlowGraph;
import com.raditha.release.cfg.ExecutionPath;
import com.raditha.release.model.AbortSignal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Forward dataflow over a {@link ControlFlowGraph} with a single boolean of
 * state: has the variable been released since it was last acquired.
 * <p>
 * Each block is visited at most once per state, so the worklist terminates
 * in time linear in the number of edges no matter how many paths the graph
 * has. Any exit reached unreleased fails the whole check:
 * <ul>
 *     <li>a return whose value does not hand the variable to the caller</li>
 *     <li>a throw that leaves the procedure</li>
 *     <li>the exit block</li>
 *     <li>a block with no successors that is not the exit</li>
 * </ul>
 */
public class AllPathsReleaseChecker {

    /**
     * State after one block, or a violation inside it.
     */
    record BlockResult(boolean releasedAfter, boolean violated) {
        static final BlockResult VIOLATION = new BlockResult(false, true);
    }

    private record State(BasicBlock block, boolean released) {
    }

    public boolean areAllPathsReleased(ControlFlowGraph cfg, VariableFacts facts) {
        return findUnreleasedExit(cfg, facts, AbortSignal.NONE).isEmpty();
    }

    public boolean areAllPathsReleased(ControlFlowGraph cfg, VariableFacts facts, AbortSignal abort) {
        return findUnreleasedExit(cfg, facts, abort).isEmpty();
    }

    /**
     * The first block found where the variable can leave the procedure
     * unreleased.
     */
    public Optional<BasicBlock> findUnreleasedExit(ControlFlowGraph cfg, VariableFacts facts, AbortSignal abort) {
        Deque<State> worklist = new ArrayDeque<>();
        Set<State> visited = new HashSet<>();
        State seed = new State(cfg.entry(), facts.initiallyReleased());
        worklist.add(seed);
        visited.add(seed);

        while (!worklist.isEmpty()) {
            abort.throwIfAborted();
            State state = worklist.poll();
            BlockResult result = apply(state.block(), state.released(), facts, abort);
            if (result.violated()) {
                return Optional.of(state.block());
            }
            for (BasicBlock successor : state.block().successors()) {
                State next = new State(successor, result.releasedAfter());
                if (visited.add(next)) {
                    worklist.add(next);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Replay one enumerated path with the same transfer function.
     *
     * @return true if the path reaches an exit unreleased
     */
    public boolean violates(ExecutionPath path, VariableFacts facts) {
        return violates(path, facts, AbortSignal.NONE);
    }

    public boolean violates(ExecutionPath path, VariableFacts facts, AbortSignal abort) {
        boolean released = facts.initiallyReleased();
        for (BasicBlock block : path.blocks()) {
            abort.throwIfAborted();
            BlockResult result = apply(block, released, facts, abort);
            if (result.violated()) {
                return true;
            }
            released = result.releasedAfter();
        }
        return false;
    }

    BlockResult apply(BasicBlock block, boolean releasedBefore, VariableFacts facts, AbortSignal abort) {
        boolean released = releasedBefore;
        boolean releaseBlock = facts.releaseBlocks().contains(block);
        boolean throwLeavesProcedure = block.fallThrough().map(BasicBlock::isExit).orElse(false);

        for (Node op : block.operations()) {
            abort.throwIfAborted();
            if (facts.acquires(op)) {
                released = false;
            }
            if (releaseBlock && facts.releases(op)) {
                released = true;
            }
            if (released) {
                continue;
            }
            if (op instanceof ReturnStmt exit && exit.getExpression().isPresent()) {
                if (!facts.returnsVariable(exit)) {
                    return BlockResult.VIOLATION;
                }
                // the caller owns it now
                released = true;
            }
            if (op instanceof ThrowStmt && throwLeavesProcedure) {
                return BlockResult.VIOLATION;
            }
        }

        if (!released && (block.isExit() || block.successors().isEmpty())) {
            return BlockResult.VIOLATION;
        }
        return new BlockResult(released, false);
    }
}
