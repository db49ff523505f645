package com.raditha.release.cfg;

import com.github.javaparser.ast.Node;
import com.raditha.release.model.Procedure;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable control-flow graph of one procedure. Block 0 is the entry and
 * the last block is the exit. Safe to share between threads once built.
 */
public final class ControlFlowGraph {
    private final Procedure procedure;
    private final List<BasicBlock> blocks;
    private final Map<Node, BasicBlock> blockByOperation = new IdentityHashMap<>();

    ControlFlowGraph(Procedure procedure, List<BasicBlock> blocks) {
        if (blocks.size() < 2 || !blocks.get(0).isEntry() || !blocks.get(blocks.size() - 1).isExit()) {
            throw new IllegalArgumentException("A graph needs an entry first and an exit last");
        }
        this.procedure = procedure;
        this.blocks = List.copyOf(blocks);
        for (int i = 0; i < this.blocks.size(); i++) {
            BasicBlock block = this.blocks.get(i);
            block.freeze(this, i);
            for (Node op : block.operations()) {
                blockByOperation.put(op, block);
            }
        }
    }

    public Procedure procedure() {
        return procedure;
    }

    public List<BasicBlock> blocks() {
        return blocks;
    }

    public BasicBlock entry() {
        return blocks.get(0);
    }

    public BasicBlock exit() {
        return blocks.get(blocks.size() - 1);
    }

    public int size() {
        return blocks.size();
    }

    public BasicBlock block(int ordinal) {
        return blocks.get(ordinal);
    }

    /**
     * The block whose operation is {@code node} or contains it.
     */
    public Optional<BasicBlock> blockContaining(Node node) {
        for (Node current = node; current != null; current = current.getParentNode().orElse(null)) {
            BasicBlock block = blockByOperation.get(current);
            if (block != null) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }

    /**
     * The operation of a block that is {@code node} or contains it.
     */
    public Optional<Node> operationContaining(Node node) {
        for (Node current = node; current != null; current = current.getParentNode().orElse(null)) {
            if (blockByOperation.containsKey(current)) {
                return Optional.of(current);
            }
        }
        return Optional.empty();
    }

    public List<BasicBlock> blocksWithin(RegionKind kind) {
        return blocks.stream().filter(b -> b.isWithin(kind)).toList();
    }

    @Override
    public String toString() {
        return "CFG of " + procedure + " with " + blocks.size() + " blocks";
    }
}
