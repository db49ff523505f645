package com.raditha.release.cfg;

import com.github.javaparser.ast.Node;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A straight-line run of operations with at most two successors.
 * <p>
 * Blocks are filled in by {@link ControlFlowGraphBuilder} and frozen when the
 * owning {@link ControlFlowGraph} is created. Any mutation after that throws.
 * Equality is identity.
 */
public final class BasicBlock {

    /**
     * Entry and exit carry no operations.
     */
    public enum Kind {
        ENTRY,
        EXIT,
        BODY
    }

    private final Kind kind;
    private final ControlFlowRegion region;
    private final List<Node> operations = new ArrayList<>();
    private @Nullable BasicBlock fallThrough;
    private @Nullable BasicBlock conditional;
    private int ordinal = -1;
    private @Nullable ControlFlowGraph graph;

    BasicBlock(Kind kind, ControlFlowRegion region) {
        this.kind = kind;
        this.region = region;
    }

    void addOperation(Node operation) {
        checkMutable();
        operations.add(operation);
    }

    void setFallThrough(BasicBlock successor) {
        checkMutable();
        this.fallThrough = successor;
    }

    void setConditional(BasicBlock successor) {
        checkMutable();
        this.conditional = successor;
    }

    void freeze(ControlFlowGraph owner, int index) {
        checkMutable();
        this.graph = owner;
        this.ordinal = index;
    }

    private void checkMutable() {
        if (graph != null) {
            throw new IllegalStateException("Block B" + ordinal + " is part of a finished graph");
        }
    }

    public Kind kind() {
        return kind;
    }

    public boolean isEntry() {
        return kind == Kind.ENTRY;
    }

    public boolean isExit() {
        return kind == Kind.EXIT;
    }

    public int ordinal() {
        return ordinal;
    }

    public ControlFlowRegion region() {
        return region;
    }

    public boolean isWithin(RegionKind regionKind) {
        return region.isWithin(regionKind);
    }

    public List<Node> operations() {
        return Collections.unmodifiableList(operations);
    }

    public Optional<BasicBlock> fallThrough() {
        return Optional.ofNullable(fallThrough);
    }

    /**
     * Target taken when the block's last operation evaluates to true, or when
     * an exception leaves a try body.
     */
    public Optional<BasicBlock> conditional() {
        return Optional.ofNullable(conditional);
    }

    /**
     * Conditional successor first, then fall-through.
     */
    public List<BasicBlock> successors() {
        List<BasicBlock> result = new ArrayList<>(2);
        if (conditional != null) {
            result.add(conditional);
        }
        if (fallThrough != null && fallThrough != conditional) {
            result.add(fallThrough);
        }
        return result;
    }

    public ControlFlowGraph graph() {
        if (graph == null) {
            throw new IllegalStateException("Block is still under construction");
        }
        return graph;
    }

    @Override
    public String toString() {
        return "B" + ordinal;
    }
}
