package com.raditha.release.cfg;

import com.github.javaparser.ast.Node;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * A lexical region of a procedure that groups blocks: a try body, a catch
 * clause, a finally block, a loop or the procedure itself.
 * Regions nest through {@link #enclosing()}.
 */
public final class ControlFlowRegion {
    private final RegionKind kind;
    private final @Nullable ControlFlowRegion enclosing;
    private final Node owner;

    ControlFlowRegion(RegionKind kind, @Nullable ControlFlowRegion enclosing, Node owner) {
        this.kind = kind;
        this.enclosing = enclosing;
        this.owner = owner;
    }

    public RegionKind kind() {
        return kind;
    }

    public Optional<ControlFlowRegion> enclosing() {
        return Optional.ofNullable(enclosing);
    }

    /**
     * The statement or block that introduced this region.
     */
    public Node owner() {
        return owner;
    }

    /**
     * True when this region or one of its ancestors has the given kind.
     */
    public boolean isWithin(RegionKind wanted) {
        return nearest(wanted).isPresent();
    }

    /**
     * The innermost region of the given kind, starting with this one.
     */
    public Optional<ControlFlowRegion> nearest(RegionKind wanted) {
        for (ControlFlowRegion r = this; r != null; r = r.enclosing) {
            if (r.kind == wanted) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    /**
     * True when {@code other} is this region or nested somewhere inside it.
     */
    public boolean encloses(ControlFlowRegion other) {
        for (ControlFlowRegion r = other; r != null; r = r.enclosing) {
            if (r == this) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return kind.name();
    }
}
