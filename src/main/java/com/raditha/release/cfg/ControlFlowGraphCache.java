package com.raditha.release.cfg;

import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.Procedure;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Session-wide cache of control-flow graphs keyed by procedure identity.
 * <p>
 * Failed constructions are cached too, as empty results, so a body the
 * builder cannot handle is only attempted once. Safe for concurrent use.
 */
public class ControlFlowGraphCache {
    private final ControlFlowGraphBuilder builder;
    private final ConcurrentMap<Procedure, Optional<ControlFlowGraph>> graphs = new ConcurrentHashMap<>();

    public ControlFlowGraphCache() {
        this(new ControlFlowGraphBuilder());
    }

    public ControlFlowGraphCache(ControlFlowGraphBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder");
    }

    /**
     * The graph of a procedure, built on first request.
     *
     * @return empty when the procedure's body cannot be turned into a graph
     */
    public Optional<ControlFlowGraph> get(Procedure procedure) {
        Objects.requireNonNull(procedure, "procedure");
        return graphs.computeIfAbsent(procedure, builder::build);
    }

    /**
     * Like {@link #get(Procedure)}, with construction polling {@code abort}.
     * An aborted construction leaves nothing in the cache.
     */
    public Optional<ControlFlowGraph> get(Procedure procedure, AbortSignal abort) {
        Objects.requireNonNull(procedure, "procedure");
        Objects.requireNonNull(abort, "abort");
        return graphs.computeIfAbsent(procedure, key -> builder.build(key, abort));
    }

    public void invalidate(Procedure procedure) {
        graphs.remove(procedure);
    }

    public void clear() {
        graphs.clear();
    }

    public int size() {
        return graphs.size();
    }
}
