package com.raditha.release.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.raditha.release.cfg.BasicBlock;
import com.raditha.release.cfg.ControlFlowGraph;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ReleaseEvent;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.ResolutionContext;
import com.raditha.release.util.ASTUtility;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the flow passes need to know about one variable in one
 * procedure: where it is acquired, where it is released and which return
 * statements hand it back.
 */
public final class VariableFacts {
    private final Procedure procedure;
    private final TrackedVariable variable;
    private final List<ReleaseEvent> releaseEvents;
    private final Set<BasicBlock> releaseBlocks;
    private final ResolutionContext context;
    private final OwnershipTransferResolver ownership;

    public VariableFacts(Procedure procedure, TrackedVariable variable, List<ReleaseEvent> releaseEvents,
                         Set<BasicBlock> releaseBlocks, ResolutionContext context,
                         OwnershipTransferResolver ownership) {
        this.procedure = procedure;
        this.variable = variable;
        this.releaseEvents = List.copyOf(releaseEvents);
        this.releaseBlocks = Set.copyOf(releaseBlocks);
        this.context = context;
        this.ownership = ownership;
    }

    public Procedure procedure() {
        return procedure;
    }

    public TrackedVariable variable() {
        return variable;
    }

    public List<ReleaseEvent> releaseEvents() {
        return releaseEvents;
    }

    public Set<BasicBlock> releaseBlocks() {
        return releaseBlocks;
    }

    /**
     * State at procedure entry. A parameter arrives holding its resource.
     * A local holds nothing until it is acquired, so an exit taken before
     * the acquisition has nothing to release.
     */
    public boolean initiallyReleased() {
        Node declaration = variable.declaration();
        if (declaration instanceof Parameter parameter) {
            return parameter.getParentNode().orElse(null) instanceof CatchClause;
        }
        return declaration instanceof VariableDeclarator
                && ASTUtility.isAncestorOrSelf(procedure.declaration(), declaration);
    }

    /**
     * True when the operation gives the variable a new resource: a
     * declaration with a non-null initializer, the variable of a for-each
     * header, a catch parameter, or a non-null assignment.
     */
    public boolean acquires(Node operation) {
        Node declaration = variable.declaration();
        if (operation == declaration) {
            return true;
        }
        if (declaration instanceof VariableDeclarator declarator
                && ASTUtility.isAncestorOrSelf(operation, declarator)
                && !ASTUtility.isInsideClosure(declarator, operation)) {
            boolean forEachVariable = ASTUtility.nearestAncestor(declarator, ForEachStmt.class)
                    .map(f -> f.getVariable() == declarator.getParentNode().orElse(null))
                    .orElse(false);
            if (forEachVariable || declarator.getInitializer().filter(i -> !i.isNullLiteralExpr()).isPresent()) {
                return true;
            }
        }
        for (AssignExpr assign : ASTUtility.findOutsideClosures(operation, AssignExpr.class)) {
            if (assign.getOperator() == AssignExpr.Operator.ASSIGN
                    && !(assign.getValue() instanceof NullLiteralExpr)
                    && context.refersTo(assign.getTarget(), variable)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the operation contains one of the variable's release events.
     */
    public boolean releases(Node operation) {
        for (ReleaseEvent event : releaseEvents) {
            if (ASTUtility.isAncestorOrSelf(operation, event.call())) {
                return true;
            }
        }
        return false;
    }

    public boolean returnsVariable(ReturnStmt exit) {
        return ownership.returnsVariable(exit, variable, context);
    }

    /**
     * The first block, in block order, that acquires the variable. For
     * parameters that is the entry block.
     */
    public Optional<BasicBlock> acquisitionBlock(ControlFlowGraph cfg, AbortSignal abort) {
        if (variable.declaration() instanceof Parameter parameter
                && !(parameter.getParentNode().orElse(null) instanceof CatchClause)) {
            return Optional.of(cfg.entry());
        }
        for (BasicBlock block : cfg.blocks()) {
            abort.throwIfAborted();
            for (Node op : block.operations()) {
                if (acquires(op)) {
                    return Optional.of(block);
                }
            }
        }
        return Optional.empty();
    }
}
