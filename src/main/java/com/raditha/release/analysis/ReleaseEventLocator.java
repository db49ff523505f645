package com.raditha.release.analysis;

import com.github.javaparser.ast.expr.MethodCallExpr;
import com.raditha.release.cfg.BasicBlock;
import com.raditha.release.cfg.ControlFlowGraph;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ReleaseEvent;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.ResolutionContext;
import com.raditha.release.util.ASTUtility;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds the release events of a variable and the blocks they sit in.
 * Releases inside nested lambdas or classes belong to those closures and are
 * not counted.
 */
public class ReleaseEventLocator {
    private final ReleaseClassifier classifier;

    public ReleaseEventLocator(ReleaseClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public List<ReleaseEvent> locate(Procedure procedure, TrackedVariable variable, ResolutionContext context) {
        return locate(procedure, variable, context, AbortSignal.NONE);
    }

    public List<ReleaseEvent> locate(Procedure procedure, TrackedVariable variable, ResolutionContext context,
                                     AbortSignal abort) {
        List<ReleaseEvent> events = new ArrayList<>();
        for (MethodCallExpr call : ASTUtility.findOutsideClosures(procedure.declaration(), MethodCallExpr.class)) {
            abort.throwIfAborted();
            classifier.releasedOperand(call)
                    .filter(operand -> context.refersTo(operand, variable))
                    .ifPresent(operand -> events.add(new ReleaseEvent(call, variable)));
        }
        return events;
    }

    public Set<BasicBlock> releaseBlocks(ControlFlowGraph cfg, List<ReleaseEvent> events) {
        Set<BasicBlock> blocks = new HashSet<>();
        for (ReleaseEvent event : events) {
            cfg.blockContaining(event.call()).ifPresent(blocks::add);
        }
        return blocks;
    }
}
