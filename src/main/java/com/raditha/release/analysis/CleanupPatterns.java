package com.raditha.release.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ReleaseEvent;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.ResolutionContext;
import com.raditha.release.util.ASTUtility;

import java.util.List;
import java.util.Optional;

/**
 * Syntax checks for the two constructs that release on every exit:
 * try-with-resources and a release inside a finally block.
 */
public class CleanupPatterns {

    /**
     * True when the variable is declared as a try resource, or named as a
     * resource in the {@code try (existing)} form.
     */
    public boolean isScopedAcquisition(Procedure procedure, TrackedVariable variable, ResolutionContext context) {
        if (variable.declaration() instanceof VariableDeclarator declarator
                && declarator.getParentNode().orElse(null) instanceof VariableDeclarationExpr declaration
                && declaration.getParentNode().orElse(null) instanceof TryStmt tryStmt
                && ASTUtility.indexOfIdentity(tryStmt.getResources(), declaration) >= 0) {
            return true;
        }
        for (TryStmt tryStmt : ASTUtility.findOutsideClosures(procedure.declaration(), TryStmt.class)) {
            for (Expression resource : tryStmt.getResources()) {
                if (context.refersTo(resource, variable)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * The first release event that sits in the finally block of a try
     * statement of this procedure.
     */
    public Optional<ReleaseEvent> releaseInFinally(Procedure procedure, List<ReleaseEvent> events) {
        for (ReleaseEvent event : events) {
            if (isInFinally(event.call(), procedure.declaration())) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    private boolean isInFinally(Node node, Node root) {
        Node child = node;
        Node parent = node.getParentNode().orElse(null);
        while (parent != null && child != root) {
            if (parent instanceof TryStmt tryStmt) {
                Optional<BlockStmt> finallyBlock = tryStmt.getFinallyBlock();
                if (finallyBlock.isPresent() && finallyBlock.get() == child) {
                    return true;
                }
            }
            child = parent;
            parent = parent.getParentNode().orElse(null);
        }
        return false;
    }
}
