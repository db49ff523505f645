package com.raditha.release.util;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Utility class for common AST operations.
 * <p>
 * JavaParser nodes implement structural {@code equals}, so every containment
 * check in here compares by reference.
 */
public class ASTUtility {

    private ASTUtility() {
        /* this is only a utility class */
    }

    /**
     * A closure boundary is a node whose body runs in a different activation
     * than the code around it: lambdas, local classes and records, and the
     * members of anonymous classes.
     */
    public static boolean isClosureBoundary(Node node) {
        return node instanceof LambdaExpr
                || node instanceof LocalClassDeclarationStmt
                || node instanceof LocalRecordDeclarationStmt
                || node instanceof BodyDeclaration<?>;
    }

    /**
     * Find all nodes of a type below {@code root} without descending into
     * nested closures. The root itself is always searched, even when it is a
     * lambda or a method.
     */
    public static <T extends Node> List<T> findOutsideClosures(Node root, Class<T> type) {
        List<T> found = new ArrayList<>();
        collect(root, type, found, true);
        return found;
    }

    private static <T extends Node> void collect(Node node, Class<T> type, List<T> found, boolean isRoot) {
        if (!isRoot && isClosureBoundary(node)) {
            return;
        }
        if (type.isInstance(node)) {
            found.add(type.cast(node));
        }
        for (Node child : node.getChildNodes()) {
            collect(child, type, found, false);
        }
    }

    /**
     * True when {@code node} is {@code ancestor} or sits somewhere below it.
     */
    public static boolean isAncestorOrSelf(Node ancestor, Node node) {
        Node current = node;
        while (current != null) {
            if (current == ancestor) {
                return true;
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    /**
     * True when a closure boundary separates {@code node} from {@code root}.
     */
    public static boolean isInsideClosure(Node node, Node root) {
        Node current = node.getParentNode().orElse(null);
        while (current != null && current != root) {
            if (isClosureBoundary(current)) {
                return true;
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    /**
     * Index of {@code node} in {@code nodes} by reference, or -1.
     */
    public static int indexOfIdentity(List<? extends Node> nodes, Node node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Strip parentheses and casts.
     */
    public static Expression unwrap(Expression expression) {
        Expression current = expression;
        while (true) {
            if (current instanceof EnclosedExpr enclosed) {
                current = enclosed.getInner();
            } else if (current instanceof CastExpr cast) {
                current = cast.getExpression();
            } else {
                return current;
            }
        }
    }

    /**
     * 1-based line where the node starts, or -1 when positions are unavailable.
     */
    public static int lineOf(Node node) {
        return node.getBegin().map(p -> p.line).orElse(-1);
    }

    /**
     * Nearest ancestor of the given type by reference walk.
     */
    public static <T extends Node> Optional<T> nearestAncestor(Node node, Class<T> type) {
        Node current = node.getParentNode().orElse(null);
        while (current != null) {
            if (type.isInstance(current)) {
                return Optional.of(type.cast(current));
            }
            current = current.getParentNode().orElse(null);
        }
        return Optional.empty();
    }
}
