package com.raditha.release.resolve;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.util.ASTUtility;

import java.util.Optional;

/**
 * Answers the name and call questions the release analysis needs.
 */
public interface ResolutionContext {

    /**
     * Whether answers come from type information rather than lexical
     * scoping alone.
     */
    boolean isSemantic();

    /**
     * The node that declares the variable a name refers to: a
     * {@code VariableDeclarator} or a {@code Parameter}.
     */
    Optional<Node> declarationOf(NameExpr name);

    Optional<CallTarget> resolveCallTarget(MethodCallExpr call);

    /**
     * True when the expression, after stripping parentheses and casts, is a
     * name that refers to the tracked variable.
     */
    default boolean refersTo(Expression expression, TrackedVariable variable) {
        Expression e = ASTUtility.unwrap(expression);
        if (!(e instanceof NameExpr name) || !name.getNameAsString().equals(variable.name())) {
            return false;
        }
        return declarationOf(name).map(variable::isDeclaredBy).orElse(false);
    }
}
