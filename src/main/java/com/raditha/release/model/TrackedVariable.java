package com.raditha.release.model;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.raditha.release.util.ASTUtility;

import java.util.Objects;
import java.util.Optional;

/**
 * The resource-owning variable under analysis.
 * <p>
 * Identity is the declaring node: two variables that share a name in
 * different scopes are different variables.
 */
public final class TrackedVariable {
    private final Node declaration;
    private final String name;

    private TrackedVariable(Node declaration, String name) {
        this.declaration = declaration;
        this.name = name;
    }

    public static TrackedVariable of(VariableDeclarator declarator) {
        Objects.requireNonNull(declarator, "declarator");
        return new TrackedVariable(declarator, declarator.getNameAsString());
    }

    public static TrackedVariable of(Parameter parameter) {
        Objects.requireNonNull(parameter, "parameter");
        return new TrackedVariable(parameter, parameter.getNameAsString());
    }

    public Node declaration() {
        return declaration;
    }

    public String name() {
        return name;
    }

    public boolean isParameter() {
        return declaration instanceof Parameter;
    }

    public Optional<Expression> initializer() {
        if (declaration instanceof VariableDeclarator declarator) {
            return declarator.getInitializer();
        }
        return Optional.empty();
    }

    /**
     * True when {@code node} is this variable's declaring node.
     */
    public boolean isDeclaredBy(Node node) {
        return node == declaration;
    }

    public int line() {
        return ASTUtility.lineOf(declaration);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TrackedVariable other && other.declaration == declaration;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(declaration);
    }

    @Override
    public String toString() {
        return name + "@" + line();
    }
}
