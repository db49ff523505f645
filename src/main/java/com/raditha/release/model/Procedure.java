package com.raditha.release.model;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.release.util.ASTUtility;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One analyzable unit of code: a method, constructor, initializer or lambda.
 * <p>
 * Two procedures are equal only when they wrap the very same declaration
 * node. That makes {@code Procedure} usable as a cache key even though
 * JavaParser nodes compare structurally.
 */
public final class Procedure {
    private final Node declaration;
    private final ProcedureKind kind;

    private Procedure(Node declaration, ProcedureKind kind) {
        this.declaration = declaration;
        this.kind = kind;
    }

    /**
     * Wrap a declaration node.
     *
     * @throws IllegalArgumentException if the node cannot own a body
     */
    public static Procedure of(Node declaration) {
        Objects.requireNonNull(declaration, "declaration");
        if (declaration instanceof MethodDeclaration) {
            return new Procedure(declaration, ProcedureKind.METHOD);
        }
        if (declaration instanceof ConstructorDeclaration) {
            return new Procedure(declaration, ProcedureKind.CONSTRUCTOR);
        }
        if (declaration instanceof InitializerDeclaration init) {
            return new Procedure(declaration,
                    init.isStatic() ? ProcedureKind.STATIC_INITIALIZER : ProcedureKind.INSTANCE_INITIALIZER);
        }
        if (declaration instanceof LambdaExpr) {
            return new Procedure(declaration, ProcedureKind.LAMBDA);
        }
        throw new IllegalArgumentException(
                "Not an analyzable procedure: " + declaration.getClass().getSimpleName());
    }

    /**
     * The innermost procedure that contains the node, if any.
     */
    public static Optional<Procedure> enclosing(Node node) {
        Node current = node;
        while (current != null) {
            if (isProcedureDeclaration(current)) {
                return Optional.of(of(current));
            }
            current = current.getParentNode().orElse(null);
        }
        return Optional.empty();
    }

    public static boolean isProcedureDeclaration(Node node) {
        return node instanceof MethodDeclaration
                || node instanceof ConstructorDeclaration
                || node instanceof InitializerDeclaration
                || node instanceof LambdaExpr;
    }

    public Node declaration() {
        return declaration;
    }

    public ProcedureKind kind() {
        return kind;
    }

    /**
     * The block body. Empty for abstract or native methods and for
     * expression-bodied lambdas.
     */
    public Optional<BlockStmt> body() {
        return switch (kind) {
            case METHOD -> ((MethodDeclaration) declaration).getBody();
            case CONSTRUCTOR -> Optional.of(((ConstructorDeclaration) declaration).getBody());
            case STATIC_INITIALIZER, INSTANCE_INITIALIZER -> Optional.of(((InitializerDeclaration) declaration).getBody());
            case LAMBDA -> {
                Statement body = ((LambdaExpr) declaration).getBody();
                yield body.isBlockStmt() ? Optional.of(body.asBlockStmt()) : Optional.empty();
            }
        };
    }

    /**
     * The expression of an expression-bodied lambda.
     */
    public Optional<Expression> expressionBody() {
        if (declaration instanceof LambdaExpr lambda) {
            return lambda.getExpressionBody();
        }
        return Optional.empty();
    }

    /**
     * Top level statements in source order. An expression-bodied lambda
     * yields its single expression statement.
     */
    public List<Statement> statements() {
        Optional<BlockStmt> body = body();
        if (body.isPresent()) {
            return body.get().getStatements();
        }
        if (declaration instanceof LambdaExpr lambda) {
            return List.of(lambda.getBody());
        }
        return List.of();
    }

    public NodeList<Parameter> parameters() {
        return switch (kind) {
            case METHOD -> ((MethodDeclaration) declaration).getParameters();
            case CONSTRUCTOR -> ((ConstructorDeclaration) declaration).getParameters();
            case LAMBDA -> ((LambdaExpr) declaration).getParameters();
            default -> new NodeList<>();
        };
    }

    /**
     * Readable name used in logs and reports.
     */
    public String name() {
        return switch (kind) {
            case METHOD -> ((MethodDeclaration) declaration).getNameAsString();
            case CONSTRUCTOR -> ((ConstructorDeclaration) declaration).getNameAsString();
            case STATIC_INITIALIZER -> "<clinit>";
            case INSTANCE_INITIALIZER -> "<init>";
            case LAMBDA -> "lambda@" + ASTUtility.lineOf(declaration);
        };
    }

    public int line() {
        return ASTUtility.lineOf(declaration);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Procedure other && other.declaration == declaration;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(declaration);
    }

    @Override
    public String toString() {
        return kind + " " + name() + " (line " + line() + ")";
    }
}
