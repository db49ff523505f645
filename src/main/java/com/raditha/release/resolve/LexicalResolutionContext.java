package com.raditha.release.resolve;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.TryStmt;
import com.raditha.release.util.ASTUtility;

import java.util.List;
import java.util.Optional;

/**
 * Resolves names using Java's lexical scoping rules over the syntax tree
 * alone. Needs no classpath and never fails, which makes it the default.
 * <p>
 * The walk goes outward from the name, checking at each level the
 * declarations that are visible from the child it came from: earlier
 * statements of a block, for-loop and for-each variables, try resources,
 * catch, lambda and method parameters, and finally the fields of every
 * enclosing type, so a field shadowing nothing local resolves to the field.
 */
public class LexicalResolutionContext implements ResolutionContext {

    @Override
    public boolean isSemantic() {
        return false;
    }

    @Override
    public Optional<Node> declarationOf(NameExpr name) {
        String target = name.getNameAsString();
        Node child = name;
        Node parent = name.getParentNode().orElse(null);
        while (parent != null) {
            Optional<Node> found = declaredIn(parent, child, target);
            if (found.isPresent()) {
                return found;
            }
            child = parent;
            parent = parent.getParentNode().orElse(null);
        }
        return Optional.empty();
    }

    private Optional<Node> declaredIn(Node scope, Node child, String name) {
        if (scope instanceof BlockStmt block) {
            return precedingLocal(block.getStatements(), child, name);
        }
        if (scope instanceof SwitchEntry entry) {
            return precedingLocal(entry.getStatements(), child, name);
        }
        if (scope instanceof ForStmt forStmt) {
            for (Expression init : forStmt.getInitialization()) {
                Optional<Node> found = declaredBy(init, name);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        if (scope instanceof ForEachStmt forEach && child != forEach.getIterable()) {
            return declaredBy(forEach.getVariable(), name);
        }
        if (scope instanceof TryStmt tryStmt) {
            return tryResource(tryStmt, child, name);
        }
        if (scope instanceof CatchClause clause) {
            return parameterNamed(List.of(clause.getParameter()), name);
        }
        if (scope instanceof LambdaExpr lambda) {
            return parameterNamed(lambda.getParameters(), name);
        }
        if (scope instanceof CallableDeclaration<?> callable) {
            return parameterNamed(callable.getParameters(), name);
        }
        if (scope instanceof TypeDeclaration<?> type) {
            return fieldNamed(type.getMembers(), name);
        }
        if (scope instanceof ObjectCreationExpr creation && creation.getAnonymousClassBody().isPresent()
                && child instanceof BodyDeclaration<?>) {
            return fieldNamed(creation.getAnonymousClassBody().get(), name);
        }
        return Optional.empty();
    }

    /**
     * Locals declared by statements that come before {@code child}.
     */
    private Optional<Node> precedingLocal(List<Statement> statements, Node child, String name) {
        int limit = ASTUtility.indexOfIdentity(statements, child);
        if (limit < 0) {
            limit = statements.size();
        }
        for (int i = 0; i < limit; i++) {
            if (statements.get(i) instanceof ExpressionStmt stmt) {
                Optional<Node> found = declaredBy(stmt.getExpression(), name);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Resources are visible in the try block and in later resources, not in
     * catch clauses or the finally block.
     */
    private Optional<Node> tryResource(TryStmt tryStmt, Node child, String name) {
        NodeList<Expression> resources = tryStmt.getResources();
        int limit;
        if (child == tryStmt.getTryBlock()) {
            limit = resources.size();
        } else {
            limit = ASTUtility.indexOfIdentity(resources, child);
            if (limit < 0) {
                return Optional.empty();
            }
        }
        for (int i = 0; i < limit; i++) {
            Optional<Node> found = declaredBy(resources.get(i), name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<Node> declaredBy(Expression expression, String name) {
        if (expression instanceof VariableDeclarationExpr declaration) {
            for (VariableDeclarator declarator : declaration.getVariables()) {
                if (declarator.getNameAsString().equals(name)) {
                    return Optional.of(declarator);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Node> parameterNamed(List<Parameter> parameters, String name) {
        for (Parameter parameter : parameters) {
            if (parameter.getNameAsString().equals(name)) {
                return Optional.of(parameter);
            }
        }
        return Optional.empty();
    }

    private Optional<Node> fieldNamed(List<BodyDeclaration<?>> members, String name) {
        for (BodyDeclaration<?> member : members) {
            if (member instanceof FieldDeclaration field) {
                for (VariableDeclarator declarator : field.getVariables()) {
                    if (declarator.getNameAsString().equals(name)) {
                        return Optional.of(declarator);
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Find a method of the same compilation unit with the call's name and
     * arity. Overloads with the same arity are ambiguous and stay unresolved.
     */
    @Override
    public Optional<CallTarget> resolveCallTarget(MethodCallExpr call) {
        String name = call.getNameAsString();
        Optional<CompilationUnit> cu = call.findCompilationUnit();
        if (cu.isEmpty()) {
            return Optional.of(CallTarget.unresolved(name));
        }
        List<MethodDeclaration> candidates = cu.get().findAll(MethodDeclaration.class, m ->
                m.getNameAsString().equals(name) && m.getParameters().size() == call.getArguments().size());
        if (candidates.size() != 1) {
            return Optional.of(CallTarget.unresolved(name));
        }
        List<String> parameterNames = candidates.get(0).getParameters().stream()
                .map(Parameter::getNameAsString)
                .toList();
        return Optional.of(new CallTarget(name, parameterNames, true));
    }
}
