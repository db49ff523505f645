package com.raditha.release.resolve;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedValueDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves names and call targets through the JavaParser symbol solver.
 * <p>
 * The compilation unit must have been parsed with a symbol resolver
 * configured. Whenever the solver cannot answer, usually because a type is
 * missing from the classpath, the lexical rules are used instead.
 */
public class SymbolSolverResolutionContext implements ResolutionContext {
    private static final Logger logger = LoggerFactory.getLogger(SymbolSolverResolutionContext.class);

    private final LexicalResolutionContext lexical = new LexicalResolutionContext();

    @Override
    public boolean isSemantic() {
        return true;
    }

    @Override
    public Optional<Node> declarationOf(NameExpr name) {
        try {
            ResolvedValueDeclaration resolved = name.resolve();
            Optional<? extends Node> ast = resolved.toAst();
            if (ast.isPresent()) {
                return Optional.of(normalize(ast.get(), name.getNameAsString()));
            }
        } catch (RuntimeException e) {
            logger.debug("Symbol solver could not resolve {}, using lexical scope: {}", name, e.getMessage());
        }
        return lexical.declarationOf(name);
    }

    /**
     * Multi-variable declarations resolve to the whole declaration; narrow
     * them to the declarator with the right name.
     */
    private Node normalize(Node node, String name) {
        List<VariableDeclarator> declarators = List.of();
        if (node instanceof VariableDeclarationExpr declaration) {
            declarators = declaration.getVariables();
        } else if (node instanceof FieldDeclaration field) {
            declarators = field.getVariables();
        }
        for (VariableDeclarator declarator : declarators) {
            if (declarator.getNameAsString().equals(name)) {
                return declarator;
            }
        }
        return node;
    }

    @Override
    public Optional<CallTarget> resolveCallTarget(MethodCallExpr call) {
        try {
            ResolvedMethodDeclaration method = call.resolve();
            List<String> parameterNames = new ArrayList<>();
            for (int i = 0; i < method.getNumberOfParams(); i++) {
                parameterNames.add(method.getParam(i).getName());
            }
            return Optional.of(new CallTarget(method.getName(), parameterNames, true));
        } catch (RuntimeException e) {
            logger.debug("Symbol solver could not resolve call {}: {}", call, e.getMessage());
            return lexical.resolveCallTarget(call);
        }
    }
}
