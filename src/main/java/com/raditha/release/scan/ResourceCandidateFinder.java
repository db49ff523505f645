package com.raditha.release.scan;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.ResolutionContext;
import com.raditha.release.util.ASTUtility;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the locals of a procedure that hold a resource created in it,
 * either through their initializer or through a later assignment.
 * Fields and variables of nested closures are left out.
 */
public class ResourceCandidateFinder {
    private final ResourceTypeClassifier typeClassifier;

    public ResourceCandidateFinder(ResourceTypeClassifier typeClassifier) {
        this.typeClassifier = typeClassifier;
    }

    public List<ResourceCandidate> find(Procedure procedure, ResolutionContext context) {
        Map<TrackedVariable, ResourceCandidate> found = new LinkedHashMap<>();
        Node root = procedure.declaration();

        // 1. Initialized declarations
        for (VariableDeclarator declarator : ASTUtility.findOutsideClosures(root, VariableDeclarator.class)) {
            declarator.getInitializer()
                    .filter(init -> typeClassifier.producesResource(init, declarator.getType()))
                    .ifPresent(init -> found.putIfAbsent(TrackedVariable.of(declarator),
                            new ResourceCandidate(TrackedVariable.of(declarator), init)));
        }

        // 2. Assignments to locals declared in this procedure
        for (AssignExpr assign : ASTUtility.findOutsideClosures(root, AssignExpr.class)) {
            if (assign.getOperator() != AssignExpr.Operator.ASSIGN || !(assign.getTarget() instanceof NameExpr name)) {
                continue;
            }
            Optional<Node> declaration = context.declarationOf(name);
            if (declaration.isEmpty() || !(declaration.get() instanceof VariableDeclarator declarator)
                    || !ASTUtility.isAncestorOrSelf(root, declarator)
                    || ASTUtility.isInsideClosure(declarator, root)) {
                continue;
            }
            if (typeClassifier.producesResource(assign.getValue(), declarator.getType())) {
                TrackedVariable variable = TrackedVariable.of(declarator);
                found.putIfAbsent(variable, new ResourceCandidate(variable, assign.getValue()));
            }
        }
        return new ArrayList<>(found.values());
    }
}
