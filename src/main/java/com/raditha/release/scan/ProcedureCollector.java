package com.raditha.release.scan;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.raditha.release.model.Procedure;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects every analyzable procedure of a compilation unit: methods with a
 * body, constructors, initializer blocks and lambdas, including those nested
 * in anonymous and local classes.
 */
public class ProcedureCollector {

    public List<Procedure> collect(CompilationUnit cu) {
        List<Procedure> procedures = new ArrayList<>();
        cu.accept(new ProcedureVisitor(), procedures);
        return procedures;
    }

    /**
     * Visitor that records a procedure before descending into it, so outer
     * procedures come before the lambdas they contain.
     */
    private static class ProcedureVisitor extends VoidVisitorAdapter<List<Procedure>> {

        @Override
        public void visit(MethodDeclaration method, List<Procedure> procedures) {
            // Skip methods without body (abstract, interface methods)
            if (method.getBody().isPresent()) {
                procedures.add(Procedure.of(method));
            }
            super.visit(method, procedures);
        }

        @Override
        public void visit(ConstructorDeclaration constructor, List<Procedure> procedures) {
            procedures.add(Procedure.of(constructor));
            super.visit(constructor, procedures);
        }

        @Override
        public void visit(InitializerDeclaration initializer, List<Procedure> procedures) {
            procedures.add(Procedure.of(initializer));
            super.visit(initializer, procedures);
        }

        @Override
        public void visit(LambdaExpr lambda, List<Procedure> procedures) {
            procedures.add(Procedure.of(lambda));
            super.visit(lambda, procedures);
        }
    }
}
