package com.raditha.release.analysis;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;

import java.util.Optional;

/**
 * Decides which calls run a release protocol. Supplied by the caller so the
 * engine does not depend on any particular resource type.
 */
@FunctionalInterface
public interface ReleaseClassifier {

    /**
     * The expression a call releases, or empty if the call is not a release.
     * For {@code in.close()} that is {@code in}; for
     * {@code IOUtils.closeQuietly(in)} it is also {@code in}.
     */
    Optional<Expression> releasedOperand(MethodCallExpr call);
}
