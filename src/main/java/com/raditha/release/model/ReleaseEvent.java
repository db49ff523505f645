package com.raditha.release.model;

import com.github.javaparser.ast.expr.MethodCallExpr;
import com.raditha.release.util.ASTUtility;

import java.util.Objects;

/**
 * A call that runs the release protocol on a tracked variable.
 *
 * @param call     the releasing call
 * @param variable the variable it releases
 */
public record ReleaseEvent(MethodCallExpr call, TrackedVariable variable) {

    public ReleaseEvent {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(variable, "variable");
    }

    public int line() {
        return ASTUtility.lineOf(call);
    }

    /**
     * Format as "r.close() at line 12".
     */
    public String describe() {
        return call + " at line " + line();
    }
}
