package com.raditha.release.scan;

import com.github.javaparser.ast.expr.Expression;
import com.raditha.release.model.TrackedVariable;

/**
 * A local variable that receives a resource.
 *
 * @param variable the local
 * @param creation the first resource-producing expression assigned to it
 */
public record ResourceCandidate(TrackedVariable variable, Expression creation) {
}
