package com.raditha.release.analysis;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.raditha.release.config.ReleaseAnalysisConfig;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Recognises releases by method name.
 * <p>
 * A receiver method such as {@code close} releases its scope when called
 * without arguments. A static helper such as {@code closeQuietly} releases
 * its single argument.
 */
public class MethodNameReleaseClassifier implements ReleaseClassifier {
    private final Set<String> receiverMethods;
    private final Set<String> staticMethods;

    public MethodNameReleaseClassifier() {
        this(Set.of("close"), Set.of("closeQuietly"));
    }

    public MethodNameReleaseClassifier(Collection<String> receiverMethods, Collection<String> staticMethods) {
        this.receiverMethods = Set.copyOf(receiverMethods);
        this.staticMethods = Set.copyOf(staticMethods);
    }

    public static MethodNameReleaseClassifier from(ReleaseAnalysisConfig config) {
        return new MethodNameReleaseClassifier(config.releaseMethods(), config.staticReleaseMethods());
    }

    @Override
    public Optional<Expression> releasedOperand(MethodCallExpr call) {
        String name = call.getNameAsString();
        if (receiverMethods.contains(name) && call.getArguments().isEmpty()) {
            return call.getScope();
        }
        if (staticMethods.contains(name) && call.getArguments().size() == 1) {
            return Optional.of(call.getArgument(0));
        }
        return Optional.empty();
    }
}
