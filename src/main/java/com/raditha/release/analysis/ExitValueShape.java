package com.raditha.release.analysis;

import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SwitchExpr;

import java.util.Optional;
import java.util.Set;

/**
 * The closed set of value shapes an exit can hand back.
 */
enum ExitValueShape {
    /**
     * A bare name.
     */
    REFERENCE,

    /**
     * Parentheses, casts and calls that pass their first argument through:
     * {@code Objects.requireNonNull(x)}, {@code CompletableFuture.completedFuture(x)}.
     */
    WRAPPER,

    /**
     * {@code c ? a : b}.
     */
    CONDITIONAL,

    /**
     * Null-coalescing calls: {@code Objects.requireNonNullElse(a, b)},
     * {@code Objects.requireNonNullElseGet(a, s)} and
     * {@code Optional.ofNullable(a).orElse(b)} with its orElseGet and
     * orElseThrow variants.
     */
    COALESCE,

    /**
     * A switch expression.
     */
    SWITCH,

    OTHER;

    private static final Set<String> PASS_THROUGH = Set.of("requireNonNull", "completedFuture", "completedStage");
    private static final Set<String> STATIC_COALESCE = Set.of("requireNonNullElse", "requireNonNullElseGet");
    private static final Set<String> OPTIONAL_FALLBACK = Set.of("orElse", "orElseGet", "orElseThrow");
    private static final Set<String> OPTIONAL_FACTORY = Set.of("ofNullable", "of");

    static ExitValueShape of(Expression value) {
        if (value instanceof NameExpr) {
            return REFERENCE;
        }
        if (value instanceof EnclosedExpr || value instanceof CastExpr) {
            return WRAPPER;
        }
        if (value instanceof ConditionalExpr) {
            return CONDITIONAL;
        }
        if (value instanceof SwitchExpr) {
            return SWITCH;
        }
        if (value instanceof MethodCallExpr call) {
            if (PASS_THROUGH.contains(call.getNameAsString()) && !call.getArguments().isEmpty()) {
                return WRAPPER;
            }
            if (coalescedValue(call).isPresent()) {
                return COALESCE;
            }
        }
        return OTHER;
    }

    /**
     * The expression a wrapper passes through.
     */
    static Expression unwrapOnce(Expression value) {
        if (value instanceof EnclosedExpr enclosed) {
            return enclosed.getInner();
        }
        if (value instanceof CastExpr cast) {
            return cast.getExpression();
        }
        return ((MethodCallExpr) value).getArgument(0);
    }

    /**
     * The left operand of a coalescing call.
     */
    static Optional<Expression> coalescedValue(MethodCallExpr call) {
        String name = call.getNameAsString();
        if (STATIC_COALESCE.contains(name) && call.getArguments().size() == 2) {
            return Optional.of(call.getArgument(0));
        }
        if (OPTIONAL_FALLBACK.contains(name) && call.getScope().isPresent()
                && call.getScope().get() instanceof MethodCallExpr factory
                && OPTIONAL_FACTORY.contains(factory.getNameAsString())
                && factory.getArguments().size() == 1) {
            return Optional.of(factory.getArgument(0));
        }
        return Optional.empty();
    }
}
