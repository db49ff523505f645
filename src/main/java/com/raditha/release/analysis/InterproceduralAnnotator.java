package com.raditha.release.analysis;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.raditha.release.config.ReleaseAnalysisConfig;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.InterproceduralInfo;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.CallTarget;
import com.raditha.release.resolve.ResolutionContext;
import com.raditha.release.util.ASTUtility;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Flags calls that receive the variable and might release it.
 * <p>
 * The test is a name heuristic: the callee name contains a release keyword,
 * or the receiving parameter's name contains an ownership keyword. It is not
 * sound, so the result is advisory and never changes a verdict.
 */
public class InterproceduralAnnotator {
    private final List<String> releaseKeywords;
    private final List<String> ownershipKeywords;

    public InterproceduralAnnotator() {
        this(List.of("close", "dispose", "release"), List.of("owner"));
    }

    public InterproceduralAnnotator(Collection<String> releaseKeywords, Collection<String> ownershipKeywords) {
        this.releaseKeywords = lowerCase(releaseKeywords);
        this.ownershipKeywords = lowerCase(ownershipKeywords);
    }

    public static InterproceduralAnnotator from(ReleaseAnalysisConfig config) {
        return new InterproceduralAnnotator(config.releaseKeywords(), config.ownershipKeywords());
    }

    private static List<String> lowerCase(Collection<String> words) {
        return words.stream().map(w -> w.toLowerCase(Locale.ROOT)).toList();
    }

    public InterproceduralInfo annotate(Procedure procedure, TrackedVariable variable, ResolutionContext context,
                                        AbortSignal abort) {
        List<String> calls = new ArrayList<>();
        List<String> potential = new ArrayList<>();
        for (MethodCallExpr call : ASTUtility.findOutsideClosures(procedure.declaration(), MethodCallExpr.class)) {
            abort.throwIfAborted();
            int position = argumentPosition(call, variable, context);
            if (position < 0) {
                continue;
            }
            CallTarget target = context.resolveCallTarget(call)
                    .orElseGet(() -> CallTarget.unresolved(call.getNameAsString()));
            String description = target.name() + " (line " + ASTUtility.lineOf(call) + ")";
            calls.add(description);
            if (mightRelease(target, position)) {
                potential.add(description);
            }
        }
        return new InterproceduralInfo(calls, potential);
    }

    private int argumentPosition(MethodCallExpr call, TrackedVariable variable, ResolutionContext context) {
        List<Expression> arguments = call.getArguments();
        for (int i = 0; i < arguments.size(); i++) {
            if (context.refersTo(arguments.get(i), variable)) {
                return i;
            }
        }
        return -1;
    }

    boolean mightRelease(CallTarget target, int argumentIndex) {
        String name = target.name().toLowerCase(Locale.ROOT);
        if (releaseKeywords.stream().anyMatch(name::contains)) {
            return true;
        }
        return target.parameterName(argumentIndex)
                .map(p -> p.toLowerCase(Locale.ROOT))
                .filter(p -> ownershipKeywords.stream().anyMatch(p::contains))
                .isPresent();
    }
}
