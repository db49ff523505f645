package com.raditha.release.scan;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;
import com.raditha.release.config.ReleaseAnalysisConfig;
import com.raditha.release.util.ASTUtility;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether an expression produces a resource that must be released.
 * <p>
 * With the symbol solver the produced type must be, or extend,
 * {@code java.lang.AutoCloseable}. Without it, or when resolution fails, the
 * simple type name is compared with the configured resource names and
 * suffixes: the instantiated type for {@code new}, the declared type for a
 * factory call.
 */
public class ResourceTypeClassifier {
    private static final Logger logger = LoggerFactory.getLogger(ResourceTypeClassifier.class);
    private static final String AUTO_CLOSEABLE = "java.lang.AutoCloseable";

    private final Set<String> resourceTypes;
    private final List<String> resourceSuffixes;
    private final boolean useSymbols;

    public ResourceTypeClassifier(ReleaseAnalysisConfig config) {
        this.resourceTypes = Set.copyOf(config.resourceTypes());
        this.resourceSuffixes = config.resourceTypeSuffixes();
        this.useSymbols = config.useSymbolSolver();
    }

    public boolean producesResource(Expression value, @Nullable Type declaredType) {
        Expression e = ASTUtility.unwrap(value);
        if (e instanceof NullLiteralExpr) {
            return false;
        }
        if (useSymbols) {
            Optional<Boolean> resolved = isAutoCloseable(e);
            if (resolved.isPresent()) {
                return resolved.get();
            }
        }
        if (e instanceof ObjectCreationExpr creation) {
            return isResourceTypeName(creation.getType().getNameAsString());
        }
        if (e instanceof MethodCallExpr && declaredType instanceof ClassOrInterfaceType type) {
            return isResourceTypeName(type.getNameAsString());
        }
        return false;
    }

    private Optional<Boolean> isAutoCloseable(Expression expression) {
        try {
            ResolvedType type = expression.calculateResolvedType();
            if (!type.isReferenceType()) {
                return Optional.of(false);
            }
            ResolvedReferenceType reference = type.asReferenceType();
            if (AUTO_CLOSEABLE.equals(reference.getQualifiedName())) {
                return Optional.of(true);
            }
            return Optional.of(reference.getAllAncestors().stream()
                    .anyMatch(a -> AUTO_CLOSEABLE.equals(a.getQualifiedName())));
        } catch (RuntimeException e) {
            logger.debug("Could not resolve the type of {}: {}", expression, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isResourceTypeName(String simpleName) {
        if (resourceTypes.contains(simpleName)) {
            return true;
        }
        for (String suffix : resourceSuffixes) {
            if (simpleName.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }
}
