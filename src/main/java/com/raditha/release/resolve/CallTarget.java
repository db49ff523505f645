package com.raditha.release.resolve;

import java.util.List;
import java.util.Optional;

/**
 * What is known about the method a call invokes.
 *
 * @param name           method name as written at the call site
 * @param parameterNames declared parameter names, empty when the target is unknown
 * @param resolved       whether a declaration was found
 */
public record CallTarget(String name, List<String> parameterNames, boolean resolved) {

    public CallTarget {
        parameterNames = List.copyOf(parameterNames);
    }

    public static CallTarget unresolved(String name) {
        return new CallTarget(name, List.of(), false);
    }

    public Optional<String> parameterName(int index) {
        if (index < 0 || index >= parameterNames.size()) {
            return Optional.empty();
        }
        return Optional.of(parameterNames.get(index));
    }
}
