package com.raditha.release.model;

/**
 * Cooperative cancellation flag polled by long running loops.
 */
@FunctionalInterface
public interface AbortSignal {

    AbortSignal NONE = () -> false;

    boolean isAborted();

    /**
     * @throws AnalysisAbortedException if the caller asked to stop
     */
    default void throwIfAborted() {
        if (isAborted()) {
            throw new AnalysisAbortedException("Release analysis aborted");
        }
    }
}
