package com.raditha.release.model;

/**
 * Raised when an {@link AbortSignal} fires in the middle of an analysis.
 */
public class AnalysisAbortedException extends RuntimeException {

    public AnalysisAbortedException(String message) {
        super(message);
    }
}
