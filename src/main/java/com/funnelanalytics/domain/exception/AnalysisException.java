package com.funnelanalytics.domain.exception;

/**
 * Base type for failures an analysis request reports to its caller.
 */
public abstract class AnalysisException extends RuntimeException {

    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
