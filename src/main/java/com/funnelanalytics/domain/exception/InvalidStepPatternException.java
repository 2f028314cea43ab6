package com.funnelanalytics.domain.exception;

/**
 * Step list cannot form a funnel (fewer than two usable steps, missing type, ...).
 */
public class InvalidStepPatternException extends InvalidAnalysisRequestException {

    public InvalidStepPatternException(String message) {
        super(message);
    }
}
