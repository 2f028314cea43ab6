package com.funnelanalytics.domain.exception;

public class InvalidAnalysisRequestException extends AnalysisException {

    public InvalidAnalysisRequestException(String message) {
        super(message);
    }
}
