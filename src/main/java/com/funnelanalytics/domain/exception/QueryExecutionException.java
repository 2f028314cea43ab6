package com.funnelanalytics.domain.exception;

public class QueryExecutionException extends AnalysisException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
