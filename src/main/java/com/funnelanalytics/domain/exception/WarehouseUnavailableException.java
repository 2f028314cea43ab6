package com.funnelanalytics.domain.exception;

public class WarehouseUnavailableException extends AnalysisException {

    public WarehouseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
