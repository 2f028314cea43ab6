package com.funnelanalytics.domain.exception;

import lombok.Getter;

/**
 * The hit read would scan more rows than the warehouse allows. Not retried.
 */
@Getter
public class QueryResourceLimitException extends AnalysisException {

    private final long rowsRequested;
    private final long rowLimit;

    public QueryResourceLimitException(long rowsRequested, long rowLimit) {
        super(String.format("Query would scan %d rows, limit is %d. Narrow the date range.", rowsRequested, rowLimit));
        this.rowsRequested = rowsRequested;
        this.rowLimit = rowLimit;
    }
}
