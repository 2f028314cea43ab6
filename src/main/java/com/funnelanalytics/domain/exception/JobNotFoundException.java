package com.funnelanalytics.domain.exception;

import java.util.UUID;

public class JobNotFoundException extends AnalysisException {

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
    }
}
