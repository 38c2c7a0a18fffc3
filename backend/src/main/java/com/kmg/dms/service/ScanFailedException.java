package com.kmg.dms.service;

/**
 * A scan run aborted in its own bookkeeping. The scan job has already been marked FAILED.
 */
public class ScanFailedException extends RuntimeException {
    private final String jobId;

    public ScanFailedException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
