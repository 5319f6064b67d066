package com.tributary.exception;

/**
 * Thrown when a parallel job is aborted, either because one of its tasks
 * failed or because the job was cancelled. The failing task's throwable is
 * the cause.
 */
public class JobFailedException extends TributaryException {

    private final int jobId;

    public JobFailedException(int jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public int jobId() {
        return jobId;
    }
}
