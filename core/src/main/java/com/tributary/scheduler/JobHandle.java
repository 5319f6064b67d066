package com.tributary.scheduler;

import java.util.concurrent.CompletableFuture;

/**
 * A submitted job.
 */
public interface JobHandle {

    int jobId();

    /**
     * Completes normally once every partition result has been handed to the
     * result handler, or exceptionally with a
     * {@link com.tributary.exception.JobFailedException} on the first task
     * failure or on cancellation. Completed on the scheduler's event thread.
     *
     * @return the completion future
     */
    CompletableFuture<Void> completion();

    /**
     * Cancels the job. Running tasks are interrupted and no further results
     * are delivered. Has no effect on a finished job.
     *
     * @param reason included in the failure message
     */
    void cancel(String reason);
}
