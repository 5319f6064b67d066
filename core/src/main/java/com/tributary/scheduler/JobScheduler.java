package com.tributary.scheduler;

/**
 * Runs a computation across N partitions in parallel and reports back per
 * partition.
 */
public interface JobScheduler {

    /**
     * Submits a job of {@code numPartitions} independent tasks. Returns
     * immediately.
     *
     * @param description shown in logs
     * @param numPartitions number of tasks; zero completes the job at once
     * @param task the work for one partition
     * @param resultHandler receives each successful partition's result
     * @param <R> the partition result type
     * @return the job handle
     */
    <R> JobHandle submitJob(String description,
                            int numPartitions,
                            PartitionTask<R> task,
                            ResultHandler<R> resultHandler);
}
