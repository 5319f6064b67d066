package com.tributary.scheduler;

/**
 * Work done for one partition of a job.
 *
 * @param <R> the partition result type
 */
@FunctionalInterface
public interface PartitionTask<R> {

    /**
     * Computes one partition. Runs on a worker thread.
     *
     * @param partition the partition index
     * @return the partition's result
     * @throws Exception on failure; fails the whole job
     */
    R run(int partition) throws Exception;
}
