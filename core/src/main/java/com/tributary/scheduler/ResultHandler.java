package com.tributary.scheduler;

/**
 * Receives the result of each successful partition.
 *
 * <p>Called on the scheduler's event thread, which is shared by all jobs.
 * Implementations must return quickly and must not block.
 *
 * @param <R> the partition result type
 */
@FunctionalInterface
public interface ResultHandler<R> {

    void onPartitionResult(int partition, R result);
}
