package com.tributary.connect.service;

import com.tributary.arrow.EncodedBatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reorder buffer between the partition tasks of one query and the thread that
 * streams its results.
 *
 * <p>Producers deliver each partition's batches once, in any order. A single
 * consumer takes partitions strictly in increasing index order, waiting until
 * the next one has arrived or the job has failed. A taken slot is cleared so
 * sent batches can be collected.
 *
 * <p>Slots and the failure are guarded by one lock and observed through one
 * condition, so an arrival and a failure cannot be missed between the check
 * and the wait. Only the first failure is kept. A partition that arrived
 * before the consumer reached it is still returned after a failure; the
 * failure surfaces at the first partition that never arrived.
 */
public final class PartitionBatchSet {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final List<List<EncodedBatch>> slots;
    private final boolean[] arrived;
    private final boolean[] taken;
    private Throwable failure;

    public PartitionBatchSet(int numPartitions) {
        if (numPartitions < 0) {
            throw new IllegalArgumentException("numPartitions must not be negative, got: " + numPartitions);
        }
        this.slots = new ArrayList<>(Collections.nCopies(numPartitions, null));
        this.arrived = new boolean[numPartitions];
        this.taken = new boolean[numPartitions];
    }

    public int numPartitions() {
        return arrived.length;
    }

    /**
     * Records a partition's batches and wakes the consumer. Never blocks
     * beyond acquiring the lock.
     *
     * @param partition the partition index
     * @param batches the partition's batches in encoding order
     * @throws IllegalStateException if the partition was already delivered
     */
    public void put(int partition, List<EncodedBatch> batches) {
        checkIndex(partition);
        lock.lock();
        try {
            if (arrived[partition]) {
                throw new IllegalStateException("Partition " + partition + " was already delivered");
            }
            slots.set(partition, List.copyOf(batches));
            arrived[partition] = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the job's failure and wakes the consumer. Later failures are
     * ignored.
     *
     * @param cause the failure
     * @return true if this call recorded the failure
     */
    public boolean fail(Throwable cause) {
        lock.lock();
        try {
            if (failure != null) {
                return false;
            }
            failure = cause;
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for a partition and removes its batches from the set.
     *
     * @param partition the partition index
     * @return the partition's batches
     * @throws ExecutionException if the job failed before the partition arrived;
     *     the cause is the recorded failure
     * @throws InterruptedException if interrupted while waiting
     * @throws IllegalStateException if the partition was already taken
     */
    public List<EncodedBatch> take(int partition) throws ExecutionException, InterruptedException {
        checkIndex(partition);
        lock.lock();
        try {
            while (!arrived[partition] && failure == null) {
                changed.await();
            }
            if (!arrived[partition]) {
                throw new ExecutionException(failure);
            }
            if (taken[partition]) {
                throw new IllegalStateException("Partition " + partition + " was already taken");
            }
            taken[partition] = true;
            List<EncodedBatch> batches = slots.get(partition);
            slots.set(partition, null);
            return batches;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of partitions delivered but not yet taken.
     */
    public int pendingPartitions() {
        lock.lock();
        try {
            int pending = 0;
            for (int i = 0; i < arrived.length; i++) {
                if (arrived[i] && !taken[i]) {
                    pending++;
                }
            }
            return pending;
        } finally {
            lock.unlock();
        }
    }

    private void checkIndex(int partition) {
        if (partition < 0 || partition >= arrived.length) {
            throw new IndexOutOfBoundsException(
                "Partition " + partition + " out of range [0, " + arrived.length + ")");
        }
    }
}
