package com.tributary.scheduler;

import com.tributary.exception.JobFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide job scheduler: tasks run on a fixed worker pool, all job
 * bookkeeping happens on one event thread.
 *
 * <p>Workers only compute; every outcome (task success, task failure,
 * cancellation) is posted to the event thread, which updates the job,
 * hands results to the job's {@link ResultHandler} and completes the job's
 * future. A job's state is therefore only ever touched by the event thread.
 *
 * <p>The first task failure fails the job; its remaining tasks are
 * interrupted and later outcomes are ignored.
 */
public class ParallelJobScheduler implements JobScheduler, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ParallelJobScheduler.class);

    private final ExecutorService workers;
    private final ExecutorService eventLoop;
    private final AtomicInteger nextJobId = new AtomicInteger();
    private final AtomicInteger nextWorkerId = new AtomicInteger();
    private final int parallelism;

    /**
     * @param parallelism number of worker threads
     */
    public ParallelJobScheduler(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
        this.parallelism = parallelism;
        this.workers = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "task-worker-" + nextWorkerId.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.eventLoop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "scheduler-event-loop");
            t.setDaemon(true);
            return t;
        });
        logger.info("ParallelJobScheduler initialized: parallelism={}", parallelism);
    }

    public int parallelism() {
        return parallelism;
    }

    @Override
    public <R> JobHandle submitJob(String description,
                                   int numPartitions,
                                   PartitionTask<R> task,
                                   ResultHandler<R> resultHandler) {
        if (numPartitions < 0) {
            throw new IllegalArgumentException("numPartitions must not be negative, got: " + numPartitions);
        }
        Job<R> job = new Job<>(nextJobId.getAndIncrement(), description, numPartitions, resultHandler);
        logger.debug("Submitting job {} ({}) with {} tasks", job.jobId, description, numPartitions);
        if (numPartitions == 0) {
            job.completion.complete(null);
            return job;
        }
        for (int p = 0; p < numPartitions; p++) {
            final int partition = p;
            job.tasks.add(workers.submit(() -> runTask(job, task, partition)));
        }
        return job;
    }

    private <R> void runTask(Job<R> job, PartitionTask<R> task, int partition) {
        if (job.completion.isDone()) {
            return;
        }
        try {
            R result = task.run(partition);
            post(() -> job.onTaskSucceeded(partition, result));
        } catch (Throwable t) {
            post(() -> job.onTaskFailed(partition, t));
        }
    }

    private void post(Runnable event) {
        try {
            eventLoop.execute(event);
        } catch (RejectedExecutionException e) {
            logger.warn("Scheduler event dropped: event loop is shut down");
        }
    }

    /**
     * Stops accepting jobs and shuts down both thread pools, interrupting
     * running tasks.
     */
    @Override
    public void close() {
        logger.info("Shutting down ParallelJobScheduler");
        workers.shutdownNow();
        eventLoop.shutdown();
        try {
            if (!eventLoop.awaitTermination(5, TimeUnit.SECONDS)) {
                eventLoop.shutdownNow();
            }
        } catch (InterruptedException e) {
            eventLoop.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Per-job state; mutated on the event thread only, except for the task list.
     */
    private final class Job<R> implements JobHandle {
        private final int jobId;
        private final String description;
        private final ResultHandler<R> resultHandler;
        private final CompletableFuture<Void> completion = new CompletableFuture<>();
        // Appended by the submitting thread while the event thread may already be cancelling
        private final Queue<Future<?>> tasks = new ConcurrentLinkedQueue<>();
        private int remaining;
        private boolean finished = false;

        Job(int jobId, String description, int numPartitions, ResultHandler<R> resultHandler) {
            this.jobId = jobId;
            this.description = description;
            this.resultHandler = resultHandler;
            this.remaining = numPartitions;
        }

        void onTaskSucceeded(int partition, R result) {
            if (finished) {
                return;
            }
            try {
                resultHandler.onPartitionResult(partition, result);
            } catch (RuntimeException e) {
                fail(new JobFailedException(jobId,
                    "Job " + jobId + " aborted: result handler failed for partition " + partition, e));
                return;
            }
            if (--remaining == 0) {
                finished = true;
                logger.debug("Job {} ({}) finished", jobId, description);
                completion.complete(null);
            }
        }

        void onTaskFailed(int partition, Throwable cause) {
            if (finished) {
                return;
            }
            logger.debug("Job {} ({}): task for partition {} failed", jobId, description, partition, cause);
            fail(new JobFailedException(jobId,
                "Job " + jobId + " aborted due to failure of task for partition " + partition + ": " + cause,
                cause));
        }

        void onCancelled(String reason) {
            if (finished) {
                return;
            }
            logger.info("Job {} ({}) cancelled: {}", jobId, description, reason);
            fail(new JobFailedException(jobId, "Job " + jobId + " cancelled: " + reason,
                new CancellationException(reason)));
        }

        private void fail(JobFailedException failure) {
            finished = true;
            for (Future<?> task : tasks) {
                task.cancel(true);
            }
            completion.completeExceptionally(failure);
        }

        @Override
        public int jobId() {
            return jobId;
        }

        @Override
        public CompletableFuture<Void> completion() {
            return completion;
        }

        @Override
        public void cancel(String reason) {
            post(() -> onCancelled(reason));
        }
    }
}
