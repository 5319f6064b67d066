package com.tributary.connect.service;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.protobuf.ByteString;
import com.tributary.arrow.ArrowBatchEncoder;
import com.tributary.arrow.EncodedBatch;
import com.tributary.arrow.EncodedBatchIterator;
import com.tributary.connect.proto.ExecutePlanResponse;
import com.tributary.execution.PhysicalPlan;
import com.tributary.runtime.RowIterator;
import com.tributary.scheduler.JobHandle;
import com.tributary.scheduler.JobScheduler;
import com.tributary.scheduler.PartitionTask;
import com.tributary.types.StructType;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Streams the result of a query to a gRPC client in partition order.
 *
 * <p>Partitions run as one job on the shared {@link JobScheduler}. Each task
 * encodes its partition into Arrow batches and hands the whole list back; the
 * scheduler's callback only stores it in a {@link PartitionBatchSet}. The
 * thread that called {@link #streamResults} drains the set in order
 * 0..N-1 and writes every batch to the stream, so network writes never run on
 * the scheduler's event thread.
 *
 * <p>Features:
 * <ul>
 *   <li>Client-visible order follows partition order, whatever order tasks finish in</li>
 *   <li>An empty result still sends one zero-row batch carrying the schema</li>
 *   <li>A metrics message follows the last batch</li>
 *   <li>A failed task aborts the stream after the partitions already sent</li>
 *   <li>Client cancellation cancels the job</li>
 * </ul>
 */
public class StreamingResultHandler {

    private static final Logger logger = LoggerFactory.getLogger(StreamingResultHandler.class);

    private final StreamObserver<ExecutePlanResponse> responseObserver;
    private final JobScheduler scheduler;
    private final ArrowBatchEncoder encoder;
    private final String clientId;
    private final String operationId;
    private final Context grpcContext;

    private int batchIndex = 0;
    private long totalRows = 0;

    /**
     * Create a streaming result handler.
     *
     * @param responseObserver gRPC stream observer for sending responses
     * @param scheduler runs the partition tasks
     * @param encoder encodes partition rows into Arrow batches
     * @param clientId client identifier echoed on every response
     * @param operationId operation identifier for logging and tracking
     */
    public StreamingResultHandler(StreamObserver<ExecutePlanResponse> responseObserver,
                                  JobScheduler scheduler,
                                  ArrowBatchEncoder encoder,
                                  String clientId,
                                  String operationId) {
        this.responseObserver = responseObserver;
        this.scheduler = scheduler;
        this.encoder = encoder;
        this.clientId = clientId;
        this.operationId = operationId;
        this.grpcContext = Context.current();
    }

    /**
     * Executes {@code plan} and streams all of its batches, then the metrics,
     * then completes the stream.
     *
     * <p>On failure nothing after the last fully sent partition is written and
     * the failure is thrown; the caller terminates the stream.
     *
     * @param plan the executed physical plan
     * @param maxRecordsPerBatch row limit per batch; zero or negative means unlimited
     * @param maxEstimatedBatchBytes estimated byte limit per batch
     * @param timeZoneId session time zone for timestamp columns
     */
    public void streamResults(PhysicalPlan plan,
                              int maxRecordsPerBatch,
                              long maxEstimatedBatchBytes,
                              String timeZoneId) {
        StructType schema = plan.schema();
        int numPartitions = plan.numPartitions();
        PartitionBatchSet batchSet = new PartitionBatchSet(numPartitions);

        PartitionTask<List<EncodedBatch>> task = partition ->
            encodePartition(plan, partition, schema, maxRecordsPerBatch, maxEstimatedBatchBytes, timeZoneId);

        JobHandle job = scheduler.submitJob(
            "ExecutePlan " + operationId, numPartitions, task, batchSet::put);
        job.completion().whenComplete((ignored, failure) -> {
            if (failure != null) {
                batchSet.fail(unwrap(failure));
            }
        });

        Context.CancellationListener onCancel = context ->
            job.cancel("client cancelled operation " + operationId);
        grpcContext.addListener(onCancel, MoreExecutors.directExecutor());

        try {
            for (int partition = 0; partition < numPartitions; partition++) {
                List<EncodedBatch> batches = awaitPartition(batchSet, partition, job);
                for (EncodedBatch batch : batches) {
                    sendBatch(batch);
                }
            }
        } finally {
            grpcContext.removeListener(onCancel);
        }

        if (batchIndex == 0) {
            sendBatch(encoder.createEmptyBatch(schema, timeZoneId));
        }

        sendMetrics(plan);
        responseObserver.onCompleted();

        logger.info("[{}] Streamed {} batches, {} total rows from {} partitions",
            operationId, batchIndex, totalRows, numPartitions);
    }

    private List<EncodedBatch> awaitPartition(PartitionBatchSet batchSet, int partition, JobHandle job) {
        if (grpcContext.isCancelled()) {
            logger.info("[{}] Query cancelled by client after {} batches, {} rows",
                operationId, batchIndex, totalRows);
            job.cancel("client cancelled operation " + operationId);
            throw Status.CANCELLED
                .withDescription("Operation " + operationId + " cancelled by client")
                .asRuntimeException();
        }
        try {
            return batchSet.take(partition);
        } catch (ExecutionException e) {
            logger.warn("[{}] Job failed while waiting for partition {} after {} batches",
                operationId, partition, batchIndex);
            throw asUnchecked(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.cancel("interrupted while streaming operation " + operationId);
            throw Status.CANCELLED
                .withDescription("Interrupted while waiting for partition " + partition)
                .withCause(e)
                .asRuntimeException();
        }
    }

    private List<EncodedBatch> encodePartition(PhysicalPlan plan,
                                               int partition,
                                               StructType schema,
                                               int maxRecordsPerBatch,
                                               long maxEstimatedBatchBytes,
                                               String timeZoneId) {
        List<EncodedBatch> batches = new ArrayList<>();
        try (RowIterator rows = plan.execute(partition);
             EncodedBatchIterator encoded = encoder.encode(
                 rows, schema, maxRecordsPerBatch, maxEstimatedBatchBytes, timeZoneId)) {
            encoded.forEachRemaining(batches::add);
        }
        return batches;
    }

    private void sendBatch(EncodedBatch batch) {
        ExecutePlanResponse response = ExecutePlanResponse.newBuilder()
            .setClientId(clientId)
            .setOperationId(operationId)
            .setArrowBatch(ExecutePlanResponse.ArrowBatch.newBuilder()
                .setRowCount(batch.rowCount())
                .setData(ByteString.copyFrom(batch.data()))
                .build())
            .build();

        responseObserver.onNext(response);

        logger.debug("[{}] Sent batch {}: {} rows, {} bytes",
            operationId, batchIndex, batch.rowCount(), batch.data().length);
        batchIndex++;
        totalRows += batch.rowCount();
    }

    private void sendMetrics(PhysicalPlan plan) {
        ExecutePlanResponse response = ExecutePlanResponse.newBuilder()
            .setClientId(clientId)
            .setOperationId(operationId)
            .setMetrics(MetricsSnapshotter.buildMetrics(plan))
            .build();
        responseObserver.onNext(response);
        logger.debug("[{}] Sent metrics for {} operators",
            operationId, response.getMetrics().getMetricsCount());
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private static RuntimeException asUnchecked(Throwable t) {
        if (t instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (t instanceof Error error) {
            throw error;
        }
        return new CompletionException(t);
    }
}
