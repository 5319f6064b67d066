package com.tributary.connect.service;

import com.tributary.arrow.ArrowBatchDecoder;
import com.tributary.arrow.ArrowBatchEncoder;
import com.tributary.connect.proto.ExecutePlanResponse;
import com.tributary.exception.JobFailedException;
import com.tributary.execution.RangeExec;
import com.tributary.scheduler.ParallelJobScheduler;
import com.tributary.test.RecordingObserver;
import com.tributary.test.ReverseOrderJobScheduler;
import com.tributary.test.StubPartitionsExec;
import com.tributary.test.TestBase;
import com.tributary.test.TestCategories;
import com.tributary.types.AtomicType;
import com.tributary.types.StructField;
import com.tributary.types.StructType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for StreamingResultHandler: ordered draining of out-of-order
 * partitions, the empty-result placeholder, the metrics trailer and failure
 * propagation.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("StreamingResultHandler Tests")
class StreamingResultHandlerTest extends TestBase {

    private static final String UTC = "UTC";
    private static final long BATCH_BYTES = 1024 * 1024;

    private BufferAllocator allocator;
    private ArrowBatchEncoder encoder;
    private ArrowBatchDecoder decoder;

    @Override
    protected void doSetUp() {
        allocator = new RootAllocator(Long.MAX_VALUE);
        encoder = new ArrowBatchEncoder(allocator);
        decoder = new ArrowBatchDecoder(allocator);
    }

    @Override
    protected void doTearDown() {
        allocator.close();
    }

    private List<ExecutePlanResponse> batchesOf(RecordingObserver<ExecutePlanResponse> observer) {
        return observer.values().stream()
            .filter(ExecutePlanResponse::hasArrowBatch)
            .collect(Collectors.toList());
    }

    private List<Long> idsOf(List<ExecutePlanResponse> batches) {
        List<Long> ids = new ArrayList<>();
        for (ExecutePlanResponse response : batches) {
            for (Object[] row : decoder.decode(response.getArrowBatch().getData().toByteArray()).rows()) {
                ids.add((Long) row[0]);
            }
        }
        return ids;
    }

    private static List<Long> range(long start, long end) {
        return LongStream.range(start, end).boxed().collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Partition ordering")
    class OrderingTests {

        @Test
        @DisplayName("Partitions completed in reverse order are streamed in index order")
        void reverseCompletionIsReordered() {
            // Given: 10 rows over 4 slices of sizes 2, 3, 2, 3, completed 3, 2, 1, 0
            RecordingObserver<ExecutePlanResponse> observer = new RecordingObserver<>();
            try (ReverseOrderJobScheduler scheduler = new ReverseOrderJobScheduler()) {
                StreamingResultHandler handler =
                    new StreamingResultHandler(observer, scheduler, encoder, "client-1", "op-1");

                // When
                handler.streamResults(new RangeExec(0, 10, 1, 4), 2, BATCH_BYTES, UTC);

                // Then
                assertThat(scheduler.completionOrder()).containsExactly(3, 2, 1, 0);
            }
            List<ExecutePlanResponse> batches = batchesOf(observer);
            assertThat(batches).extracting(r -> r.getArrowBatch().getRowCount())
                .containsExactly(2L, 2L, 1L, 2L, 2L, 1L);
            assertThat(idsOf(batches)).containsExactlyElementsOf(range(0, 10));
            assertThat(observer.isCompleted()).isTrue();
            assertThat(observer.error()).isNull();
        }

        @Test
        @DisplayName("Batches are written on the calling thread, not the scheduler callback thread")
        void batchesAreWrittenOnCallingThread() {
            List<String> writerThreads = new ArrayList<>();
            RecordingObserver<ExecutePlanResponse> observer = new RecordingObserver<>() {
                @Override
                public synchronized void onNext(ExecutePlanResponse value) {
                    writerThreads.add(Thread.currentThread().getName());
                    super.onNext(value);
                }
            };
            try (ReverseOrderJobScheduler scheduler = new ReverseOrderJobScheduler()) {
                new StreamingResultHandler(observer, scheduler, encoder, "client-1", "op-2")
                    .streamResults(new RangeExec(0, 6, 1, 3), 0, BATCH_BYTES, UTC);

                assertThat(scheduler.callbackThreadNames()).containsOnly("fake-scheduler-callbacks");
            }
            assertThat(writerThreads).isNotEmpty().containsOnly(Thread.currentThread().getName());
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 3, 8, 17})
        @DisplayName("Real scheduler output matches partition order")
        void parallelSchedulerPreservesOrder(int slices) {
            RecordingObserver<ExecutePlanResponse> observer = new RecordingObserver<>();
            try (ParallelJobScheduler scheduler = new ParallelJobScheduler(4)) {
                new StreamingResultHandler(observer, scheduler, encoder, "client-1", "op-3")
                    .streamResults(new RangeExec(0, 1000, 1, slices), 100, BATCH_BYTES, UTC);
            }
            assertThat(idsOf(batchesOf(observer))).containsExactlyElementsOf(range(0, 1000));
            assertThat(observer.isCompleted()).isTrue();
        }

        @Test
        @DisplayName("Every response echoes client and operation ids")
        void responsesCarryIds() {
            RecordingObserver<ExecutePlanResponse> observer = new RecordingObserver<>();
            try (ReverseOrderJobScheduler scheduler = new ReverseOrderJobScheduler()) {
                new StreamingResultHandler(observer, scheduler, encoder, "client-7", "op-7")
                    .streamResults(new RangeExec(0, 4, 1, 2), 0, BATCH_BYTES, UTC);
            }
            assertThat(observer.values()).allSatisfy(response -> {
                assertThat(response.getClientId()).isEqualTo("client-7");
                assertThat(response.getOperationId()).isEqualTo("op-7");
            });
        }
    }

    @Nested
    @DisplayName("Empty results and metrics trailer")
    class EmptyResultTests {

        @Test
        @DisplayName("A plan with zero partitions sends one empty batch, then metrics")
        void zeroPartitionsSendPlaceholder() {
            RecordingObserver<ExecutePlanResponse> observer = new RecordingObserver<>();
            try (ReverseOrderJobScheduler scheduler = new ReverseOrderJobScheduler()) {
                new StreamingResultHandler(observer, scheduler, encoder, "client-1", "op-4")
                    .streamResults(new RangeExec(5, 5, 1, 4), 10, BATCH_BYTES, UTC);
            }

            List<ExecutePlanResponse> responses = observer.values();
            assertThat(responses).hasSize(2);
            assertThat(responses.get(0).hasArrowBatch()).isTrue();
            assertThat(responses.get(0).getArrowBatch().getRowCount()).isZero();
            ArrowBatchDecoder.DecodedRows decoded =
                decoder.decode(responses.get(0).getArrowBatch().getData().toByteArray());
            assertThat(decoded.rows()).isEmpty();
            assertThat(decoded.schema().fieldAt(0).name()).isEqualTo("id");
            assertThat(responses.get(1).hasMetrics()).isTrue();
            assertThat(observer.isCompleted()).isTrue();
        }

        @Test
        @DisplayName("Partitions that are all empty still produce exactly one placeholder batch")
        void allEmptyPartitionsSendPlaceholder() {
            StructType schema = new StructType(List.of(new StructField("name", AtomicType.STRING, true)));
            StubPartitionsExec plan = new StubPartitionsExec(schema, List.of(List.of(), List.of(), List.of()));
            RecordingObserver<ExecutePlanResponse> observer = new RecordingObserver<>();
            try (ReverseOrderJobScheduler scheduler = new ReverseOrderJobScheduler()) {
                new StreamingResultHandler(observer, scheduler, encoder, "client-1", "op-5")
                    .streamResults(plan, 10, BATCH_BYTES, UTC);
            }

            assertThat(batchesOf(observer)).hasSize(1);
            assertThat(batchesOf(observer).get(0).getArrowBatch().getRowCount()).isZero();
            assertThat(observer.values()).filteredOn(ExecutePlanResponse::hasMetrics).hasSize(1);
            assertThat(observer.values().get(observer.values().size() - 1).hasMetrics()).isTrue();
        }

        @Test
        @DisplayName("The metrics trailer is the last message and reports output rows")
        void metricsTrailerFollowsBatches() {
            RecordingObserver<ExecutePlanResponse> observer = new RecordingObserver<>();
            RangeExec plan = new RangeExec(0, 50, 1, 5);
            try (ReverseOrderJobScheduler scheduler = new ReverseOrderJobScheduler()) {
                new StreamingResultHandler(observer, scheduler, encoder, "client-1", "op-6")
                    .streamResults(plan, 10, BATCH_BYTES, UTC);
            }

            List<ExecutePlanResponse> responses = observer.values();
            ExecutePlanResponse last = responses.get(responses.size() - 1);
            assertThat(last.hasMetrics()).isTrue();
            assertThat(responses.subList(0, responses.size() - 1)).allMatch(ExecutePlanResponse::hasArrowBatch);

            ExecutePlanResponse.Metrics.MetricObject range = last.getMetrics().getMetrics(0);
            assertThat(range.getName()).isEqualTo("Range");
            assertThat(range.getPlanId()).isEqualTo(plan.id());
            assertThat(range.getExecutionMetricsMap().get("numOutputRows").getValue()).isEqualTo(50);
            assertThat(range.getExecutionMetricsMap().get("numOutputRows").getMetricType()).isEqualTo("sum");
        }
    }

    @Nested
    @DisplayName("Failure propagation")
    class FailureTests {

        @Test
        @DisplayName("Failure at partition k after 0..k-1 completed sends exactly those batches")
        void failureAfterEarlierPartitions() {
            // Given: 5 slices of 2 rows; partition 2 fails after 0, 1, 3 and 4 have completed
            RecordingObserver<ExecutePlanResponse> observer = new RecordingObserver<>();
            try (ReverseOrderJobScheduler scheduler = new ReverseOrderJobScheduler(2, true)) {
                StreamingResultHandler handler =
                    new StreamingResultHandler(observer, scheduler, encoder, "client-1", "op-8");

                // When / Then
                assertThatThrownBy(() -> handler.streamResults(new RangeExec(0, 10, 1, 5), 0, BATCH_BYTES, UTC))
                    .isInstanceOf(JobFailedException.class)
                    .hasMessageContaining("partition 2")
                    .hasRootCauseInstanceOf(IllegalStateException.class);
            }

            assertThat(idsOf(batchesOf(observer))).containsExactly(0L, 1L, 2L, 3L);
            assertThat(observer.values()).noneMatch(ExecutePlanResponse::hasMetrics);
            assertThat(observer.isCompleted()).isFalse();
            assertThat(observer.error()).isNull();
        }

        @Test
        @DisplayName("Failure at the first partition sends no batches")
        void failureAtFirstPartition() {
            RecordingObserver<ExecutePlanResponse> observer = new RecordingObserver<>();
            try (ReverseOrderJobScheduler scheduler = new ReverseOrderJobScheduler(0, false)) {
                StreamingResultHandler handler =
                    new StreamingResultHandler(observer, scheduler, encoder, "client-1", "op-9");

                assertThatThrownBy(() -> handler.streamResults(new RangeExec(0, 10, 1, 5), 0, BATCH_BYTES, UTC))
                    .isInstanceOf(JobFailedException.class);
            }
            assertThat(observer.values()).isEmpty();
        }

        @Test
        @DisplayName("A task exception on the real scheduler aborts the stream")
        void realSchedulerTaskFailure() {
            StructType schema = new StructType(List.of(new StructField("id", AtomicType.LONG, false)));
            List<List<Object[]>> partitions = List.of(
                List.<Object[]>of(new Object[] {1L}),
                List.<Object[]>of(new Object[] {"not a long"}));
            RecordingObserver<ExecutePlanResponse> observer = new RecordingObserver<>();
            try (ParallelJobScheduler scheduler = new ParallelJobScheduler(2)) {
                StreamingResultHandler handler =
                    new StreamingResultHandler(observer, scheduler, encoder, "client-1", "op-10");

                assertThatThrownBy(() -> handler.streamResults(
                        new StubPartitionsExec(schema, partitions), 0, BATCH_BYTES, UTC))
                    .isInstanceOf(JobFailedException.class)
                    .hasMessageContaining("partition 1");
            }
            assertThat(observer.values()).noneMatch(ExecutePlanResponse::hasMetrics);
            assertThat(observer.isCompleted()).isFalse();
        }
    }
}
