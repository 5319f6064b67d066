package com.tributary.arrow;

import com.tributary.test.TestBase;
import com.tributary.test.TestCategories;
import com.tributary.types.AtomicType;
import com.tributary.types.DecimalType;
import com.tributary.types.StructField;
import com.tributary.types.StructType;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ArrowBatchEncoder batch boundaries and ArrowBatchDecoder.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ArrowBatchEncoder Tests")
class ArrowBatchEncoderTest extends TestBase {

    private static final StructType IDS = new StructType(new StructField("id", AtomicType.LONG, false));

    private RootAllocator allocator;
    private ArrowBatchEncoder encoder;
    private ArrowBatchDecoder decoder;

    @Override
    protected void doSetUp() {
        allocator = new RootAllocator();
        encoder = new ArrowBatchEncoder(allocator);
        decoder = new ArrowBatchDecoder(allocator);
    }

    @Override
    protected void doTearDown() {
        // Closing fails if any batch leaked buffers
        allocator.close();
    }

    private static Iterator<Object[]> ids(long count) {
        return LongStream.range(0, count).mapToObj(i -> new Object[] {i}).iterator();
    }

    private static List<EncodedBatch> drain(EncodedBatchIterator batches) {
        List<EncodedBatch> result = new ArrayList<>();
        try (batches) {
            batches.forEachRemaining(result::add);
        }
        return result;
    }

    @Nested
    @DisplayName("Batch boundaries")
    class BoundaryTests {

        @Test
        @DisplayName("The row limit splits batches")
        void rowLimit() {
            List<EncodedBatch> batches = drain(encoder.encode(ids(10), IDS, 4, Long.MAX_VALUE, "UTC"));

            assertThat(batches).extracting(EncodedBatch::rowCount).containsExactly(4L, 4L, 2L);
        }

        @Test
        @DisplayName("A non-positive row limit means unlimited")
        void unlimitedRows() {
            List<EncodedBatch> batches = drain(encoder.encode(ids(25_000), IDS, 0, Long.MAX_VALUE, "UTC"));

            assertThat(batches).extracting(EncodedBatch::rowCount).containsExactly(25_000L);
        }

        @Test
        @DisplayName("The byte estimate ends a batch once reached")
        void byteLimit() {
            // 8 bytes per long: the batch closes after the row that reaches 20 bytes
            List<EncodedBatch> batches = drain(encoder.encode(ids(10), IDS, 100, 20, "UTC"));

            assertThat(batches).extracting(EncodedBatch::rowCount).containsExactly(3L, 3L, 3L, 1L);
        }

        @Test
        @DisplayName("A row larger than the byte limit still goes out alone")
        void oversizedRow() {
            StructType schema = new StructType(new StructField("s", AtomicType.STRING, true));
            String big = "x".repeat(10_000);
            List<Object[]> rows = List.of(new Object[] {big}, new Object[] {big});

            List<EncodedBatch> batches = drain(encoder.encode(rows.iterator(), schema, 100, 1, "UTC"));

            assertThat(batches).extracting(EncodedBatch::rowCount).containsExactly(1L, 1L);
        }

        @Test
        @DisplayName("No rows produce no batches")
        void noRows() {
            assertThat(drain(encoder.encode(ids(0), IDS, 10, 100, "UTC"))).isEmpty();
        }

        @Test
        @DisplayName("Rows are not read before the iterator is advanced")
        void lazy() {
            Iterator<Object[]> exploding = new Iterator<>() {
                @Override
                public boolean hasNext() {
                    throw new IllegalStateException("read too early");
                }

                @Override
                public Object[] next() {
                    throw new IllegalStateException("read too early");
                }
            };

            EncodedBatchIterator batches = encoder.encode(exploding, IDS, 10, 100, "UTC");
            try (batches) {
                assertThatThrownBy(batches::hasNext).hasMessage("read too early");
            }
        }

        @Test
        @DisplayName("Stopping early and closing releases memory")
        void earlyClose() {
            EncodedBatchIterator batches = encoder.encode(ids(100), IDS, 10, Long.MAX_VALUE, "UTC");
            batches.next();
            batches.close();

            assertThat(allocator.getAllocatedMemory()).isZero();
            assertThat(batches.hasNext()).isFalse();
        }
    }

    @Nested
    @DisplayName("Batch contents")
    class ContentTests {

        @Test
        @DisplayName("Every batch is a self-describing stream")
        void batchesDecodeIndependently() {
            List<EncodedBatch> batches = drain(encoder.encode(ids(7), IDS, 3, Long.MAX_VALUE, "UTC"));

            List<Object> decoded = new ArrayList<>();
            for (EncodedBatch batch : batches) {
                ArrowBatchDecoder.DecodedRows rows = decoder.decode(batch.data());
                assertThat(rows.schema()).isEqualTo(IDS);
                rows.rows().forEach(row -> decoded.add(row[0]));
            }
            assertThat(decoded).containsExactly(0L, 1L, 2L, 3L, 4L, 5L, 6L);
        }

        @Test
        @DisplayName("Values of every column type survive encoding")
        void allTypes() {
            StructType schema = new StructType(
                new StructField("b", AtomicType.BOOLEAN, true),
                new StructField("i8", AtomicType.BYTE, true),
                new StructField("i16", AtomicType.SHORT, true),
                new StructField("i32", AtomicType.INTEGER, true),
                new StructField("f", AtomicType.FLOAT, true),
                new StructField("d", AtomicType.DOUBLE, true),
                new StructField("s", AtomicType.STRING, true),
                new StructField("bin", AtomicType.BINARY, true),
                new StructField("day", AtomicType.DATE, true),
                new StructField("ts", AtomicType.TIMESTAMP, true),
                new StructField("dec", new DecimalType(10, 2), true));
            Object[] values = {
                true, (byte) 7, (short) 300, 70_000, 1.5f, 2.25, "héllo",
                "raw".getBytes(StandardCharsets.UTF_8), 19_000, 1_700_000_000_123_456L, new BigDecimal("12.30")
            };
            Object[] nulls = new Object[values.length];

            List<EncodedBatch> batches = drain(encoder.encode(
                List.of(values, nulls).iterator(), schema, 10, Long.MAX_VALUE, "Europe/Paris"));
            List<Object[]> rows = decoder.decode(batches.get(0).data()).rows();

            assertThat(rows).hasSize(2);
            assertThat(rows.get(0)).containsExactly(values);
            assertThat(rows.get(1)).containsOnlyNulls();
        }

        @Test
        @DisplayName("Timestamp columns carry the session time zone")
        void timestampZone() throws Exception {
            StructType schema = new StructType(new StructField("ts", AtomicType.TIMESTAMP, true));
            EncodedBatch batch = encoder.createEmptyBatch(schema, "Asia/Tokyo");

            try (ArrowStreamReader reader = new ArrowStreamReader(new ByteArrayInputStream(batch.data()), allocator)) {
                ArrowType.Timestamp type = (ArrowType.Timestamp)
                    reader.getVectorSchemaRoot().getSchema().getFields().get(0).getType();
                assertThat(type.getTimezone()).isEqualTo("Asia/Tokyo");
            }
        }

        @Test
        @DisplayName("The empty batch carries the schema and no rows")
        void emptyBatch() {
            StructType schema = new StructType(
                new StructField("id", AtomicType.LONG, false),
                new StructField("name", AtomicType.STRING, true));

            EncodedBatch batch = encoder.createEmptyBatch(schema, "UTC");
            ArrowBatchDecoder.DecodedRows decoded = decoder.decode(batch.data());

            assertThat(batch.rowCount()).isZero();
            assertThat(decoded.schema()).isEqualTo(schema);
            assertThat(decoded.rows()).isEmpty();
            assertThat(decoded.schema().fields().stream().map(StructField::name).collect(Collectors.joining(",")))
                .isEqualTo("id,name");
        }
    }
}
