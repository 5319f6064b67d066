package com.tributary.arrow;

import com.tributary.runtime.StreamingConfig;
import com.tributary.types.StructType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.types.pojo.Schema;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.util.Iterator;
import java.util.Objects;

/**
 * Encodes rows into size-bounded, self-describing Arrow IPC batches.
 *
 * <p>Every batch is written as a complete Arrow stream (schema message plus
 * one record batch), so a client can decode any batch on its own. A batch
 * ends when it holds {@code maxRecordsPerBatch} rows or when its estimated
 * size reaches {@code maxEstimatedBatchBytes}, whichever comes first; it
 * always holds at least one row, so a single oversized row still goes out.
 *
 * <p>One encoder is shared by all queries; each {@link #encode} call works in
 * its own child allocator.
 */
public class ArrowBatchEncoder {

    private final BufferAllocator allocator;

    /**
     * @param allocator parent allocator, owned by the caller
     */
    public ArrowBatchEncoder(BufferAllocator allocator) {
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
    }

    /**
     * Starts lazily encoding {@code rows}. Nothing is read from {@code rows}
     * until the returned iterator is advanced.
     *
     * @param rows rows in the internal value representation
     * @param schema row schema
     * @param maxRecordsPerBatch row limit per batch; zero or negative means unlimited
     * @param maxEstimatedBatchBytes estimated byte limit per batch
     * @param timeZoneId zone stamped on timestamp columns
     * @return a single-use iterator that must be closed
     */
    public EncodedBatchIterator encode(Iterator<Object[]> rows,
                                       StructType schema,
                                       int maxRecordsPerBatch,
                                       long maxEstimatedBatchBytes,
                                       String timeZoneId) {
        return new EncodedBatchIterator(
            rows,
            schema,
            ArrowSchemas.toArrowSchema(schema, timeZoneId),
            allocator.newChildAllocator("arrow-batch-encoder", 0, Long.MAX_VALUE),
            StreamingConfig.normalizeMaxRecordsPerBatch(maxRecordsPerBatch),
            maxEstimatedBatchBytes);
    }

    /**
     * Creates the zero-row batch sent when a query produced no rows at all.
     *
     * @param schema row schema
     * @param timeZoneId zone stamped on timestamp columns
     * @return a batch holding only the schema and an empty record batch
     */
    public EncodedBatch createEmptyBatch(StructType schema, String timeZoneId) {
        Schema arrowSchema = ArrowSchemas.toArrowSchema(schema, timeZoneId);
        try (BufferAllocator child = allocator.newChildAllocator("arrow-empty-batch", 0, Long.MAX_VALUE);
             VectorSchemaRoot emptyRoot = VectorSchemaRoot.create(arrowSchema, child)) {
            emptyRoot.setRowCount(0);
            return new EncodedBatch(serialize(emptyRoot), 0);
        }
    }

    /**
     * Writes the root's current contents as a complete Arrow IPC stream.
     */
    static byte[] serialize(VectorSchemaRoot root) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ArrowStreamWriter writer = new ArrowStreamWriter(root, null, Channels.newChannel(out))) {
            // start() writes the schema message that makes each batch self-describing
            writer.start();
            writer.writeBatch();
            writer.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize Arrow batch", e);
        }
        return out.toByteArray();
    }
}
