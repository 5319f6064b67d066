package com.tributary.arrow;

import com.tributary.types.StructType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, single-use sequence of encoded batches over a row iterator.
 *
 * <p>Vectors are reused between batches. The iterator closes its vectors and
 * allocator once the rows are exhausted; callers stopping early must call
 * {@link #close()}.
 */
public final class EncodedBatchIterator implements Iterator<EncodedBatch>, AutoCloseable {

    private final Iterator<Object[]> rows;
    private final BufferAllocator allocator;
    private final VectorSchemaRoot root;
    private final ColumnWriter[] writers;
    private final int maxRecordsPerBatch;
    private final long maxEstimatedBatchBytes;

    private boolean closed = false;

    EncodedBatchIterator(Iterator<Object[]> rows,
                         StructType schema,
                         Schema arrowSchema,
                         BufferAllocator allocator,
                         int maxRecordsPerBatch,
                         long maxEstimatedBatchBytes) {
        this.rows = rows;
        this.allocator = allocator;
        this.maxRecordsPerBatch = maxRecordsPerBatch;
        this.maxEstimatedBatchBytes = maxEstimatedBatchBytes;
        try {
            this.root = VectorSchemaRoot.create(arrowSchema, allocator);
        } catch (RuntimeException e) {
            allocator.close();
            throw e;
        }
        List<FieldVector> vectors = root.getFieldVectors();
        this.writers = new ColumnWriter[vectors.size()];
        for (int i = 0; i < writers.length; i++) {
            writers[i] = ColumnWriter.forVector(schema.fieldAt(i).dataType(), vectors.get(i));
        }
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        if (!rows.hasNext()) {
            close();
            return false;
        }
        return true;
    }

    @Override
    public EncodedBatch next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        try {
            root.clear();
            root.allocateNew();

            int rowCount = 0;
            long estimatedBytes = 0;
            while (rows.hasNext()
                    && rowCount < maxRecordsPerBatch
                    && (estimatedBytes < maxEstimatedBatchBytes || rowCount == 0)) {
                Object[] row = rows.next();
                for (int col = 0; col < writers.length; col++) {
                    estimatedBytes += writers[col].write(rowCount, row[col]);
                }
                rowCount++;
            }
            root.setRowCount(rowCount);

            return new EncodedBatch(ArrowBatchEncoder.serialize(root), rowCount);
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        root.close();
        allocator.close();
    }
}
