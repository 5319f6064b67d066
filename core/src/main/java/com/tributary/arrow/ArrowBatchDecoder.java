package com.tributary.arrow;

import com.tributary.exception.AnalysisException;
import com.tributary.types.AtomicType;
import com.tributary.types.DataType;
import com.tributary.types.DecimalType;
import com.tributary.types.StructType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.LargeVarBinaryVector;
import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.types.pojo.ArrowType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decodes an Arrow IPC stream into rows in the internal value representation.
 * Used for data a client ships inside a plan.
 */
public class ArrowBatchDecoder {

    private final BufferAllocator allocator;

    public ArrowBatchDecoder(BufferAllocator allocator) {
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
    }

    /**
     * Rows decoded from an Arrow stream together with their schema.
     */
    public record DecodedRows(StructType schema, List<Object[]> rows) {}

    /**
     * Reads every record batch of an Arrow IPC stream.
     *
     * @param data the IPC stream bytes
     * @return the schema and all rows, in stream order
     * @throws AnalysisException if the stream is malformed or uses unsupported types
     */
    public DecodedRows decode(byte[] data) {
        try (BufferAllocator child = allocator.newChildAllocator("arrow-batch-decoder", 0, Long.MAX_VALUE);
             ArrowStreamReader reader = new ArrowStreamReader(new ByteArrayInputStream(data), child)) {

            VectorSchemaRoot root = reader.getVectorSchemaRoot();
            StructType schema = ArrowSchemas.fromArrowSchema(root.getSchema());
            List<Object[]> rows = new ArrayList<>();

            while (reader.loadNextBatch()) {
                List<FieldVector> vectors = root.getFieldVectors();
                for (int r = 0; r < root.getRowCount(); r++) {
                    Object[] row = new Object[vectors.size()];
                    for (int c = 0; c < row.length; c++) {
                        row[c] = readValue(vectors.get(c), r, schema.fieldAt(c).dataType());
                    }
                    rows.add(row);
                }
            }
            return new DecodedRows(schema, rows);
        } catch (IOException e) {
            throw new AnalysisException("Invalid Arrow IPC stream in local relation: " + e.getMessage(), e);
        }
    }

    private static Object readValue(FieldVector vector, int index, DataType type) {
        if (vector.isNull(index)) {
            return null;
        }
        if (type instanceof DecimalType) {
            return ((DecimalVector) vector).getObject(index);
        }
        switch ((AtomicType) type) {
            case BOOLEAN:
                return ((BitVector) vector).get(index) != 0;
            case BYTE:
                return ((TinyIntVector) vector).get(index);
            case SHORT:
                return ((SmallIntVector) vector).get(index);
            case INTEGER:
                return ((IntVector) vector).get(index);
            case LONG:
                return ((BigIntVector) vector).get(index);
            case FLOAT:
                return ((Float4Vector) vector).get(index);
            case DOUBLE:
                return ((Float8Vector) vector).get(index);
            case STRING:
                byte[] utf8 = vector instanceof LargeVarCharVector large
                    ? large.get(index)
                    : ((VarCharVector) vector).get(index);
                return new String(utf8, StandardCharsets.UTF_8);
            case BINARY:
                return vector instanceof LargeVarBinaryVector large
                    ? large.get(index)
                    : ((VarBinaryVector) vector).get(index);
            case DATE:
                if (vector instanceof DateMilliVector millis) {
                    return (int) Math.floorDiv(millis.get(index), 86_400_000L);
                }
                return ((DateDayVector) vector).get(index);
            case TIMESTAMP:
                return toMicros((TimeStampVector) vector, index);
            default:
                throw new IllegalArgumentException("Unhandled type: " + type);
        }
    }

    private static long toMicros(TimeStampVector vector, int index) {
        long value = vector.get(index);
        ArrowType.Timestamp type = (ArrowType.Timestamp) vector.getField().getType();
        switch (type.getUnit()) {
            case SECOND:
                return Math.multiplyExact(value, 1_000_000L);
            case MILLISECOND:
                return Math.multiplyExact(value, 1_000L);
            case NANOSECOND:
                return Math.floorDiv(value, 1_000L);
            default:
                return value;
        }
    }
}
