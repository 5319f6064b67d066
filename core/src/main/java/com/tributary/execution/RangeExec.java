package com.tributary.execution;

import com.tributary.execution.metric.SQLMetric;
import com.tributary.logical.RangeRelation;
import com.tributary.runtime.RowIterator;
import com.tributary.types.StructType;

import java.math.BigInteger;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.OptionalInt;

/**
 * Generates a range of longs split evenly into slices.
 *
 * <p>Slice {@code i} of {@code n} covers element indexes
 * {@code [i * count / n, (i + 1) * count / n)}. An empty range has no
 * partitions at all.
 */
public final class RangeExec extends PhysicalPlan {

    private final long start;
    private final long end;
    private final long step;
    private final int numSlices;
    private final long count;
    private final StructType schema;
    private final SQLMetric numOutputRows;

    public RangeExec(RangeRelation range, int numSlices) {
        if (numSlices <= 0) {
            throw new IllegalArgumentException("numSlices must be positive, got: " + numSlices);
        }
        this.start = range.start();
        this.end = range.end();
        this.step = range.step();
        this.numSlices = numSlices;
        this.count = range.count();
        this.schema = range.schema();
        this.numOutputRows = registerMetric("numOutputRows", SQLMetric.count("number of output rows"));
    }

    public RangeExec(long start, long end, long step, int numSlices) {
        this(new RangeRelation(start, end, step, OptionalInt.empty()), numSlices);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LEAF;
    }

    @Override
    public String nodeName() {
        return "Range";
    }

    @Override
    public List<PhysicalPlan> children() {
        return List.of();
    }

    @Override
    public StructType schema() {
        return schema;
    }

    @Override
    public int numPartitions() {
        return count == 0 ? 0 : numSlices;
    }

    @Override
    public RowIterator execute(int partition) {
        checkPartition(partition);
        long first = sliceBoundary(partition);
        long last = sliceBoundary(partition + 1);
        return counting(new RowIterator() {
            private long index = first;

            @Override
            public boolean hasNext() {
                return index < last;
            }

            @Override
            public Object[] next() {
                if (index >= last) {
                    throw new NoSuchElementException();
                }
                // Wraps like the engine's long arithmetic; in-range values never overflow
                long value = start + index * step;
                index++;
                return new Object[] {value};
            }

            @Override
            public void close() {
                index = last;
            }
        }, numOutputRows);
    }

    private long sliceBoundary(int slice) {
        return BigInteger.valueOf(slice)
            .multiply(BigInteger.valueOf(count))
            .divide(BigInteger.valueOf(numSlices))
            .longValueExact();
    }

    @Override
    protected String argString() {
        return String.format("(%d, %d, step=%d, splits=%d)", start, end, step, numSlices);
    }
}
