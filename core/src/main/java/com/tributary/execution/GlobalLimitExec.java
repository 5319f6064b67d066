package com.tributary.execution;

import com.tributary.execution.metric.SQLMetric;
import com.tributary.runtime.RowIterator;
import com.tributary.types.StructType;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Keeps the first {@code limit} rows of its child, reading the child's
 * partitions in order within a single partition of its own.
 */
public final class GlobalLimitExec extends PhysicalPlan {

    private final PhysicalPlan child;
    private final long limit;
    private final SQLMetric numOutputRows;

    public GlobalLimitExec(PhysicalPlan child, long limit) {
        this.child = child;
        this.limit = limit;
        this.numOutputRows = registerMetric("numOutputRows", SQLMetric.count("number of output rows"));
    }

    public long limit() {
        return limit;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STANDARD;
    }

    @Override
    public String nodeName() {
        return "GlobalLimit";
    }

    @Override
    public List<PhysicalPlan> children() {
        return List.of(child);
    }

    @Override
    public StructType schema() {
        return child.schema();
    }

    @Override
    public int numPartitions() {
        return 1;
    }

    @Override
    public RowIterator execute(int partition) {
        checkPartition(partition);
        return counting(new LimitIterator(), numOutputRows);
    }

    @Override
    protected PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new GlobalLimitExec(newChildren.get(0), limit);
    }

    @Override
    protected String argString() {
        return String.valueOf(limit);
    }

    /**
     * Opens child partitions one at a time, closing each before the next.
     */
    private final class LimitIterator implements RowIterator {
        private final int childPartitions = child.numPartitions();
        private int nextPartition = 0;
        private RowIterator current;
        private long produced = 0;

        @Override
        public boolean hasNext() {
            if (produced >= limit) {
                close();
                return false;
            }
            while (current == null || !current.hasNext()) {
                if (current != null) {
                    current.close();
                    current = null;
                }
                if (nextPartition >= childPartitions) {
                    return false;
                }
                current = child.execute(nextPartition++);
            }
            return true;
        }

        @Override
        public Object[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            produced++;
            return current.next();
        }

        @Override
        public void close() {
            if (current != null) {
                current.close();
                current = null;
            }
            nextPartition = childPartitions;
        }
    }
}
