package com.tributary.execution;

import com.tributary.execution.metric.SQLMetric;
import com.tributary.runtime.RowIterator;
import com.tributary.types.StructType;
import com.tributary.util.TreeStrings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class for executable operators.
 *
 * <p>An operator produces its rows in {@link #numPartitions()} independent
 * partitions; {@link #execute(int)} may be called for different partitions
 * concurrently from different worker threads. Each operator has a
 * process-unique id and a set of named metrics that its tasks add to.
 *
 * <p>Operators are one of four {@link NodeKind kinds}. The two wrapper kinds
 * stand in for a single current child and have no rows or metrics of their
 * own; anything walking the operator tree for reporting sees through them.
 */
public abstract class PhysicalPlan {

    /**
     * Structural role of an operator.
     */
    public enum NodeKind {
        /** Reads data; no children. */
        LEAF,
        /** Transforms the rows of its children. */
        STANDARD,
        /** Adaptive execution root; its current child may be replaced once execution starts. */
        ADAPTIVE,
        /** Boundary of an independently scheduled stage; wraps the stage's plan. */
        QUERY_STAGE;

        public boolean isWrapper() {
            return this == ADAPTIVE || this == QUERY_STAGE;
        }
    }

    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id = NEXT_ID.getAndIncrement();
    private final Map<String, SQLMetric> metrics = new LinkedHashMap<>();

    public final long id() {
        return id;
    }

    public abstract NodeKind kind();

    /**
     * Returns the operator name, e.g. {@code Range}.
     *
     * @return the node name
     */
    public abstract String nodeName();

    /**
     * Returns the child operators. For wrapper kinds this is the single
     * current child.
     *
     * @return the children, in order
     */
    public abstract List<PhysicalPlan> children();

    public abstract StructType schema();

    public abstract int numPartitions();

    /**
     * Computes one partition.
     *
     * @param partition partition index in {@code [0, numPartitions())}
     * @return the partition's rows; the caller must close the iterator
     */
    public abstract RowIterator execute(int partition);

    /**
     * Returns the same operator over new children. Only called with children
     * of the same schemas.
     *
     * @param newChildren the replacement children
     * @return the new operator
     */
    protected PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        throw new UnsupportedOperationException(nodeName() + " has no children to replace");
    }

    /**
     * Returns the operator arguments shown after the node name in plan trees.
     *
     * @return the arguments, or an empty string
     */
    protected String argString() {
        return "";
    }

    public String simpleString() {
        String args = argString();
        return args.isEmpty() ? nodeName() : nodeName() + " " + args;
    }

    public String treeString() {
        return TreeStrings.render(this, PhysicalPlan::simpleString, PhysicalPlan::children);
    }

    /**
     * Returns this operator's metrics by key, in registration order.
     *
     * @return an unmodifiable view of the metrics
     */
    public Map<String, SQLMetric> metrics() {
        return Collections.unmodifiableMap(metrics);
    }

    protected final SQLMetric registerMetric(String key, SQLMetric metric) {
        metrics.put(key, metric);
        return metric;
    }

    protected final void checkPartition(int partition) {
        if (partition < 0 || partition >= numPartitions()) {
            throw new IndexOutOfBoundsException(String.format(
                "Partition %d out of range for %s with %d partitions",
                partition, nodeName(), numPartitions()));
        }
    }

    /**
     * Wraps {@code rows} so that every row handed out is added to {@code counter}.
     */
    protected static RowIterator counting(RowIterator rows, SQLMetric counter) {
        return new RowIterator() {
            @Override
            public boolean hasNext() {
                return rows.hasNext();
            }

            @Override
            public Object[] next() {
                Object[] row = rows.next();
                counter.add(1);
                return row;
            }

            @Override
            public void close() {
                rows.close();
            }
        };
    }

    @Override
    public String toString() {
        return simpleString();
    }
}
