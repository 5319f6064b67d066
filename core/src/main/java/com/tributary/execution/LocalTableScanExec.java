package com.tributary.execution;

import com.tributary.execution.metric.SQLMetric;
import com.tributary.runtime.RowIterator;
import com.tributary.types.StructType;

import java.util.List;

/**
 * Scans rows held in memory. An empty table has no partitions.
 */
public final class LocalTableScanExec extends PhysicalPlan {

    private final StructType schema;
    private final List<Object[]> rows;
    private final SQLMetric numOutputRows;

    public LocalTableScanExec(StructType schema, List<Object[]> rows) {
        this.schema = schema;
        this.rows = List.copyOf(rows);
        this.numOutputRows = registerMetric("numOutputRows", SQLMetric.count("number of output rows"));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LEAF;
    }

    @Override
    public String nodeName() {
        return "LocalTableScan";
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
        return rows.isEmpty() ? 0 : 1;
    }

    @Override
    public RowIterator execute(int partition) {
        checkPartition(partition);
        return counting(RowIterator.of(rows), numOutputRows);
    }

    @Override
    protected String argString() {
        return schema.simpleString() + ", " + rows.size() + " rows";
    }
}
