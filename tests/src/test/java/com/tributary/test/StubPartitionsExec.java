package com.tributary.test;

import com.tributary.execution.PhysicalPlan;
import com.tributary.runtime.RowIterator;
import com.tributary.types.StructType;

import java.util.List;

/**
 * Leaf operator serving fixed rows per partition.
 */
public class StubPartitionsExec extends PhysicalPlan {

    private final StructType schema;
    private final List<List<Object[]>> partitions;

    public StubPartitionsExec(StructType schema, List<List<Object[]>> partitions) {
        this.schema = schema;
        this.partitions = partitions;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LEAF;
    }

    @Override
    public String nodeName() {
        return "StubPartitions";
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
        return partitions.size();
    }

    @Override
    public RowIterator execute(int partition) {
        checkPartition(partition);
        return RowIterator.of(partitions.get(partition));
    }
}
