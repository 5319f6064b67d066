package com.tributary.execution;

import com.tributary.runtime.RowIterator;
import com.tributary.types.StructType;

import java.util.List;

/**
 * Concatenates the partitions of its children: the first child's partitions
 * come first, then the second child's, and so on.
 */
public final class UnionExec extends PhysicalPlan {

    private final StructType schema;
    private final List<PhysicalPlan> children;

    public UnionExec(StructType schema, List<PhysicalPlan> children) {
        this.schema = schema;
        this.children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STANDARD;
    }

    @Override
    public String nodeName() {
        return "Union";
    }

    @Override
    public List<PhysicalPlan> children() {
        return children;
    }

    @Override
    public StructType schema() {
        return schema;
    }

    @Override
    public int numPartitions() {
        int total = 0;
        for (PhysicalPlan child : children) {
            total += child.numPartitions();
        }
        return total;
    }

    @Override
    public RowIterator execute(int partition) {
        checkPartition(partition);
        int remaining = partition;
        for (PhysicalPlan child : children) {
            int childPartitions = child.numPartitions();
            if (remaining < childPartitions) {
                return child.execute(remaining);
            }
            remaining -= childPartitions;
        }
        throw new IllegalStateException("Partition " + partition + " not found in union children");
    }

    @Override
    protected PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new UnionExec(schema, newChildren);
    }
}
