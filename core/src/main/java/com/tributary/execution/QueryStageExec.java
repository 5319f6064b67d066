package com.tributary.execution;

import com.tributary.runtime.RowIterator;
import com.tributary.types.StructType;

import java.util.List;

/**
 * Marks the boundary of a query stage under adaptive execution. Delegates
 * everything to the stage's plan.
 */
public final class QueryStageExec extends PhysicalPlan {

    private final int stageId;
    private final PhysicalPlan plan;

    public QueryStageExec(int stageId, PhysicalPlan plan) {
        this.stageId = stageId;
        this.plan = plan;
    }

    public int stageId() {
        return stageId;
    }

    public PhysicalPlan plan() {
        return plan;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.QUERY_STAGE;
    }

    @Override
    public String nodeName() {
        return "QueryStage";
    }

    @Override
    public List<PhysicalPlan> children() {
        return List.of(plan);
    }

    @Override
    public StructType schema() {
        return plan.schema();
    }

    @Override
    public int numPartitions() {
        return plan.numPartitions();
    }

    @Override
    public RowIterator execute(int partition) {
        return plan.execute(partition);
    }

    @Override
    protected PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new QueryStageExec(stageId, newChildren.get(0));
    }

    @Override
    protected String argString() {
        return String.valueOf(stageId);
    }
}
