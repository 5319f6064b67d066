package com.tributary.execution;

import com.tributary.runtime.RowIterator;
import com.tributary.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of an adaptively executed plan.
 *
 * <p>Before execution the current plan is the initial physical plan. The
 * first time the partition layout is requested the plan is finalized:
 * query stages that turn out to produce no partitions are removed from
 * unions. The finalized plan is then used for execution and reporting.
 */
public final class AdaptivePlanExec extends PhysicalPlan {

    private static final Logger logger = LoggerFactory.getLogger(AdaptivePlanExec.class);

    private final PhysicalPlan initialPlan;
    private volatile PhysicalPlan currentPlan;
    private volatile boolean isFinalPlan = false;

    public AdaptivePlanExec(PhysicalPlan initialPlan) {
        this.initialPlan = initialPlan;
        this.currentPlan = initialPlan;
    }

    public PhysicalPlan initialPlan() {
        return initialPlan;
    }

    /**
     * Returns the plan currently standing in for this node: the initial plan
     * before execution, the finalized plan after.
     *
     * @return the current plan
     */
    public PhysicalPlan executedPlan() {
        return currentPlan;
    }

    public boolean isFinalPlan() {
        return isFinalPlan;
    }

    /**
     * Re-plans once from the observed partition layout. Later calls return
     * the same plan.
     *
     * @return the final plan
     */
    public synchronized PhysicalPlan finalPlan() {
        if (!isFinalPlan) {
            PhysicalPlan replanned = pruneEmptyStages(initialPlan);
            if (replanned != initialPlan) {
                logger.debug("Adaptive re-plan removed empty stages:\n{}", replanned.treeString());
            }
            currentPlan = replanned;
            isFinalPlan = true;
        }
        return currentPlan;
    }

    private static PhysicalPlan pruneEmptyStages(PhysicalPlan plan) {
        List<PhysicalPlan> children = plan.children();
        if (children.isEmpty() || plan.kind() == NodeKind.ADAPTIVE) {
            return plan;
        }
        List<PhysicalPlan> newChildren = new ArrayList<>(children.size());
        boolean changed = false;
        for (PhysicalPlan child : children) {
            if (plan instanceof UnionExec
                    && child.kind() == NodeKind.QUERY_STAGE
                    && child.numPartitions() == 0) {
                changed = true;
                continue;
            }
            PhysicalPlan newChild = pruneEmptyStages(child);
            changed |= newChild != child;
            newChildren.add(newChild);
        }
        return changed ? plan.withNewChildren(newChildren) : plan;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ADAPTIVE;
    }

    @Override
    public String nodeName() {
        return "AdaptivePlan";
    }

    @Override
    public List<PhysicalPlan> children() {
        return List.of(currentPlan);
    }

    @Override
    public StructType schema() {
        return initialPlan.schema();
    }

    @Override
    public int numPartitions() {
        return finalPlan().numPartitions();
    }

    @Override
    public RowIterator execute(int partition) {
        return finalPlan().execute(partition);
    }

    @Override
    protected String argString() {
        return "isFinalPlan=" + isFinalPlan;
    }
}
