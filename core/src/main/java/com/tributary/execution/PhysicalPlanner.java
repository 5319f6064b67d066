package com.tributary.execution;

import com.tributary.exception.AnalysisException;
import com.tributary.logical.Limit;
import com.tributary.logical.LocalRelation;
import com.tributary.logical.LogicalPlan;
import com.tributary.logical.RangeRelation;
import com.tributary.logical.SQLRelation;
import com.tributary.logical.TableScan;
import com.tributary.logical.Union;
import com.tributary.runtime.DuckDBRuntime;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a logical plan into an operator tree.
 *
 * <p>With adaptive execution enabled the tree is rooted at an
 * {@link AdaptivePlanExec}, and a {@link QueryStageExec} is placed wherever
 * partitions are regrouped: around every union input and around the input
 * of a global limit. One planner plans one query; stage ids are numbered
 * from 0 per planner.
 */
public class PhysicalPlanner {

    private final DuckDBRuntime runtime;
    private final PlannerOptions options;
    private int nextStageId = 0;

    public PhysicalPlanner(DuckDBRuntime runtime, PlannerOptions options) {
        this.runtime = runtime;
        this.options = options;
    }

    /**
     * Plans the whole query.
     *
     * @param logical the analyzed plan
     * @return the executable root
     * @throws AnalysisException if a node has no physical counterpart
     */
    public PhysicalPlan plan(LogicalPlan logical) {
        PhysicalPlan physical = planNode(logical);
        return options.adaptiveEnabled() ? new AdaptivePlanExec(physical) : physical;
    }

    private PhysicalPlan planNode(LogicalPlan logical) {
        if (logical instanceof RangeRelation range) {
            return new RangeExec(range, range.numPartitions().orElse(options.defaultParallelism()));
        }
        if (logical instanceof SQLRelation sql) {
            return new DuckDBScanExec(runtime, sql.query(), sql.schema(), options.zone());
        }
        if (logical instanceof TableScan scan) {
            return new DuckDBScanExec(runtime, scan.toDuckDBQuery(), scan.schema(), options.zone());
        }
        if (logical instanceof LocalRelation local) {
            return new LocalTableScanExec(local.schema(), local.rows());
        }
        if (logical instanceof Union union) {
            List<PhysicalPlan> inputs = new ArrayList<>(union.children().size());
            for (LogicalPlan child : union.children()) {
                inputs.add(stage(planNode(child)));
            }
            return new UnionExec(union.schema(), inputs);
        }
        if (logical instanceof Limit limit) {
            return new GlobalLimitExec(stage(planNode(limit.child())), limit.limit());
        }
        throw new AnalysisException("No physical plan for logical operator: " + logical.simpleString());
    }

    private PhysicalPlan stage(PhysicalPlan plan) {
        return options.adaptiveEnabled() ? new QueryStageExec(nextStageId++, plan) : plan;
    }
}
