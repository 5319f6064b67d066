package com.tributary.connect.service;

import com.tributary.connect.proto.ExecutePlanResponse;
import com.tributary.execution.AdaptivePlanExec;
import com.tributary.execution.PhysicalPlan;
import com.tributary.execution.QueryStageExec;
import com.tributary.execution.metric.SQLMetric;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the metrics trailer of a query from its physical plan.
 *
 * <p>The tree is walked depth-first. Adaptive and query stage wrappers are not
 * reported themselves: each is replaced by the plan it currently stands for,
 * which is attributed to the wrapper's parent. Every other operator yields one
 * metric object. The root names itself as parent.
 */
public final class MetricsSnapshotter {

    private MetricsSnapshotter() {
    }

    public static ExecutePlanResponse.Metrics buildMetrics(PhysicalPlan root) {
        List<ExecutePlanResponse.Metrics.MetricObject> objects = new ArrayList<>();
        PhysicalPlan unwrappedRoot = unwrap(root);
        collect(unwrappedRoot, unwrappedRoot.id(), objects);
        return ExecutePlanResponse.Metrics.newBuilder().addAllMetrics(objects).build();
    }

    private static void collect(PhysicalPlan plan,
                                long parentId,
                                List<ExecutePlanResponse.Metrics.MetricObject> out) {
        PhysicalPlan node = unwrap(plan);
        out.add(toMetricObject(node, parentId));
        for (PhysicalPlan child : node.children()) {
            collect(child, node.id(), out);
        }
    }

    static PhysicalPlan unwrap(PhysicalPlan plan) {
        PhysicalPlan current = plan;
        while (current.kind().isWrapper()) {
            switch (current.kind()) {
                case ADAPTIVE -> current = ((AdaptivePlanExec) current).executedPlan();
                case QUERY_STAGE -> current = ((QueryStageExec) current).plan();
                default -> throw new IllegalStateException("Unexpected wrapper kind " + current.kind());
            }
        }
        return current;
    }

    private static ExecutePlanResponse.Metrics.MetricObject toMetricObject(PhysicalPlan node, long parentId) {
        ExecutePlanResponse.Metrics.MetricObject.Builder builder =
            ExecutePlanResponse.Metrics.MetricObject.newBuilder()
                .setName(node.nodeName())
                .setPlanId(node.id())
                .setParent(parentId);
        for (Map.Entry<String, SQLMetric> entry : node.metrics().entrySet()) {
            SQLMetric metric = entry.getValue();
            builder.putExecutionMetrics(entry.getKey(),
                ExecutePlanResponse.Metrics.MetricValue.newBuilder()
                    .setName(metric.displayName())
                    .setValue(metric.value())
                    .setMetricType(metric.metricType().wireName())
                    .build());
        }
        return builder.build();
    }
}
