package com.tributary.connect.service;

import com.tributary.connect.proto.ExecutePlanResponse;
import com.tributary.execution.AdaptivePlanExec;
import com.tributary.execution.GlobalLimitExec;
import com.tributary.execution.PhysicalPlan;
import com.tributary.execution.QueryStageExec;
import com.tributary.execution.RangeExec;
import com.tributary.execution.UnionExec;
import com.tributary.runtime.RowIterator;
import com.tributary.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("MetricsSnapshotter Tests")
class MetricsSnapshotterTest {

    @Test
    @DisplayName("Adaptive wrapper over B over C yields two metric objects")
    void adaptiveWrapperIsUnwrapped() {
        // Given: A (adaptive) -> B (GlobalLimit) -> C (Range)
        RangeExec c = new RangeExec(0, 10, 1, 2);
        GlobalLimitExec b = new GlobalLimitExec(c, 5);
        AdaptivePlanExec a = new AdaptivePlanExec(b);

        // When
        List<ExecutePlanResponse.Metrics.MetricObject> objects = MetricsSnapshotter.buildMetrics(a).getMetricsList();

        // Then
        assertThat(objects).hasSize(2);
        assertThat(objects).extracting(ExecutePlanResponse.Metrics.MetricObject::getName)
            .containsExactly("GlobalLimit", "Range");
        assertThat(objects.get(0).getPlanId()).isEqualTo(b.id());
        assertThat(objects.get(0).getParent()).isEqualTo(b.id());
        assertThat(objects.get(1).getPlanId()).isEqualTo(c.id());
        assertThat(objects.get(1).getParent()).isEqualTo(b.id());
        assertThat(objects).noneMatch(o -> o.getPlanId() == a.id());
    }

    @Test
    @DisplayName("Query stages are replaced by their plan and attributed to the stage's parent")
    void queryStagesAreUnwrapped() {
        RangeExec left = new RangeExec(0, 4, 1, 1);
        RangeExec right = new RangeExec(4, 8, 1, 1);
        UnionExec union = new UnionExec(left.schema(),
            List.of(new QueryStageExec(0, left), new QueryStageExec(1, right)));

        List<ExecutePlanResponse.Metrics.MetricObject> objects =
            MetricsSnapshotter.buildMetrics(new AdaptivePlanExec(union)).getMetricsList();

        assertThat(objects).extracting(ExecutePlanResponse.Metrics.MetricObject::getName)
            .containsExactly("Union", "Range", "Range");
        assertThat(objects.get(1).getParent()).isEqualTo(union.id());
        assertThat(objects.get(2).getParent()).isEqualTo(union.id());
    }

    @Test
    @DisplayName("Metrics reflect the plan chosen once adaptive execution has re-planned")
    void metricsFollowReplannedChild() {
        RangeExec nonEmpty = new RangeExec(0, 4, 1, 2);
        RangeExec empty = new RangeExec(0, 0, 1, 2);
        UnionExec union = new UnionExec(nonEmpty.schema(),
            List.of(new QueryStageExec(0, nonEmpty), new QueryStageExec(1, empty)));
        AdaptivePlanExec adaptive = new AdaptivePlanExec(union);

        adaptive.finalPlan();

        List<ExecutePlanResponse.Metrics.MetricObject> objects =
            MetricsSnapshotter.buildMetrics(adaptive).getMetricsList();
        assertThat(objects).extracting(ExecutePlanResponse.Metrics.MetricObject::getPlanId)
            .doesNotContain(empty.id())
            .contains(nonEmpty.id());
    }

    @Test
    @DisplayName("Metric values carry display name, value and type")
    void metricValuesAreCopied() {
        RangeExec range = new RangeExec(0, 3, 1, 1);
        try (RowIterator rows = range.execute(0)) {
            while (rows.hasNext()) {
                rows.next();
            }
        }

        ExecutePlanResponse.Metrics.MetricValue value = MetricsSnapshotter.buildMetrics(range)
            .getMetrics(0).getExecutionMetricsMap().get("numOutputRows");

        assertThat(value.getName()).isEqualTo("number of output rows");
        assertThat(value.getValue()).isEqualTo(3);
        assertThat(value.getMetricType()).isEqualTo("sum");
    }

    @Test
    @DisplayName("unwrap sees through nested wrappers")
    void unwrapNestedWrappers() {
        RangeExec leaf = new RangeExec(0, 1, 1, 1);
        PhysicalPlan wrapped = new AdaptivePlanExec(new QueryStageExec(0, leaf));

        assertThat(MetricsSnapshotter.unwrap(wrapped)).isSameAs(leaf);
    }
}
