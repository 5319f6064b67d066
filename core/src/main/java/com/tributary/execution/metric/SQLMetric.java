package com.tributary.execution.metric;

import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * A named accumulator attached to a physical operator.
 *
 * <p>Tasks of the same operator run on different worker threads and add to
 * the same metric concurrently.
 */
public final class SQLMetric {

    private final MetricType metricType;
    private final String displayName;
    private final LongAdder value = new LongAdder();

    public SQLMetric(MetricType metricType, String displayName) {
        this.metricType = Objects.requireNonNull(metricType, "metricType must not be null");
        this.displayName = Objects.requireNonNull(displayName, "displayName must not be null");
    }

    public static SQLMetric count(String displayName) {
        return new SQLMetric(MetricType.SUM, displayName);
    }

    public static SQLMetric size(String displayName) {
        return new SQLMetric(MetricType.SIZE, displayName);
    }

    public static SQLMetric nanoTiming(String displayName) {
        return new SQLMetric(MetricType.NS_TIMING, displayName);
    }

    public void add(long delta) {
        value.add(delta);
    }

    public long value() {
        return value.sum();
    }

    public MetricType metricType() {
        return metricType;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return String.format("SQLMetric(%s, %s=%d)", metricType.wireName(), displayName, value());
    }
}
