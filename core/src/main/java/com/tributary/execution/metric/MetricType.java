package com.tributary.execution.metric;

/**
 * How a metric value should be rendered by clients.
 */
public enum MetricType {
    /** Plain count. */
    SUM("sum"),
    /** Bytes. */
    SIZE("size"),
    /** Milliseconds. */
    TIMING("timing"),
    /** Nanoseconds. */
    NS_TIMING("nsTiming"),
    AVERAGE("average");

    private final String wireName;

    MetricType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the name sent to clients, e.g. {@code nsTiming}
     */
    public String wireName() {
        return wireName;
    }
}
