package com.tributary.execution;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Session settings that shape physical planning.
 *
 * @param defaultParallelism number of slices for leaf operators that do not specify one
 * @param adaptiveEnabled whether to plan for adaptive execution
 * @param zone session time zone
 */
public record PlannerOptions(int defaultParallelism, boolean adaptiveEnabled, ZoneId zone) {

    public PlannerOptions {
        if (defaultParallelism <= 0) {
            throw new IllegalArgumentException("defaultParallelism must be positive, got: " + defaultParallelism);
        }
        Objects.requireNonNull(zone, "zone must not be null");
    }
}
