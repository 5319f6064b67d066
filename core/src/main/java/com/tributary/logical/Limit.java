package com.tributary.logical;

import com.tributary.types.StructType;

import java.util.OptionalLong;

/**
 * Logical plan node keeping the first {@code limit} rows of its child.
 */
public final class Limit extends LogicalPlan {

    private final long limit;

    public Limit(LogicalPlan child, long limit) {
        super(child);
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got: " + limit);
        }
        this.limit = limit;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public long limit() {
        return limit;
    }

    @Override
    public StructType inferSchema() {
        return child().schema();
    }

    @Override
    public OptionalLong estimatedRowCount() {
        OptionalLong childRows = child().estimatedRowCount();
        return OptionalLong.of(childRows.isPresent() ? Math.min(limit, childRows.getAsLong()) : limit);
    }

    @Override
    public String simpleString() {
        return "Limit " + limit;
    }
}
