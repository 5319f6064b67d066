package com.tributary.arrow;

import java.util.Objects;

/**
 * One serialized Arrow batch: a complete IPC stream (schema message followed
 * by a single record batch) and the number of rows it holds.
 *
 * <p>The payload array is not copied; callers must not modify it.
 */
public record EncodedBatch(byte[] data, long rowCount) {

    public EncodedBatch {
        Objects.requireNonNull(data, "data must not be null");
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must not be negative: " + rowCount);
        }
    }

    public int sizeInBytes() {
        return data.length;
    }

    @Override
    public String toString() {
        return String.format("EncodedBatch(rows=%d, bytes=%d)", rowCount, data.length);
    }
}
