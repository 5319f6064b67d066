package com.tributary.runtime;

/**
 * Batch sizing constants for Arrow result streaming.
 */
public final class StreamingConfig {

    private StreamingConfig() {} // Utility class

    /** Default maximum rows per Arrow batch. */
    public static final int DEFAULT_MAX_RECORDS_PER_BATCH = 10_000;

    /** Default maximum serialized size of one Arrow batch: 4 MiB. */
    public static final long DEFAULT_ARROW_MAX_BATCH_SIZE = 4L * 1024 * 1024;

    /**
     * Share of the configured batch size handed to the encoder as its byte
     * budget. The encoder only estimates row sizes.
     */
    public static final double BATCH_SIZE_SAFETY_FACTOR = 0.7;

    /**
     * Normalizes a max-records-per-batch setting. Zero or negative means no
     * row limit, represented as {@link Integer#MAX_VALUE}.
     *
     * @param requested the configured value
     * @return a positive row limit
     */
    public static int normalizeMaxRecordsPerBatch(int requested) {
        return requested <= 0 ? Integer.MAX_VALUE : requested;
    }

    /**
     * Computes the encoder's estimated-bytes budget from the configured
     * maximum batch size.
     *
     * @param configuredMaxBatchSize configured maximum size in bytes
     * @return the byte budget, at least 1
     * @throws IllegalArgumentException if the configured size is not positive
     */
    public static long maxEstimatedBatchBytes(long configuredMaxBatchSize) {
        if (configuredMaxBatchSize <= 0) {
            throw new IllegalArgumentException(
                "Arrow max batch size must be positive, got: " + configuredMaxBatchSize);
        }
        return Math.max(1L, (long) (configuredMaxBatchSize * BATCH_SIZE_SAFETY_FACTOR));
    }
}
