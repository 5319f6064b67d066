package com.tributary.connect.config;

import com.tributary.runtime.StreamingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Properties;

/**
 * Server options, read once at start-up from JVM system properties.
 *
 * <p>Recognized properties:
 * <ul>
 *   <li>{@value #PROP_PORT} - gRPC binding port (default 15002)</li>
 *   <li>{@value #PROP_MAX_INBOUND_MESSAGE_SIZE} - largest accepted request, in bytes (default 128m)</li>
 *   <li>{@value #PROP_ARROW_MAX_BATCH_SIZE} - largest Arrow batch sent, in MiB unless suffixed (default 4m)</li>
 *   <li>{@value #PROP_SESSION_CACHE_SIZE} - most sessions kept at once (default 100)</li>
 *   <li>{@value #PROP_SESSION_IDLE_TIMEOUT_SECONDS} - idle time before a session is evicted (default 3600)</li>
 *   <li>{@value #PROP_MAX_ERROR_MESSAGE_SIZE} - longest error message sent to clients (default 2048)</li>
 *   <li>{@value #PROP_SCHEDULER_PARALLELISM} - task worker threads (default: available processors)</li>
 * </ul>
 *
 * <p>Unparsable or out-of-range values are logged and replaced by the default.
 */
public final class ConnectConfig {

    private static final Logger logger = LoggerFactory.getLogger(ConnectConfig.class);

    public static final String PROP_PORT = "tributary.connect.grpc.binding.port";
    public static final String PROP_MAX_INBOUND_MESSAGE_SIZE = "tributary.connect.grpc.maxInboundMessageSize";
    public static final String PROP_ARROW_MAX_BATCH_SIZE = "tributary.connect.grpc.arrow.maxBatchSize";
    public static final String PROP_SESSION_CACHE_SIZE = "tributary.connect.session.cacheSize";
    public static final String PROP_SESSION_IDLE_TIMEOUT_SECONDS = "tributary.connect.session.idleTimeoutSeconds";
    public static final String PROP_MAX_ERROR_MESSAGE_SIZE = "tributary.connect.jvmStacktrace.maxSize";
    public static final String PROP_SCHEDULER_PARALLELISM = "tributary.connect.scheduler.parallelism";

    public static final int DEFAULT_PORT = 15002;
    public static final long DEFAULT_MAX_INBOUND_MESSAGE_SIZE = 128L * 1024 * 1024;
    public static final long DEFAULT_ARROW_MAX_BATCH_SIZE = StreamingConfig.DEFAULT_ARROW_MAX_BATCH_SIZE;
    public static final int DEFAULT_SESSION_CACHE_SIZE = 100;
    public static final long DEFAULT_SESSION_IDLE_TIMEOUT_SECONDS = 3600;
    public static final int DEFAULT_MAX_ERROR_MESSAGE_SIZE = 2048;

    /** Smallest message size that can still hold an abbreviation marker. */
    static final int MIN_ERROR_MESSAGE_SIZE = 4;

    private static final long KIB = 1024L;
    private static final long MIB = 1024L * KIB;
    private static final long GIB = 1024L * MIB;

    private final int port;
    private final long maxInboundMessageSize;
    private final long arrowMaxBatchSize;
    private final int sessionCacheSize;
    private final long sessionIdleTimeoutSeconds;
    private final int maxErrorMessageSize;
    private final int schedulerParallelism;

    private ConnectConfig(Builder builder) {
        this.port = builder.port;
        this.maxInboundMessageSize = builder.maxInboundMessageSize;
        this.arrowMaxBatchSize = builder.arrowMaxBatchSize;
        this.sessionCacheSize = builder.sessionCacheSize;
        this.sessionIdleTimeoutSeconds = builder.sessionIdleTimeoutSeconds;
        this.maxErrorMessageSize = builder.maxErrorMessageSize;
        this.schedulerParallelism = builder.schedulerParallelism;
    }

    /**
     * Reads the configuration from JVM system properties.
     *
     * @return the configuration
     */
    public static ConnectConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from a property set.
     *
     * @param props the properties
     * @return the configuration
     */
    public static ConnectConfig fromProperties(Properties props) {
        Builder builder = builder();
        builder.port = getInt(props, PROP_PORT, DEFAULT_PORT, 0, 65535);
        builder.maxInboundMessageSize = getBytes(props, PROP_MAX_INBOUND_MESSAGE_SIZE,
            DEFAULT_MAX_INBOUND_MESSAGE_SIZE, 1, Integer.MAX_VALUE);
        builder.arrowMaxBatchSize = getBytes(props, PROP_ARROW_MAX_BATCH_SIZE,
            DEFAULT_ARROW_MAX_BATCH_SIZE, MIB, Long.MAX_VALUE);
        builder.sessionCacheSize = getInt(props, PROP_SESSION_CACHE_SIZE,
            DEFAULT_SESSION_CACHE_SIZE, 1, Integer.MAX_VALUE);
        builder.sessionIdleTimeoutSeconds = getInt(props, PROP_SESSION_IDLE_TIMEOUT_SECONDS,
            (int) DEFAULT_SESSION_IDLE_TIMEOUT_SECONDS, 1, Integer.MAX_VALUE);
        builder.maxErrorMessageSize = getInt(props, PROP_MAX_ERROR_MESSAGE_SIZE,
            DEFAULT_MAX_ERROR_MESSAGE_SIZE, MIN_ERROR_MESSAGE_SIZE, Integer.MAX_VALUE);
        builder.schedulerParallelism = getInt(props, PROP_SCHEDULER_PARALLELISM,
            Runtime.getRuntime().availableProcessors(), 1, Integer.MAX_VALUE);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int port() {
        return port;
    }

    public long maxInboundMessageSize() {
        return maxInboundMessageSize;
    }

    public long arrowMaxBatchSize() {
        return arrowMaxBatchSize;
    }

    /**
     * Returns the encoder's byte budget per batch: the configured Arrow
     * batch size scaled by {@link StreamingConfig#BATCH_SIZE_SAFETY_FACTOR}.
     *
     * @return the estimated-bytes limit
     */
    public long maxEstimatedBatchBytes() {
        return StreamingConfig.maxEstimatedBatchBytes(arrowMaxBatchSize);
    }

    public int sessionCacheSize() {
        return sessionCacheSize;
    }

    public long sessionIdleTimeoutSeconds() {
        return sessionIdleTimeoutSeconds;
    }

    public int maxErrorMessageSize() {
        return maxErrorMessageSize;
    }

    public int schedulerParallelism() {
        return schedulerParallelism;
    }

    /**
     * Returns a copy of this configuration bound to another port.
     *
     * @param newPort the port, 0 for any free port
     * @return the new configuration
     */
    public ConnectConfig withPort(int newPort) {
        return toBuilder().port(newPort).build();
    }

    public Builder toBuilder() {
        return builder()
            .port(port)
            .maxInboundMessageSize(maxInboundMessageSize)
            .arrowMaxBatchSize(arrowMaxBatchSize)
            .sessionCacheSize(sessionCacheSize)
            .sessionIdleTimeoutSeconds(sessionIdleTimeoutSeconds)
            .maxErrorMessageSize(maxErrorMessageSize)
            .schedulerParallelism(schedulerParallelism);
    }

    @Override
    public String toString() {
        return String.format(
            "ConnectConfig(port=%d, maxInboundMessageSize=%d, arrowMaxBatchSize=%d, sessionCacheSize=%d, "
                + "sessionIdleTimeoutSeconds=%d, maxErrorMessageSize=%d, schedulerParallelism=%d)",
            port, maxInboundMessageSize, arrowMaxBatchSize, sessionCacheSize,
            sessionIdleTimeoutSeconds, maxErrorMessageSize, schedulerParallelism);
    }

    // ========== Configuration Helpers ==========

    private static int getInt(Properties props, String key, int defaultValue, int min, int max) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed >= min && parsed <= max) {
                return parsed;
            }
            logger.warn("Ignoring {}={}: must be between {} and {}; using {}", key, value, min, max, defaultValue);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not an integer; using {}", key, value, defaultValue);
        }
        return defaultValue;
    }

    private static long getBytes(Properties props, String key, long defaultValue, long defaultUnit, long max) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            long parsed = parseByteSize(value, defaultUnit);
            if (parsed > 0 && parsed <= max) {
                return parsed;
            }
            logger.warn("Ignoring {}={}: must be between 1 and {} bytes; using {}", key, value, max, defaultValue);
        } catch (NumberFormatException | ArithmeticException e) {
            logger.warn("Ignoring {}={}: not a byte size; using {}", key, value, defaultValue);
        }
        return defaultValue;
    }

    /**
     * Parses sizes such as {@code 4m}, {@code 128MiB}, {@code 512k} or {@code 1048576}.
     *
     * @param value the size text
     * @param defaultUnit multiplier applied when the value has no unit suffix
     * @return the size in bytes
     * @throws NumberFormatException if the text is not a size
     */
    static long parseByteSize(String value, long defaultUnit) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        int split = 0;
        while (split < normalized.length() && Character.isDigit(normalized.charAt(split))) {
            split++;
        }
        if (split == 0) {
            throw new NumberFormatException("No digits in byte size: " + value);
        }
        long amount = Long.parseLong(normalized.substring(0, split));
        String unit = normalized.substring(split).trim();
        long multiplier;
        switch (unit) {
            case "":
                multiplier = defaultUnit;
                break;
            case "b":
                multiplier = 1;
                break;
            case "k":
            case "kb":
            case "kib":
                multiplier = KIB;
                break;
            case "m":
            case "mb":
            case "mib":
                multiplier = MIB;
                break;
            case "g":
            case "gb":
            case "gib":
                multiplier = GIB;
                break;
            default:
                throw new NumberFormatException("Unknown byte size unit in: " + value);
        }
        return Math.multiplyExact(amount, multiplier);
    }

    /**
     * Builder for programmatic configuration, starting from the defaults.
     */
    public static final class Builder {
        private int port = DEFAULT_PORT;
        private long maxInboundMessageSize = DEFAULT_MAX_INBOUND_MESSAGE_SIZE;
        private long arrowMaxBatchSize = DEFAULT_ARROW_MAX_BATCH_SIZE;
        private int sessionCacheSize = DEFAULT_SESSION_CACHE_SIZE;
        private long sessionIdleTimeoutSeconds = DEFAULT_SESSION_IDLE_TIMEOUT_SECONDS;
        private int maxErrorMessageSize = DEFAULT_MAX_ERROR_MESSAGE_SIZE;
        private int schedulerParallelism = Runtime.getRuntime().availableProcessors();

        private Builder() {}

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxInboundMessageSize(long bytes) {
            this.maxInboundMessageSize = bytes;
            return this;
        }

        public Builder arrowMaxBatchSize(long bytes) {
            this.arrowMaxBatchSize = bytes;
            return this;
        }

        public Builder sessionCacheSize(int size) {
            this.sessionCacheSize = size;
            return this;
        }

        public Builder sessionIdleTimeoutSeconds(long seconds) {
            this.sessionIdleTimeoutSeconds = seconds;
            return this;
        }

        public Builder maxErrorMessageSize(int size) {
            this.maxErrorMessageSize = size;
            return this;
        }

        public Builder schedulerParallelism(int threads) {
            this.schedulerParallelism = threads;
            return this;
        }

        /**
         * @return the configuration
         * @throws IllegalArgumentException if a value is out of range
         */
        public ConnectConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
            }
            if (maxInboundMessageSize <= 0 || maxInboundMessageSize > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(
                    "maxInboundMessageSize must be between 1 and " + Integer.MAX_VALUE + ", got: " + maxInboundMessageSize);
            }
            if (arrowMaxBatchSize <= 0) {
                throw new IllegalArgumentException("arrowMaxBatchSize must be positive, got: " + arrowMaxBatchSize);
            }
            if (sessionCacheSize <= 0) {
                throw new IllegalArgumentException("sessionCacheSize must be positive, got: " + sessionCacheSize);
            }
            if (sessionIdleTimeoutSeconds <= 0) {
                throw new IllegalArgumentException(
                    "sessionIdleTimeoutSeconds must be positive, got: " + sessionIdleTimeoutSeconds);
            }
            if (maxErrorMessageSize < MIN_ERROR_MESSAGE_SIZE) {
                throw new IllegalArgumentException(
                    "maxErrorMessageSize must be at least " + MIN_ERROR_MESSAGE_SIZE + ", got: " + maxErrorMessageSize);
            }
            if (schedulerParallelism <= 0) {
                throw new IllegalArgumentException(
                    "schedulerParallelism must be positive, got: " + schedulerParallelism);
            }
            return new ConnectConfig(this);
        }
    }
}
