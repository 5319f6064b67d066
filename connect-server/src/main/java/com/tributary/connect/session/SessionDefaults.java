package com.tributary.connect.session;

import com.tributary.runtime.StreamingConfig;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;

/**
 * Default session configuration and validation of the keys the server
 * interprets. Other keys are stored as given.
 */
public final class SessionDefaults {

    public static final String TIME_ZONE = "tributary.sql.session.timeZone";
    public static final String MAX_RECORDS_PER_BATCH = "tributary.sql.execution.arrow.maxRecordsPerBatch";
    public static final String ADAPTIVE_ENABLED = "tributary.sql.adaptive.enabled";
    public static final String DEFAULT_PARALLELISM = "tributary.sql.leafNodeDefaultParallelism";

    private SessionDefaults() {}

    public static Map<String, String> getDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put(TIME_ZONE, TimeZone.getDefault().getID());
        defaults.put(MAX_RECORDS_PER_BATCH, String.valueOf(StreamingConfig.DEFAULT_MAX_RECORDS_PER_BATCH));
        defaults.put(ADAPTIVE_ENABLED, "true");
        defaults.put(DEFAULT_PARALLELISM, String.valueOf(Runtime.getRuntime().availableProcessors()));

        return defaults;
    }

    /**
     * Checks a value for one of the interpreted keys and returns it in
     * canonical form.
     *
     * @param key the configuration key
     * @param value the proposed value
     * @return the value to store
     * @throws IllegalArgumentException if the value is invalid for the key
     */
    public static String validate(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value for '" + key + "' must not be null");
        }
        switch (key) {
            case TIME_ZONE:
                try {
                    return ZoneId.of(value.trim()).getId();
                } catch (DateTimeException e) {
                    throw new IllegalArgumentException("Invalid time zone for '" + key + "': " + value, e);
                }
            case MAX_RECORDS_PER_BATCH:
                parseInt(key, value, Integer.MIN_VALUE);
                return value.trim();
            case DEFAULT_PARALLELISM:
                parseInt(key, value, 1);
                return value.trim();
            case ADAPTIVE_ENABLED: {
                String normalized = value.trim().toLowerCase(Locale.ROOT);
                if (!normalized.equals("true") && !normalized.equals("false")) {
                    throw new IllegalArgumentException("'" + key + "' must be true or false, got: " + value);
                }
                return normalized;
            }
            default:
                return value;
        }
    }

    static int parseInt(String key, String value, int min) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < min) {
                throw new IllegalArgumentException("'" + key + "' must be at least " + min + ", got: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + value, e);
        }
    }
}
