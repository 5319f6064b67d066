package com.tributary.connect.session;

import com.tributary.exception.AnalysisException;
import com.tributary.execution.PlannerOptions;
import com.tributary.logical.LogicalPlan;
import com.tributary.runtime.DuckDBRuntime;
import com.tributary.runtime.StreamingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Execution context of one (user, session) pair: a private DuckDB database,
 * session configuration and temporary views.
 *
 * <p>Requests hold a session between {@link #tryAcquire()} and
 * {@link #release()}. When the registry evicts a session it is
 * {@link #retire() retired}: it can no longer be acquired, and its database
 * is closed as soon as the last request holding it releases it.
 */
public class Session {

    private static final Logger logger = LoggerFactory.getLogger(Session.class);

    private final SessionKey key;
    private final long createdAt;
    private final Map<String, String> config;
    private final Map<String, LogicalPlan> tempViews;
    private final DuckDBRuntime runtime;

    private int inFlight = 0;
    private boolean retired = false;
    private boolean closed = false;

    public Session(SessionKey key, DuckDBRuntime runtime) {
        this.key = key;
        this.createdAt = System.currentTimeMillis();
        this.config = new ConcurrentHashMap<>(SessionDefaults.getDefaults());
        this.tempViews = new ConcurrentHashMap<>();
        this.runtime = runtime;
    }

    /**
     * Creates a session with a fresh DuckDB database.
     *
     * @param key the session key
     * @return the new session
     */
    public static Session create(SessionKey key) {
        return new Session(key, DuckDBRuntime.create(key.toString()));
    }

    public SessionKey key() {
        return key;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public DuckDBRuntime runtime() {
        return runtime;
    }

    // ========== Lifecycle ==========

    /**
     * Marks the session as in use by one more request.
     *
     * @return false if the session was retired and must not be used
     */
    public synchronized boolean tryAcquire() {
        if (retired) {
            return false;
        }
        inFlight++;
        return true;
    }

    /**
     * Ends one request's use of the session.
     */
    public synchronized void release() {
        if (inFlight == 0) {
            throw new IllegalStateException("Session " + key + " released more often than acquired");
        }
        inFlight--;
        if (retired && inFlight == 0) {
            closeRuntime();
        }
    }

    /**
     * Stops handing out the session and closes its database once idle.
     */
    public synchronized void retire() {
        if (retired) {
            return;
        }
        retired = true;
        if (inFlight == 0) {
            closeRuntime();
        } else {
            logger.info("Session {} retired with {} requests in flight; closing when they finish", key, inFlight);
        }
    }

    public synchronized boolean isRetired() {
        return retired;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int inFlightRequests() {
        return inFlight;
    }

    private void closeRuntime() {
        if (!closed) {
            closed = true;
            runtime.close();
            tempViews.clear();
        }
    }

    // ========== Configuration ==========

    public String getConfig(String key) {
        return config.get(key);
    }

    /**
     * Sets a configuration value, validating the keys the server interprets.
     *
     * @param key the key
     * @param value the value
     * @throws IllegalArgumentException if the value is invalid for the key
     */
    public void setConfig(String key, String value) {
        config.put(key, SessionDefaults.validate(key, value));
    }

    public Map<String, String> getAllConfig() {
        return new HashMap<>(config);
    }

    public ZoneId timeZone() {
        return ZoneId.of(config.get(SessionDefaults.TIME_ZONE));
    }

    /**
     * @return the row limit per Arrow batch; {@link Integer#MAX_VALUE} when unlimited
     */
    public int maxRecordsPerBatch() {
        return StreamingConfig.normalizeMaxRecordsPerBatch(
            Integer.parseInt(config.get(SessionDefaults.MAX_RECORDS_PER_BATCH)));
    }

    public PlannerOptions plannerOptions() {
        return new PlannerOptions(
            Integer.parseInt(config.get(SessionDefaults.DEFAULT_PARALLELISM)),
            Boolean.parseBoolean(config.get(SessionDefaults.ADAPTIVE_ENABLED)),
            timeZone());
    }

    // ========== Temporary Views ==========

    /**
     * Registers a temporary view.
     *
     * @param name the view name
     * @param plan the view's plan
     * @param replace whether an existing view of that name may be replaced
     * @throws AnalysisException if the view exists and replace is false
     */
    public void registerTempView(String name, LogicalPlan plan, boolean replace) {
        if (replace) {
            tempViews.put(name, plan);
            return;
        }
        if (tempViews.putIfAbsent(name, plan) != null) {
            throw new AnalysisException("Temporary view '" + name + "' already exists");
        }
    }

    public Optional<LogicalPlan> getTempView(String name) {
        return Optional.ofNullable(tempViews.get(name));
    }

    @Override
    public String toString() {
        return String.format("Session[key=%s, created=%d, views=%d]", key, createdAt, tempViews.size());
    }
}
