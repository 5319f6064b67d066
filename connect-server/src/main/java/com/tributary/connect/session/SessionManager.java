package com.tributary.connect.session;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.tributary.connect.config.ConnectConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Registry of execution contexts keyed by (user, session).
 *
 * <p>Backed by a Guava cache bounded by {@code sessionCacheSize} (least
 * recently used entries go first) with an independent idle timeout. Creation
 * is exactly-once per key: concurrent first requests for the same key wait
 * for the single load and all receive the same session.
 *
 * <p>Eviction retires the session instead of closing it outright, so a
 * request that is still running keeps a working database. A janitor thread
 * runs cache maintenance periodically, so idle sessions are released even
 * when no new requests arrive.
 */
public class SessionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    /** Interval between cache maintenance runs. */
    private static final long CLEANUP_INTERVAL_SECONDS = 60;

    private final Cache<SessionKey, Session> sessions;
    private final Function<SessionKey, Session> sessionFactory;
    private final ScheduledExecutorService janitor;

    /**
     * Creates a registry that builds sessions with their own DuckDB database.
     *
     * @param config server configuration
     */
    public SessionManager(ConnectConfig config) {
        this(config.sessionCacheSize(), config.sessionIdleTimeoutSeconds(), Ticker.systemTicker(), Session::create);
    }

    /**
     * Create SessionManager with custom configuration.
     *
     * @param maximumSize most sessions kept at once
     * @param idleTimeoutSeconds seconds without access before a session is evicted
     * @param ticker time source for idle tracking
     * @param sessionFactory builds the session for a new key
     */
    public SessionManager(int maximumSize,
                          long idleTimeoutSeconds,
                          Ticker ticker,
                          Function<SessionKey, Session> sessionFactory) {
        this.sessionFactory = sessionFactory;
        RemovalListener<SessionKey, Session> onRemoval = notification -> {
            Session session = notification.getValue();
            if (session == null) {
                return;
            }
            logger.info("Session {} removed ({}), age {} ms",
                notification.getKey(), notification.getCause(),
                System.currentTimeMillis() - session.getCreatedAt());
            session.retire();
        };
        this.sessions = CacheBuilder.newBuilder()
            // One segment keeps capacity and LRU order exact
            .concurrencyLevel(1)
            .maximumSize(maximumSize)
            .expireAfterAccess(idleTimeoutSeconds, TimeUnit.SECONDS)
            .ticker(ticker)
            .removalListener(onRemoval)
            .build();

        this.janitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-janitor");
            t.setDaemon(true);
            return t;
        });
        janitor.scheduleAtFixedRate(sessions::cleanUp,
            CLEANUP_INTERVAL_SECONDS, CLEANUP_INTERVAL_SECONDS, TimeUnit.SECONDS);

        logger.info("SessionManager initialized: maximumSize={}, idleTimeoutSeconds={}",
            maximumSize, idleTimeoutSeconds);
    }

    /**
     * Returns the session for a key, creating it on first use.
     *
     * @param userId the principal
     * @param sessionId the client's session id
     * @return the session; the same instance for every caller until it is evicted
     */
    public Session getOrCreate(String userId, String sessionId) {
        SessionKey key = new SessionKey(userId, sessionId);
        try {
            return sessions.get(key, () -> {
                logger.info("Creating session {}", key);
                return sessionFactory.apply(key);
            });
        } catch (ExecutionException | UncheckedExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Failed to create session " + key, cause);
        }
    }

    /**
     * Returns the session for a key, marked as in use. The caller must call
     * {@link Session#release()} when done.
     *
     * <p>If the cached session was retired between lookup and acquisition,
     * its entry is dropped and a fresh session is created.
     *
     * @param userId the principal
     * @param sessionId the client's session id
     * @return the acquired session
     */
    public Session acquire(String userId, String sessionId) {
        while (true) {
            Session session = getOrCreate(userId, sessionId);
            if (session.tryAcquire()) {
                return session;
            }
            sessions.asMap().remove(session.key(), session);
        }
    }

    /**
     * Returns the number of cached sessions.
     *
     * @return the cache size
     */
    public long size() {
        return sessions.size();
    }

    /**
     * Runs pending evictions now.
     */
    public void cleanUp() {
        sessions.cleanUp();
    }

    /**
     * Evicts all sessions and stops the janitor.
     */
    @Override
    public void close() {
        logger.info("Shutting down SessionManager");
        janitor.shutdownNow();
        sessions.invalidateAll();
        sessions.cleanUp();
        logger.info("SessionManager shutdown complete");
    }
}
