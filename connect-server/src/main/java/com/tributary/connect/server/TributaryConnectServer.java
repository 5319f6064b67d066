package com.tributary.connect.server;

import com.tributary.arrow.ArrowBatchDecoder;
import com.tributary.arrow.ArrowBatchEncoder;
import com.tributary.connect.config.ConnectConfig;
import com.tributary.connect.service.AnalyzePlanHandler;
import com.tributary.connect.service.ConnectServiceImpl;
import com.tributary.connect.service.ErrorTranslator;
import com.tributary.connect.service.ExecutePlanHandler;
import com.tributary.connect.session.SessionManager;
import com.tributary.scheduler.ParallelJobScheduler;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Tributary Connect server bootstrap.
 *
 * Responsibilities:
 * 1. Create the Arrow allocator, job scheduler and session registry
 * 2. Wire the gRPC service from them
 * 3. Start the gRPC server
 * 4. Handle graceful shutdown
 *
 * Usage:
 * <pre>
 * TributaryConnectServer server = new TributaryConnectServer(ConnectConfig.fromSystemProperties());
 * server.start();
 * server.blockUntilShutdown();
 * </pre>
 */
public class TributaryConnectServer {
    private static final Logger logger = LoggerFactory.getLogger(TributaryConnectServer.class);

    private final ConnectConfig config;

    private Server grpcServer;
    private BufferAllocator allocator;
    private ParallelJobScheduler scheduler;
    private SessionManager sessionManager;
    private Thread shutdownHook;

    /**
     * Create server with the given configuration.
     *
     * @param config server configuration; port 0 binds an ephemeral port
     */
    public TributaryConnectServer(ConnectConfig config) {
        this.config = config;
    }

    /**
     * Start the server.
     *
     * @throws IOException if server fails to bind
     */
    public synchronized void start() throws IOException {
        if (grpcServer != null) {
            throw new IllegalStateException("Server already started");
        }
        logger.info("Starting Tributary Connect Server...");
        logger.info("Configuration: {}", config);

        // 1. Shared engine resources
        allocator = new RootAllocator(Long.MAX_VALUE);
        scheduler = new ParallelJobScheduler(config.schedulerParallelism());
        sessionManager = new SessionManager(config);

        // 2. Service
        ConnectServiceImpl service = new ConnectServiceImpl(
            new ExecutePlanHandler(
                sessionManager,
                scheduler,
                new ArrowBatchEncoder(allocator),
                new ArrowBatchDecoder(allocator),
                config),
            new AnalyzePlanHandler(sessionManager, new ArrowBatchDecoder(allocator)),
            new ErrorTranslator(config.maxErrorMessageSize()));

        // 3. Build and start gRPC server
        try {
            grpcServer = ServerBuilder.forPort(config.port())
                .maxInboundMessageSize((int) config.maxInboundMessageSize())
                .addService(service)
                .build()
                .start();
        } catch (IOException e) {
            releaseResources();
            throw e;
        }

        logger.info("Tributary Connect Server started on port {}", grpcServer.getPort());

        shutdownHook = new Thread(() -> {
            logger.info("Shutdown hook triggered");
            TributaryConnectServer.this.stop();
        }, "tributary-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    /**
     * Stop the server gracefully. Safe to call more than once.
     */
    public synchronized void stop() {
        if (grpcServer == null) {
            return;
        }
        logger.info("Stopping Tributary Connect Server...");

        // 1. Stop accepting new connections
        try {
            grpcServer.shutdown();
            if (!grpcServer.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Server did not terminate gracefully, forcing shutdown");
                grpcServer.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted during server shutdown", e);
            grpcServer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        grpcServer = null;

        // 2. Sessions, scheduler, allocator
        releaseResources();

        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down, hook stays registered");
            }
        }
        shutdownHook = null;

        logger.info("Tributary Connect Server stopped");
    }

    private void releaseResources() {
        if (sessionManager != null) {
            sessionManager.close();
            sessionManager = null;
        }
        if (scheduler != null) {
            scheduler.close();
            scheduler = null;
        }
        if (allocator != null) {
            allocator.close();
            allocator = null;
        }
    }

    /**
     * Block until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        Server server;
        synchronized (this) {
            server = grpcServer;
        }
        if (server != null) {
            server.awaitTermination();
        }
    }

    /**
     * Get the bound port, or the configured port before start.
     *
     * @return Port number
     */
    public synchronized int getPort() {
        return grpcServer != null ? grpcServer.getPort() : config.port();
    }

    /**
     * Main entry point.
     *
     * Usage:
     * <pre>
     * java -Dtributary.connect.session.cacheSize=50 -jar connect-server.jar [port]
     * </pre>
     */
    public static void main(String[] args) {
        try {
            ConnectConfig config = ConnectConfig.fromSystemProperties();
            if (args.length > 0) {
                config = config.withPort(Integer.parseInt(args[0]));
            }

            TributaryConnectServer server = new TributaryConnectServer(config);
            server.start();

            logger.info("================================================");
            logger.info("Tributary Connect Server is running");
            logger.info("Port: {}", server.getPort());
            logger.info("Session cache: {} sessions, idle timeout {}s",
                config.sessionCacheSize(), config.sessionIdleTimeoutSeconds());
            logger.info("Scheduler parallelism: {}", config.schedulerParallelism());
            logger.info("================================================");

            server.blockUntilShutdown();

        } catch (Exception e) {
            logger.error("Server failed to start", e);
            System.exit(1);
        }
    }
}
