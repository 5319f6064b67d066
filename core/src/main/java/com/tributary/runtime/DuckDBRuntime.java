package com.tributary.runtime;

import com.tributary.exception.EmbeddedRuntimeException;
import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * DuckDB runtime - owns one private in-memory DuckDB database.
 *
 * <p>Each execution context gets its own runtime, so tables created by one
 * session are invisible to every other session. The runtime keeps one
 * primary connection open for the lifetime of the database; work is done on
 * duplicates of it, one per task, which DuckDB allows to run concurrently.
 *
 * <p>Typical usage:
 * <pre>{@code
 * DuckDBRuntime runtime = DuckDBRuntime.create("alice/session-1");
 * try (Connection conn = runtime.openConnection();
 *      Statement stmt = conn.createStatement()) {
 *     // ... run queries ...
 * }
 * runtime.close();
 * }</pre>
 *
 * <p>Every {@link SQLException} raised here is rethrown as an
 * {@link EmbeddedRuntimeException}.
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    /** Unnamed in-memory database: private to the connection that opens it and its duplicates. */
    static final String PRIVATE_MEMORY_URL = "jdbc:duckdb:";

    private final String name;
    private final DuckDBConnection connection;
    private volatile boolean closed = false;

    private DuckDBRuntime(String name) throws SQLException {
        this.name = name;

        // Streaming results avoid materializing a partition before the first row is read
        Properties props = new Properties();
        props.setProperty(DuckDBDriver.JDBC_STREAM_RESULTS, "true");

        Connection rawConn = DriverManager.getConnection(PRIVATE_MEMORY_URL, props);
        this.connection = rawConn.unwrap(DuckDBConnection.class);
        configureConnection();

        logger.info("DuckDB runtime '{}' initialized", name);
    }

    private void configureConnection() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("SET enable_progress_bar=false");
            stmt.execute("SET preserve_insertion_order=true");
            stmt.execute("SET default_null_order='NULLS FIRST'");
        }
    }

    /**
     * Creates a runtime backed by a fresh private in-memory database.
     *
     * @param name label used in log output
     * @return the new runtime
     * @throws EmbeddedRuntimeException if DuckDB cannot be started
     */
    public static DuckDBRuntime create(String name) {
        try {
            return new DuckDBRuntime(name);
        } catch (SQLException e) {
            throw EmbeddedRuntimeException.fromSql(e, null);
        }
    }

    /**
     * Opens a new connection to this runtime's database. The caller owns and
     * must close it.
     *
     * @return a duplicate of the primary connection
     * @throws IllegalStateException if the runtime is closed
     * @throws EmbeddedRuntimeException if DuckDB refuses the connection
     */
    public Connection openConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime '" + name + "' is closed");
        }
        try {
            return connection.duplicate();
        } catch (SQLException e) {
            throw EmbeddedRuntimeException.fromSql(e, null);
        }
    }

    /**
     * Executes a statement that returns no rows the caller cares about.
     *
     * @param sql the statement
     * @throws EmbeddedRuntimeException if DuckDB rejects the statement
     */
    public void execute(String sql) {
        try (Connection conn = openConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw EmbeddedRuntimeException.fromSql(e, sql);
        }
    }

    /**
     * Returns whether a table or view with the given name exists in the database.
     *
     * @param tableName unquoted table name
     * @return true if found
     */
    public boolean tableExists(String tableName) {
        String sql = "SELECT count(*) FROM information_schema.tables WHERE table_name = ?";
        try (Connection conn = openConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, tableName);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            throw EmbeddedRuntimeException.fromSql(e, sql);
        }
    }

    public String name() {
        return name;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the primary connection. Connections already handed out keep
     * working until their owners close them.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        logger.info("Closing DuckDB runtime '{}'", name);
        try {
            connection.close();
        } catch (SQLException e) {
            logger.error("Error closing DuckDB connection for runtime '{}'", name, e);
        }
    }
}
