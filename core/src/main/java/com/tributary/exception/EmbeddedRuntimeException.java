package com.tributary.exception;

import java.sql.SQLException;

/**
 * Failure raised by the embedded DuckDB runtime.
 *
 * <p>The message is the runtime's own message, unchanged, so that clients see
 * the original error text. The SQL that was running is kept for logging.
 *
 * <p>Example usage:
 * <pre>
 *   try (Statement stmt = connection.createStatement()) {
 *       stmt.execute(sql);
 *   } catch (SQLException e) {
 *       throw EmbeddedRuntimeException.fromSql(e, sql);
 *   }
 * </pre>
 */
public class EmbeddedRuntimeException extends TributaryException {

    private final String failedSQL;

    public EmbeddedRuntimeException(String message, Throwable cause, String failedSQL) {
        super(message, cause, ErrorOrigin.EMBEDDED_RUNTIME);
        this.failedSQL = failedSQL;
    }

    /**
     * Wraps a DuckDB {@link SQLException}, keeping its message.
     *
     * @param e the runtime failure
     * @param sql the SQL that failed, may be null
     * @return the tagged exception
     */
    public static EmbeddedRuntimeException fromSql(SQLException e, String sql) {
        return new EmbeddedRuntimeException(e.getMessage(), e, sql);
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }
}
