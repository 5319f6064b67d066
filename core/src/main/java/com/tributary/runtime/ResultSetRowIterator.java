package com.tributary.runtime;

import com.tributary.exception.EmbeddedRuntimeException;
import com.tributary.types.AtomicType;
import com.tributary.types.DataType;
import com.tributary.types.DecimalType;
import com.tributary.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.NoSuchElementException;

/**
 * Streams the rows of a DuckDB query, converting each column to the internal
 * value representation of its {@link DataType}.
 *
 * <p>The iterator owns its connection, statement and result set and closes
 * them when exhausted or closed. Failures while reading are rethrown as
 * {@link EmbeddedRuntimeException}.
 */
public final class ResultSetRowIterator implements RowIterator {

    private static final Logger logger = LoggerFactory.getLogger(ResultSetRowIterator.class);

    private final Connection connection;
    private final Statement statement;
    private final ResultSet resultSet;
    private final StructType schema;
    private final ZoneId zone;
    private final String sql;

    private boolean advanced = false;
    private boolean hasRow = false;
    private boolean closed = false;

    private ResultSetRowIterator(Connection connection, Statement statement, ResultSet resultSet,
                                 StructType schema, ZoneId zone, String sql) {
        this.connection = connection;
        this.statement = statement;
        this.resultSet = resultSet;
        this.schema = schema;
        this.zone = zone;
        this.sql = sql;
    }

    /**
     * Runs a query on a fresh connection of the runtime.
     *
     * @param runtime the runtime to query
     * @param sql the query
     * @param schema the expected output schema; column i of the query maps to field i
     * @param zone zone used to interpret timestamps without a time zone
     * @return the open iterator
     * @throws EmbeddedRuntimeException if DuckDB rejects the query
     */
    public static ResultSetRowIterator open(DuckDBRuntime runtime, String sql, StructType schema, ZoneId zone) {
        Connection conn = runtime.openConnection();
        Statement stmt = null;
        try {
            stmt = conn.createStatement();
            ResultSet rs = stmt.executeQuery(sql);
            return new ResultSetRowIterator(conn, stmt, rs, schema, zone, sql);
        } catch (SQLException e) {
            closeQuietly(stmt);
            closeQuietly(conn);
            throw EmbeddedRuntimeException.fromSql(e, sql);
        }
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        if (!advanced) {
            try {
                hasRow = resultSet.next();
            } catch (SQLException e) {
                close();
                throw EmbeddedRuntimeException.fromSql(e, sql);
            }
            advanced = true;
            if (!hasRow) {
                close();
            }
        }
        return hasRow;
    }

    @Override
    public Object[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        advanced = false;
        Object[] row = new Object[schema.size()];
        try {
            for (int i = 0; i < row.length; i++) {
                row[i] = readValue(resultSet, i + 1, schema.fieldAt(i).dataType(), zone);
            }
        } catch (SQLException e) {
            close();
            throw EmbeddedRuntimeException.fromSql(e, sql);
        }
        return row;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeQuietly(resultSet);
        closeQuietly(statement);
        closeQuietly(connection);
    }

    /**
     * Reads one column value in the internal representation of {@code type}.
     *
     * @param rs the positioned result set
     * @param column 1-based column index
     * @param type the column type
     * @param zone zone for timestamps without a time zone
     * @return the value, or null
     * @throws SQLException if DuckDB cannot produce the value
     */
    static Object readValue(ResultSet rs, int column, DataType type, ZoneId zone) throws SQLException {
        if (type instanceof DecimalType decimal) {
            Object value = rs.getObject(column);
            return value == null ? null : toBigDecimal(value).setScale(decimal.scale(), RoundingMode.HALF_UP);
        }
        AtomicType atomic = (AtomicType) type;
        if (atomic == AtomicType.STRING) {
            return rs.getString(column);
        }
        Object value = rs.getObject(column);
        if (value == null) {
            return null;
        }
        switch (atomic) {
            case BOOLEAN:
                return value instanceof Boolean b ? b : Boolean.valueOf(value.toString());
            case BYTE:
                return ((Number) value).byteValue();
            case SHORT:
                return ((Number) value).shortValue();
            case INTEGER:
                return ((Number) value).intValue();
            case LONG:
                return ((Number) value).longValue();
            case FLOAT:
                return ((Number) value).floatValue();
            case DOUBLE:
                return ((Number) value).doubleValue();
            case BINARY:
                return toBytes(value);
            case DATE:
                return (int) toLocalDate(value).toEpochDay();
            case TIMESTAMP:
                return toEpochMicros(toInstant(value, zone));
            default:
                return value.toString();
        }
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal bd) {
            return bd;
        }
        if (value instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        if (value instanceof Number n) {
            return BigDecimal.valueOf(n.longValue());
        }
        return new BigDecimal(value.toString());
    }

    private static byte[] toBytes(Object value) throws SQLException {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof Blob blob) {
            return blob.getBytes(1, (int) blob.length());
        }
        return value.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        return LocalDate.parse(value.toString());
    }

    private static Instant toInstant(Object value, ZoneId zone) {
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.atZone(zone).toInstant();
        }
        if (value instanceof Timestamp ts) {
            return ts.toLocalDateTime().atZone(zone).toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return LocalDateTime.parse(value.toString().replace(' ', 'T')).atZone(zone).toInstant();
    }

    /**
     * Converts an instant to microseconds since the epoch.
     *
     * @param instant the instant
     * @return microseconds since 1970-01-01T00:00:00Z
     */
    public static long toEpochMicros(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000L);
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            logger.warn("Error closing DuckDB resource", e);
        }
    }
}
