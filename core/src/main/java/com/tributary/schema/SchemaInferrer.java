package com.tributary.schema;

import com.tributary.exception.EmbeddedRuntimeException;
import com.tributary.runtime.DuckDBRuntime;
import com.tributary.types.AtomicType;
import com.tributary.types.DataType;
import com.tributary.types.DecimalType;
import com.tributary.types.StructField;
import com.tributary.types.StructType;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers schema from DuckDB by executing DESCRIBE queries.
 *
 * <p>Used when a relation is backed by SQL text (queries, file scans, tables)
 * and its columns are only known to DuckDB.
 */
public class SchemaInferrer {

    private static final Pattern DECIMAL_PATTERN =
        Pattern.compile("(?:DECIMAL|NUMERIC)\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)");

    private final DuckDBRuntime runtime;

    public SchemaInferrer(DuckDBRuntime runtime) {
        this.runtime = runtime;
    }

    /**
     * Infers the schema of a SQL query by executing DESCRIBE.
     *
     * @param sql the SQL query to analyze
     * @return the inferred schema
     * @throws EmbeddedRuntimeException if DuckDB cannot describe the query
     */
    public StructType inferSchema(String sql) {
        // DESCRIBE binds the query without running it
        String describeSql = "DESCRIBE (" + sql + ")";

        List<StructField> fields = new ArrayList<>();

        try (Connection conn = runtime.openConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(describeSql)) {

            while (rs.next()) {
                String columnName = rs.getString("column_name");
                String columnType = rs.getString("column_type");
                String nullableStr = rs.getString("null");

                boolean nullable = !"NO".equalsIgnoreCase(nullableStr);
                fields.add(new StructField(columnName, mapDuckDBType(columnType), nullable));
            }

        } catch (SQLException e) {
            throw EmbeddedRuntimeException.fromSql(e, sql);
        }

        return new StructType(fields);
    }

    /**
     * Maps a DuckDB type name to a column type.
     *
     * <p>Types without a direct counterpart (TIME, INTERVAL, UUID, nested
     * types) are carried as strings. Integers wider than a signed long become
     * decimals with scale 0.
     *
     * @param duckdbType the DuckDB type name (e.g., "INTEGER", "DECIMAL(10,2)")
     * @return the corresponding DataType
     */
    public static DataType mapDuckDBType(String duckdbType) {
        if (duckdbType == null) {
            return AtomicType.STRING;
        }

        String upper = duckdbType.toUpperCase(Locale.ROOT).trim();
        Matcher decimal = DECIMAL_PATTERN.matcher(upper);
        if (decimal.matches()) {
            return new DecimalType(Integer.parseInt(decimal.group(1)), Integer.parseInt(decimal.group(2)));
        }

        // Nested and parameterized types: STRUCT(...), MAP(...), INTEGER[], ENUM(...)
        if (upper.contains("[") || upper.contains("(")) {
            return AtomicType.STRING;
        }

        switch (upper) {
            case "TINYINT":
            case "INT1":
                return AtomicType.BYTE;
            case "SMALLINT":
            case "INT2":
            case "SHORT":
            case "UTINYINT":
                return AtomicType.SHORT;
            case "INTEGER":
            case "INT":
            case "INT4":
            case "SIGNED":
            case "USMALLINT":
                return AtomicType.INTEGER;
            case "BIGINT":
            case "INT8":
            case "LONG":
            case "UINTEGER":
                return AtomicType.LONG;
            case "UBIGINT":
                return new DecimalType(20, 0);
            case "HUGEINT":
            case "INT128":
            case "UHUGEINT":
                return new DecimalType(DecimalType.MAX_PRECISION, 0);

            case "REAL":
            case "FLOAT":
            case "FLOAT4":
                return AtomicType.FLOAT;
            case "DOUBLE":
            case "FLOAT8":
                return AtomicType.DOUBLE;
            case "DECIMAL":
            case "NUMERIC":
                return new DecimalType(18, 3);

            case "BLOB":
            case "BYTEA":
            case "BINARY":
            case "VARBINARY":
                return AtomicType.BINARY;

            case "BOOLEAN":
            case "BOOL":
            case "LOGICAL":
                return AtomicType.BOOLEAN;

            case "DATE":
                return AtomicType.DATE;
            case "TIMESTAMP":
            case "DATETIME":
            case "TIMESTAMP_S":
            case "TIMESTAMP_MS":
            case "TIMESTAMP_NS":
            case "TIMESTAMP WITH TIME ZONE":
            case "TIMESTAMPTZ":
                return AtomicType.TIMESTAMP;

            default:
                return AtomicType.STRING;
        }
    }
}
