package com.tributary.logical;

import com.tributary.types.StructType;
import com.tributary.util.SQLQuoting;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Logical plan node reading a DuckDB table or a set of files.
 *
 * <p>Example SQL generation:
 * <pre>
 *   TableScan(TABLE, [orders])             → SELECT * FROM "orders"
 *   TableScan(PARQUET, [/a.parquet])       → SELECT * FROM read_parquet(['/a.parquet'])
 *   TableScan(CSV, [/a.csv, /b.csv])       → SELECT * FROM read_csv_auto(['/a.csv', '/b.csv'])
 * </pre>
 */
public final class TableScan extends LogicalPlan {

    /**
     * Supported sources.
     */
    public enum TableFormat {
        TABLE,      // Table or view in the session database
        PARQUET,
        CSV,
        JSON;

        /**
         * Parses a client format name, case-insensitively.
         *
         * @param name the format name, e.g. "parquet"
         * @return the file format
         * @throws IllegalArgumentException if the format is not a supported file format
         */
        public static TableFormat fromFileFormat(String name) {
            String normalized = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
            for (TableFormat format : values()) {
                if (format != TABLE && format.name().equals(normalized)) {
                    return format;
                }
            }
            throw new IllegalArgumentException("Unsupported data source format: '" + name
                + "'. Supported formats are 'parquet', 'csv', 'json'.");
        }
    }

    private final TableFormat format;
    private final List<String> sources;

    /**
     * @param format the source format
     * @param sources the table name (for TABLE) or the file paths
     * @param schema the output schema
     */
    public TableScan(TableFormat format, List<String> sources, StructType schema) {
        super(); // No children
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.sources = List.copyOf(sources);
        if (this.sources.isEmpty()) {
            throw new IllegalArgumentException("TableScan needs at least one source");
        }
        if (format == TableFormat.TABLE && this.sources.size() != 1) {
            throw new IllegalArgumentException("A table scan reads exactly one table");
        }
        this.schema = schema;
    }

    public TableFormat format() {
        return format;
    }

    public List<String> sources() {
        return sources;
    }

    /**
     * Returns the DuckDB query reading this source.
     *
     * @param format the source format
     * @param sources the table name or file paths
     * @return the SQL text
     */
    public static String toDuckDBQuery(TableFormat format, List<String> sources) {
        if (format == TableFormat.TABLE) {
            return "SELECT * FROM " + SQLQuoting.quoteIdentifier(sources.get(0));
        }
        String paths = sources.stream()
            .map(SQLQuoting::quoteFilePath)
            .collect(Collectors.joining(", ", "[", "]"));
        switch (format) {
            case PARQUET:
                return "SELECT * FROM read_parquet(" + paths + ")";
            case CSV:
                return "SELECT * FROM read_csv_auto(" + paths + ")";
            case JSON:
                return "SELECT * FROM read_json_auto(" + paths + ")";
            default:
                throw new IllegalArgumentException("Unhandled format: " + format);
        }
    }

    public String toDuckDBQuery() {
        return toDuckDBQuery(format, sources);
    }

    @Override
    public StructType inferSchema() {
        return schema;
    }

    @Override
    protected void collectInputFiles(Set<String> files) {
        if (format != TableFormat.TABLE) {
            files.addAll(sources);
        }
    }

    @Override
    public String simpleString() {
        return "TableScan " + format.name().toLowerCase(Locale.ROOT) + " " + schema.simpleString()
            + " " + String.join(", ", sources);
    }
}
