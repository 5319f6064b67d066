package com.tributary.execution;

import com.tributary.execution.metric.SQLMetric;
import com.tributary.runtime.DuckDBRuntime;
import com.tributary.runtime.ResultSetRowIterator;
import com.tributary.runtime.RowIterator;
import com.tributary.types.StructType;

import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Runs a query in the session's DuckDB database as a single partition.
 *
 * <p>Each execution opens its own connection; DuckDB failures surface as
 * {@link com.tributary.exception.EmbeddedRuntimeException}.
 */
public final class DuckDBScanExec extends PhysicalPlan {

    private final DuckDBRuntime runtime;
    private final String sql;
    private final StructType schema;
    private final ZoneId zone;
    private final SQLMetric numOutputRows;
    private final SQLMetric openTime;

    public DuckDBScanExec(DuckDBRuntime runtime, String sql, StructType schema, ZoneId zone) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.numOutputRows = registerMetric("numOutputRows", SQLMetric.count("number of output rows"));
        this.openTime = registerMetric("openTime", SQLMetric.nanoTiming("time to open query"));
    }

    public String sql() {
        return sql;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LEAF;
    }

    @Override
    public String nodeName() {
        return "DuckDBScan";
    }

    @Override
    public List<PhysicalPlan> children() {
        return List.of();
    }

    @Override
    public StructType schema() {
        return schema;
    }

    @Override
    public int numPartitions() {
        return 1;
    }

    @Override
    public RowIterator execute(int partition) {
        checkPartition(partition);
        long startNanos = System.nanoTime();
        try {
            return counting(ResultSetRowIterator.open(runtime, sql, schema, zone), numOutputRows);
        } finally {
            openTime.add(System.nanoTime() - startNanos);
        }
    }

    @Override
    protected String argString() {
        return schema.simpleString() + " " + sql.replaceAll("\\s+", " ").trim();
    }
}
