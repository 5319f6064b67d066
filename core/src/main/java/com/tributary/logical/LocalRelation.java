package com.tributary.logical;

import com.tributary.types.StructType;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Logical plan node holding rows shipped by the client.
 */
public final class LocalRelation extends LogicalPlan {

    private final List<Object[]> rows;

    public LocalRelation(StructType schema, List<Object[]> rows) {
        super();
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.rows = Collections.unmodifiableList(rows);
    }

    public List<Object[]> rows() {
        return rows;
    }

    @Override
    public StructType inferSchema() {
        return schema;
    }

    @Override
    public OptionalLong estimatedRowCount() {
        return OptionalLong.of(rows.size());
    }

    @Override
    public boolean isLocal() {
        return true;
    }

    @Override
    public String simpleString() {
        return "LocalRelation " + schema.simpleString() + ", " + rows.size() + " rows";
    }
}
