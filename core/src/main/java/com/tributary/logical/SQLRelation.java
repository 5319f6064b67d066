package com.tributary.logical;

import com.tributary.types.StructType;

import java.util.Objects;

/**
 * Logical plan node backed by a SQL query run by DuckDB. The schema is
 * resolved up front, when the relation is converted.
 */
public final class SQLRelation extends LogicalPlan {

    private final String query;

    public SQLRelation(String query, StructType schema) {
        super();
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    public String query() {
        return query;
    }

    @Override
    public StructType inferSchema() {
        return schema;
    }

    @Override
    public String simpleString() {
        return "SQL " + schema.simpleString() + " " + query.replaceAll("\\s+", " ").trim();
    }
}
