package com.tributary.logical;

import com.tributary.exception.AnalysisException;
import com.tributary.types.StructField;
import com.tributary.types.StructType;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Logical plan node concatenating the rows of all its inputs (UNION ALL).
 *
 * <p>Inputs are matched by position. Column names come from the first input;
 * a column is nullable if it is nullable in any input.
 */
public final class Union extends LogicalPlan {

    /**
     * @param inputs the inputs, at least one
     * @throws AnalysisException if the inputs have different column counts or types
     */
    public Union(List<LogicalPlan> inputs) {
        super(inputs);
        if (inputs.isEmpty()) {
            throw new AnalysisException("Union requires at least one input");
        }
        this.schema = mergeSchemas(inputs);
    }

    private static StructType mergeSchemas(List<LogicalPlan> inputs) {
        StructType first = inputs.get(0).schema();
        List<StructField> fields = new ArrayList<>(first.fields());
        for (int i = 1; i < inputs.size(); i++) {
            StructType other = inputs.get(i).schema();
            if (other.size() != first.size()) {
                throw new AnalysisException(String.format(
                    "Union can only be performed on inputs with the same number of columns, "
                        + "but the first input has %d columns and input %d has %d columns",
                    first.size(), i, other.size()));
            }
            for (int c = 0; c < fields.size(); c++) {
                StructField merged = fields.get(c);
                StructField candidate = other.fieldAt(c);
                if (!merged.dataType().equals(candidate.dataType())) {
                    throw new AnalysisException(String.format(
                        "Union can only be performed on inputs with compatible column types: "
                            + "column %d is %s in the first input but %s in input %d",
                        c, merged.dataType().typeName(), candidate.dataType().typeName(), i));
                }
                if (candidate.nullable() && !merged.nullable()) {
                    fields.set(c, new StructField(merged.name(), merged.dataType(), true));
                }
            }
        }
        return new StructType(fields);
    }

    @Override
    public StructType inferSchema() {
        return schema;
    }

    @Override
    public OptionalLong estimatedRowCount() {
        long total = 0;
        for (LogicalPlan child : children) {
            OptionalLong rows = child.estimatedRowCount();
            if (rows.isEmpty()) {
                return OptionalLong.empty();
            }
            total += rows.getAsLong();
        }
        return OptionalLong.of(total);
    }

    @Override
    public String simpleString() {
        return "Union";
    }
}
