package com.tributary.types;

import java.util.Objects;

/**
 * A named column of a {@link StructType}.
 */
public record StructField(String name, DataType dataType, boolean nullable) {

    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a nullable field.
     *
     * @param name the field name
     * @param dataType the field data type
     */
    public StructField(String name, DataType dataType) {
        this(name, dataType, true);
    }

    /**
     * Returns a copy of this field under another name.
     *
     * @param newName the new name
     * @return the renamed field
     */
    public StructField withName(String newName) {
        return new StructField(newName, dataType, nullable);
    }

    @Override
    public String toString() {
        return name + ": " + dataType.typeName() + (nullable ? "" : " NOT NULL");
    }
}
