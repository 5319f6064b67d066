package com.tributary.types;

/**
 * Fixed, parameterless column types.
 */
public enum AtomicType implements DataType {
    BOOLEAN("boolean", "boolean", 1),
    BYTE("byte", "tinyint", 1),
    SHORT("short", "smallint", 2),
    INTEGER("integer", "int", 4),
    LONG("long", "bigint", 8),
    FLOAT("float", "float", 4),
    DOUBLE("double", "double", 8),
    STRING("string", "string", -1),
    BINARY("binary", "binary", -1),
    DATE("date", "date", 4),
    TIMESTAMP("timestamp", "timestamp", 8);

    private final String typeName;
    private final String simpleString;
    private final int defaultSize;

    AtomicType(String typeName, String simpleString, int defaultSize) {
        this.typeName = typeName;
        this.simpleString = simpleString;
        this.defaultSize = defaultSize;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public String simpleString() {
        return simpleString;
    }

    @Override
    public int defaultSize() {
        return defaultSize;
    }

    /**
     * Returns true for the integral and floating point types.
     *
     * @return whether values of this type are numbers
     */
    public boolean isNumeric() {
        return this == BYTE || this == SHORT || this == INTEGER || this == LONG
            || this == FLOAT || this == DOUBLE;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
