package com.tributary.types;

/**
 * Sealed interface for the column types a query result can carry.
 *
 * <p>The set is deliberately flat: every type here maps to exactly one Arrow
 * vector type on the wire and to one internal value representation:
 * <ul>
 *   <li>{@link AtomicType#BOOLEAN}: {@code Boolean}</li>
 *   <li>{@link AtomicType#BYTE} to {@link AtomicType#DOUBLE}: the boxed Java number</li>
 *   <li>{@link AtomicType#STRING}: {@code String}; {@link AtomicType#BINARY}: {@code byte[]}</li>
 *   <li>{@link AtomicType#DATE}: {@code Integer} days since the epoch</li>
 *   <li>{@link AtomicType#TIMESTAMP}: {@code Long} microseconds since the epoch (UTC)</li>
 *   <li>{@link DecimalType}: {@code BigDecimal} at the type's scale</li>
 * </ul>
 */
public sealed interface DataType permits AtomicType, DecimalType {

    /**
     * Returns the name used in schema trees, e.g. {@code long}.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the name used in plan output, e.g. {@code bigint}.
     *
     * @return the SQL-style type name
     */
    String simpleString();

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types.
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }
}
