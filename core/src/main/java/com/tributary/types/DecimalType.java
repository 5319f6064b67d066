package com.tributary.types;

/**
 * Fixed-precision decimal type.
 *
 * @param precision total number of digits, 1 to 38
 * @param scale digits after the decimal point, 0 to precision
 */
public record DecimalType(int precision, int scale) implements DataType {

    /** Maximum precision supported by the Arrow decimal vector used on the wire. */
    public static final int MAX_PRECISION = 38;

    public DecimalType {
        if (precision < 1 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException(
                "Decimal precision must be between 1 and " + MAX_PRECISION + ", got: " + precision);
        }
        if (scale < 0 || scale > precision) {
            throw new IllegalArgumentException(
                "Decimal scale must be between 0 and precision (" + precision + "), got: " + scale);
        }
    }

    @Override
    public String typeName() {
        return "decimal(" + precision + "," + scale + ")";
    }

    @Override
    public String simpleString() {
        return typeName();
    }

    @Override
    public int defaultSize() {
        return 16;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
