package com.tributary.arrow;

import com.tributary.types.AtomicType;
import com.tributary.types.DataType;
import com.tributary.types.DecimalType;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampMicroTZVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * Writes internal values of one column into its Arrow vector.
 */
@FunctionalInterface
interface ColumnWriter {

    /** Size estimate for the offset entry of a variable-width value. */
    int OFFSET_WIDTH = 4;

    /**
     * Writes {@code value} at {@code index}, growing the vector as needed.
     *
     * @param index row index in the current batch
     * @param value internal value, may be null
     * @return estimated number of bytes the value adds to the batch
     */
    int write(int index, Object value);

    /**
     * Returns the writer for a vector created from {@link ArrowSchemas#toArrowSchema}.
     *
     * @param type the column type
     * @param vector the vector of that column
     * @return the writer
     */
    static ColumnWriter forVector(DataType type, FieldVector vector) {
        if (type instanceof DecimalType decimal) {
            DecimalVector v = (DecimalVector) vector;
            return (i, value) -> {
                if (value == null) {
                    v.setNull(i);
                } else {
                    v.setSafe(i, ((BigDecimal) value).setScale(decimal.scale(), RoundingMode.HALF_UP));
                }
                return decimal.defaultSize();
            };
        }
        switch ((AtomicType) type) {
            case BOOLEAN: {
                BitVector v = (BitVector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                    } else {
                        v.setSafe(i, (Boolean) value ? 1 : 0);
                    }
                    return 1;
                };
            }
            case BYTE: {
                TinyIntVector v = (TinyIntVector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                    } else {
                        v.setSafe(i, ((Number) value).byteValue());
                    }
                    return 1;
                };
            }
            case SHORT: {
                SmallIntVector v = (SmallIntVector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                    } else {
                        v.setSafe(i, ((Number) value).shortValue());
                    }
                    return 2;
                };
            }
            case INTEGER: {
                IntVector v = (IntVector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                    } else {
                        v.setSafe(i, ((Number) value).intValue());
                    }
                    return 4;
                };
            }
            case LONG: {
                BigIntVector v = (BigIntVector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                    } else {
                        v.setSafe(i, ((Number) value).longValue());
                    }
                    return 8;
                };
            }
            case FLOAT: {
                Float4Vector v = (Float4Vector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                    } else {
                        v.setSafe(i, ((Number) value).floatValue());
                    }
                    return 4;
                };
            }
            case DOUBLE: {
                Float8Vector v = (Float8Vector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                    } else {
                        v.setSafe(i, ((Number) value).doubleValue());
                    }
                    return 8;
                };
            }
            case STRING: {
                VarCharVector v = (VarCharVector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                        return OFFSET_WIDTH;
                    }
                    byte[] bytes = value.toString().getBytes(StandardCharsets.UTF_8);
                    v.setSafe(i, bytes);
                    return bytes.length + OFFSET_WIDTH;
                };
            }
            case BINARY: {
                VarBinaryVector v = (VarBinaryVector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                        return OFFSET_WIDTH;
                    }
                    byte[] bytes = (byte[]) value;
                    v.setSafe(i, bytes);
                    return bytes.length + OFFSET_WIDTH;
                };
            }
            case DATE: {
                DateDayVector v = (DateDayVector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                    } else {
                        v.setSafe(i, ((Number) value).intValue());
                    }
                    return 4;
                };
            }
            case TIMESTAMP: {
                TimeStampMicroTZVector v = (TimeStampMicroTZVector) vector;
                return (i, value) -> {
                    if (value == null) {
                        v.setNull(i);
                    } else {
                        v.setSafe(i, ((Number) value).longValue());
                    }
                    return 8;
                };
            }
            default:
                throw new IllegalArgumentException("Unhandled type: " + type);
        }
    }
}
