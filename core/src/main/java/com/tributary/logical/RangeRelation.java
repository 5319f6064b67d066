package com.tributary.logical;

import com.tributary.types.AtomicType;
import com.tributary.types.StructField;
import com.tributary.types.StructType;

import java.math.BigInteger;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Logical plan node producing the longs {@code start, start + step, ...}
 * up to but excluding {@code end}, in a single non-nullable column "id".
 */
public final class RangeRelation extends LogicalPlan {

    static final StructType RANGE_SCHEMA = new StructType(new StructField("id", AtomicType.LONG, false));

    private final long start;
    private final long end;
    private final long step;
    private final OptionalInt numPartitions;

    /**
     * @param start first value (inclusive)
     * @param end last value (exclusive)
     * @param step increment, positive or negative
     * @param numPartitions requested number of partitions, or empty for the session default
     * @throws IllegalArgumentException if step is zero or numPartitions is not positive
     */
    public RangeRelation(long start, long end, long step, OptionalInt numPartitions) {
        super(); // No children - this is a leaf node
        if (step == 0) {
            throw new IllegalArgumentException("step cannot be zero");
        }
        if (numPartitions.isPresent() && numPartitions.getAsInt() <= 0) {
            throw new IllegalArgumentException(
                "numPartitions must be positive, got: " + numPartitions.getAsInt());
        }
        this.start = start;
        this.end = end;
        this.step = step;
        this.numPartitions = numPartitions;
        this.schema = RANGE_SCHEMA;
    }

    public long start() {
        return start;
    }

    public long end() {
        return end;
    }

    public long step() {
        return step;
    }

    public OptionalInt numPartitions() {
        return numPartitions;
    }

    /**
     * Returns the number of values in this range.
     *
     * @return the element count
     * @throws ArithmeticException if the count does not fit in a long
     */
    public long count() {
        BigInteger span = BigInteger.valueOf(end).subtract(BigInteger.valueOf(start));
        BigInteger bigStep = BigInteger.valueOf(step);
        if (span.signum() == 0 || span.signum() != bigStep.signum()) {
            return 0;
        }
        // ceil(span / step) for span and step of the same sign
        BigInteger[] qr = span.divideAndRemainder(bigStep);
        BigInteger count = qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
        return count.longValueExact();
    }

    @Override
    public StructType inferSchema() {
        return RANGE_SCHEMA;
    }

    @Override
    public OptionalLong estimatedRowCount() {
        return OptionalLong.of(count());
    }

    @Override
    public String simpleString() {
        return String.format("Range (%d, %d, step=%d%s)", start, end, step,
            numPartitions.isPresent() ? ", splits=" + numPartitions.getAsInt() : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RangeRelation that = (RangeRelation) o;
        return start == that.start && end == that.end && step == that.step
            && numPartitions.equals(that.numPartitions);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(start);
        result = 31 * result + Long.hashCode(end);
        result = 31 * result + Long.hashCode(step);
        result = 31 * result + numPartitions.hashCode();
        return result;
    }
}
