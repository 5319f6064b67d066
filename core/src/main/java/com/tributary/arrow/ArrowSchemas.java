package com.tributary.arrow;

import com.tributary.exception.AnalysisException;
import com.tributary.types.AtomicType;
import com.tributary.types.DataType;
import com.tributary.types.DecimalType;
import com.tributary.types.StructField;
import com.tributary.types.StructType;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between row schemas and Arrow schemas.
 */
public final class ArrowSchemas {

    private ArrowSchemas() {}

    /**
     * Builds the Arrow schema used to encode rows of {@code schema}.
     * Timestamps are microsecond precision and carry {@code timeZoneId}.
     *
     * @param schema the row schema
     * @param timeZoneId session time zone
     * @return the Arrow schema
     */
    public static Schema toArrowSchema(StructType schema, String timeZoneId) {
        List<Field> fields = new ArrayList<>(schema.size());
        for (StructField field : schema.fields()) {
            ArrowType arrowType = toArrowType(field.dataType(), timeZoneId);
            FieldType fieldType = field.nullable()
                ? FieldType.nullable(arrowType)
                : FieldType.notNullable(arrowType);
            fields.add(new Field(field.name(), fieldType, null));
        }
        return new Schema(fields);
    }

    static ArrowType toArrowType(DataType type, String timeZoneId) {
        if (type instanceof DecimalType decimal) {
            return new ArrowType.Decimal(decimal.precision(), decimal.scale(), 128);
        }
        switch ((AtomicType) type) {
            case BOOLEAN:
                return ArrowType.Bool.INSTANCE;
            case BYTE:
                return new ArrowType.Int(8, true);
            case SHORT:
                return new ArrowType.Int(16, true);
            case INTEGER:
                return new ArrowType.Int(32, true);
            case LONG:
                return new ArrowType.Int(64, true);
            case FLOAT:
                return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
            case DOUBLE:
                return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
            case STRING:
                return ArrowType.Utf8.INSTANCE;
            case BINARY:
                return ArrowType.Binary.INSTANCE;
            case DATE:
                return new ArrowType.Date(DateUnit.DAY);
            case TIMESTAMP:
                return new ArrowType.Timestamp(TimeUnit.MICROSECOND, timeZoneId);
            default:
                throw new IllegalArgumentException("Unhandled type: " + type);
        }
    }

    /**
     * Reads a row schema back from an Arrow schema, e.g. one sent by a client.
     *
     * @param schema the Arrow schema
     * @return the row schema
     * @throws AnalysisException if a field has a type with no row counterpart
     */
    public static StructType fromArrowSchema(Schema schema) {
        List<StructField> fields = new ArrayList<>(schema.getFields().size());
        for (Field field : schema.getFields()) {
            fields.add(new StructField(field.getName(), fromArrowType(field), field.isNullable()));
        }
        return new StructType(fields);
    }

    private static DataType fromArrowType(Field field) {
        ArrowType type = field.getType();
        switch (type.getTypeID()) {
            case Bool:
                return AtomicType.BOOLEAN;
            case Int: {
                ArrowType.Int intType = (ArrowType.Int) type;
                if (intType.getIsSigned()) {
                    switch (intType.getBitWidth()) {
                        case 8: return AtomicType.BYTE;
                        case 16: return AtomicType.SHORT;
                        case 32: return AtomicType.INTEGER;
                        case 64: return AtomicType.LONG;
                        default: break;
                    }
                }
                break;
            }
            case FloatingPoint: {
                FloatingPointPrecision precision = ((ArrowType.FloatingPoint) type).getPrecision();
                if (precision == FloatingPointPrecision.SINGLE) {
                    return AtomicType.FLOAT;
                }
                if (precision == FloatingPointPrecision.DOUBLE) {
                    return AtomicType.DOUBLE;
                }
                break;
            }
            case Utf8:
            case LargeUtf8:
                return AtomicType.STRING;
            case Binary:
            case LargeBinary:
                return AtomicType.BINARY;
            case Date:
                return AtomicType.DATE;
            case Timestamp:
                return AtomicType.TIMESTAMP;
            case Decimal: {
                ArrowType.Decimal decimal = (ArrowType.Decimal) type;
                if (decimal.getBitWidth() == 128) {
                    return new DecimalType(decimal.getPrecision(), decimal.getScale());
                }
                break;
            }
            default:
                break;
        }
        throw new AnalysisException(
            "Unsupported Arrow type for column '" + field.getName() + "': " + type);
    }
}
