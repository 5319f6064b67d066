package com.tributary.connect.converter;

import com.tributary.connect.proto.DataSchema;
import com.tributary.connect.proto.SchemaField;
import com.tributary.types.StructField;
import com.tributary.types.StructType;

/**
 * Converts engine schemas to their wire form.
 */
public final class SchemaConverter {

    private SchemaConverter() {
    }

    public static DataSchema toProto(StructType schema) {
        DataSchema.Builder builder = DataSchema.newBuilder();
        for (StructField field : schema.fields()) {
            builder.addFields(SchemaField.newBuilder()
                .setName(field.name())
                .setDataType(field.dataType().typeName())
                .setNullable(field.nullable())
                .build());
        }
        return builder.build();
    }
}
