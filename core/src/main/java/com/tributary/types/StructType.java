package com.tributary.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Row schema: an ordered list of named, typed fields.
 */
public final class StructType {

    /** Schema with no fields. */
    public static final StructType EMPTY = new StructType(Collections.emptyList());

    private final List<StructField> fields;

    public StructType(List<StructField> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public StructType(StructField... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Returns the fields in declaration order.
     *
     * @return an unmodifiable list of fields
     */
    public List<StructField> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    /**
     * Returns the index of the field with the given name, or -1 if not found.
     *
     * @param name the field name
     * @return the field index, or -1 if not found
     */
    public int fieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Renders the schema as an indented tree:
     * <pre>
     * root
     *  |-- id: long (nullable = false)
     * </pre>
     *
     * @return the tree text, ending with a newline
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder("root\n");
        for (StructField field : fields) {
            sb.append(" |-- ")
              .append(field.name())
              .append(": ")
              .append(field.dataType().typeName())
              .append(" (nullable = ")
              .append(field.nullable())
              .append(")\n");
        }
        return sb.toString();
    }

    /**
     * Renders the schema as a bracketed column list, e.g. {@code [id: bigint, name: string]}.
     *
     * @return the column list
     */
    public String simpleString() {
        return fields.stream()
            .map(f -> f.name() + ": " + f.dataType().simpleString())
            .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructType that = (StructType) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "StructType(" + fields + ")";
    }
}
