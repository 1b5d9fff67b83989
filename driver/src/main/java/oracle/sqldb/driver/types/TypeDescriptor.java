/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.types;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * TypeDescriptor describes the SQL type of a column, or of an element or
 * field nested in a container type. It is built once from column metadata
 * or from type text and drives both decoding and encoding of values.
 * <p>
 * Instances are immutable and may be shared between threads. Two
 * descriptors are equal if they describe the same type, including all
 * attributes and nested types.
 * <p>
 * Attributes that do not apply to a kind, or that were not specified, have
 * the value -1 (or null for object attributes).
 */
public final class TypeDescriptor {

    /**
     * The kind of a SQL type.
     */
    public enum Kind {
        BOOLEAN,
        INTEGER,
        FLOAT,
        DECIMAL,
        CHAR,
        VARCHAR,
        BINARY,
        VARBINARY,
        UUID,
        DATE,
        TIME,
        TIMETZ,
        TIMESTAMP,
        TIMESTAMPTZ,
        INTERVAL,
        ARRAY,
        SET,
        ROW
    }

    private static final Pattern SIMPLE_NAME =
        Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    private static final TypeDescriptor BOOLEAN_TYPE =
        new TypeDescriptor(Kind.BOOLEAN);
    private static final TypeDescriptor INTEGER_TYPE =
        new TypeDescriptor(Kind.INTEGER);
    private static final TypeDescriptor FLOAT_TYPE =
        new TypeDescriptor(Kind.FLOAT);
    private static final TypeDescriptor UUID_TYPE =
        new TypeDescriptor(Kind.UUID);
    private static final TypeDescriptor DATE_TYPE =
        new TypeDescriptor(Kind.DATE);

    private final Kind kind;
    private final int precision;
    private final int scale;
    private final int length;
    private final IntervalRange intervalRange;
    private final TypeDescriptor element;
    private final int maxElements;
    private final List<RowField> fields;

    private TypeDescriptor(Kind kind) {
        this(kind, -1, -1, -1, null, null, -1, null);
    }

    private TypeDescriptor(Kind kind,
                           int precision,
                           int scale,
                           int length,
                           IntervalRange intervalRange,
                           TypeDescriptor element,
                           int maxElements,
                           List<RowField> fields) {
        this.kind = kind;
        this.precision = precision;
        this.scale = scale;
        this.length = length;
        this.intervalRange = intervalRange;
        this.element = element;
        this.maxElements = maxElements;
        this.fields = fields;
    }

    public static TypeDescriptor booleanType() {
        return BOOLEAN_TYPE;
    }

    public static TypeDescriptor integerType() {
        return INTEGER_TYPE;
    }

    public static TypeDescriptor floatType() {
        return FLOAT_TYPE;
    }

    public static TypeDescriptor decimalType() {
        return decimalType(-1, -1);
    }

    /**
     * Creates a DECIMAL descriptor.
     *
     * @param precision the total number of digits, or -1
     * @param scale the number of fraction digits, or -1
     * @return the descriptor
     */
    public static TypeDescriptor decimalType(int precision, int scale) {
        return new TypeDescriptor(Kind.DECIMAL, precision, scale, -1, null,
                                  null, -1, null);
    }

    /**
     * Creates a CHAR descriptor. Decoded values are padded with spaces to
     * the length, counted in UTF-8 octets.
     *
     * @param length the length in octets, or -1
     * @return the descriptor
     */
    public static TypeDescriptor charType(int length) {
        return withLength(Kind.CHAR, length);
    }

    public static TypeDescriptor varcharType() {
        return withLength(Kind.VARCHAR, -1);
    }

    public static TypeDescriptor varcharType(int length) {
        return withLength(Kind.VARCHAR, length);
    }

    /**
     * Creates a BINARY descriptor. Decoded values are padded with zero bytes
     * to the length.
     *
     * @param length the length in bytes, or -1
     * @return the descriptor
     */
    public static TypeDescriptor binaryType(int length) {
        return withLength(Kind.BINARY, length);
    }

    public static TypeDescriptor varbinaryType() {
        return withLength(Kind.VARBINARY, -1);
    }

    public static TypeDescriptor varbinaryType(int length) {
        return withLength(Kind.VARBINARY, length);
    }

    public static TypeDescriptor uuidType() {
        return UUID_TYPE;
    }

    public static TypeDescriptor dateType() {
        return DATE_TYPE;
    }

    public static TypeDescriptor timeType() {
        return withPrecision(Kind.TIME, -1);
    }

    public static TypeDescriptor timeType(int precision) {
        return withPrecision(Kind.TIME, precision);
    }

    public static TypeDescriptor timeTzType() {
        return withPrecision(Kind.TIMETZ, -1);
    }

    public static TypeDescriptor timeTzType(int precision) {
        return withPrecision(Kind.TIMETZ, precision);
    }

    public static TypeDescriptor timestampType() {
        return withPrecision(Kind.TIMESTAMP, -1);
    }

    public static TypeDescriptor timestampType(int precision) {
        return withPrecision(Kind.TIMESTAMP, precision);
    }

    public static TypeDescriptor timestampTzType() {
        return withPrecision(Kind.TIMESTAMPTZ, -1);
    }

    public static TypeDescriptor timestampTzType(int precision) {
        return withPrecision(Kind.TIMESTAMPTZ, precision);
    }

    public static TypeDescriptor intervalType(IntervalRange range) {
        return intervalType(range, -1);
    }

    /**
     * Creates an INTERVAL descriptor.
     *
     * @param range the field range
     * @param precision the fractional second precision, or -1
     * @return the descriptor
     */
    public static TypeDescriptor intervalType(IntervalRange range,
                                              int precision) {
        requireNonNull(range, "intervalType: range must be non-null");
        return new TypeDescriptor(Kind.INTERVAL, precision, -1, -1, range,
                                  null, -1, null);
    }

    public static TypeDescriptor arrayOf(TypeDescriptor element) {
        return arrayOf(element, -1);
    }

    /**
     * Creates an ARRAY descriptor.
     *
     * @param element the element type
     * @param maxElements the maximum number of elements, or -1
     * @return the descriptor
     */
    public static TypeDescriptor arrayOf(TypeDescriptor element,
                                         int maxElements) {
        return collectionOf(Kind.ARRAY, element, maxElements);
    }

    public static TypeDescriptor setOf(TypeDescriptor element) {
        return setOf(element, -1);
    }

    public static TypeDescriptor setOf(TypeDescriptor element,
                                       int maxElements) {
        return collectionOf(Kind.SET, element, maxElements);
    }

    public static TypeDescriptor row(RowField... fields) {
        requireNonNull(fields, "row: fields must be non-null");
        return row(Arrays.asList(fields));
    }

    /**
     * Creates a ROW descriptor. Field names must be unique.
     *
     * @param fields the fields, in order; may be empty
     * @return the descriptor
     *
     * @throws IllegalArgumentException if a field name is repeated
     */
    public static TypeDescriptor row(List<RowField> fields) {
        requireNonNull(fields, "row: fields must be non-null");
        Set<String> names = new HashSet<String>();
        for (RowField field : fields) {
            requireNonNull(field, "row: field must be non-null");
            if (!names.add(field.getName())) {
                throw new IllegalArgumentException(
                    "Duplicate row field name: " + field.getName());
            }
        }
        return new TypeDescriptor(Kind.ROW, -1, -1, -1, null, null, -1,
                                  Collections.unmodifiableList(
                                      new ArrayList<RowField>(fields)));
    }

    private static TypeDescriptor withLength(Kind kind, int length) {
        return new TypeDescriptor(kind, -1, -1, length, null, null, -1, null);
    }

    private static TypeDescriptor withPrecision(Kind kind, int precision) {
        return new TypeDescriptor(kind, precision, -1, -1, null, null, -1,
                                  null);
    }

    private static TypeDescriptor collectionOf(Kind kind,
                                               TypeDescriptor element,
                                               int maxElements) {
        requireNonNull(element, kind + ": element type must be non-null");
        return new TypeDescriptor(kind, -1, -1, -1, null, element,
                                  maxElements, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the precision: total digits for DECIMAL, fractional second
     * digits for the time and interval kinds.
     *
     * @return the precision or -1
     */
    public int getPrecision() {
        return precision;
    }

    public int getScale() {
        return scale;
    }

    /**
     * Returns the declared length of a character or binary type, in octets.
     *
     * @return the length or -1
     */
    public int getLength() {
        return length;
    }

    public IntervalRange getIntervalRange() {
        return intervalRange;
    }

    /**
     * @return the element type of an ARRAY or SET, null otherwise
     */
    public TypeDescriptor getElement() {
        return element;
    }

    public int getMaxElements() {
        return maxElements;
    }

    /**
     * @return the fields of a ROW, null otherwise
     */
    public List<RowField> getFields() {
        return fields;
    }

    public boolean isContainer() {
        return kind == Kind.ARRAY || kind == Kind.SET || kind == Kind.ROW;
    }

    public boolean isCharacter() {
        return kind == Kind.CHAR || kind == Kind.VARCHAR;
    }

    public boolean isBinary() {
        return kind == Kind.BINARY || kind == Kind.VARBINARY;
    }

    public boolean isNumeric() {
        return kind == Kind.INTEGER || kind == Kind.FLOAT ||
            kind == Kind.DECIMAL;
    }

    /**
     * Returns the canonical SQL spelling of the type, suitable for use in a
     * cast, for example "ARRAY[INTERVAL DAY TO SECOND]" or
     * "ROW(name VARCHAR(10), b ARRAY[NUMERIC(10,2)])".
     *
     * @return the type name
     */
    public String getTypeName() {
        StringBuilder sb = new StringBuilder();
        appendTypeName(sb);
        return sb.toString();
    }

    private void appendTypeName(StringBuilder sb) {
        switch (kind) {
        case DECIMAL:
            sb.append("NUMERIC");
            if (precision >= 0) {
                sb.append('(').append(precision);
                if (scale >= 0) {
                    sb.append(',').append(scale);
                }
                sb.append(')');
            }
            break;
        case CHAR:
        case VARCHAR:
        case BINARY:
        case VARBINARY:
            sb.append(kind.name());
            appendModifier(sb, length);
            break;
        case TIME:
        case TIMETZ:
        case TIMESTAMP:
        case TIMESTAMPTZ:
            sb.append(kind.name());
            appendModifier(sb, precision);
            break;
        case INTERVAL:
            sb.append("INTERVAL ").append(intervalRange.getTypeName());
            appendModifier(sb, precision);
            break;
        case ARRAY:
        case SET:
            sb.append(kind.name()).append('[');
            element.appendTypeName(sb);
            if (maxElements >= 0) {
                sb.append(',').append(maxElements);
            }
            sb.append(']');
            break;
        case ROW:
            sb.append("ROW(");
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                RowField field = fields.get(i);
                appendFieldName(sb, field.getName());
                sb.append(' ');
                field.getType().appendTypeName(sb);
            }
            sb.append(')');
            break;
        default:
            sb.append(kind.name());
        }
    }

    private static void appendModifier(StringBuilder sb, int value) {
        if (value >= 0) {
            sb.append('(').append(value).append(')');
        }
    }

    private static void appendFieldName(StringBuilder sb, String name) {
        if (SIMPLE_NAME.matcher(name).matches()) {
            sb.append(name);
        } else {
            sb.append('"').append(name.replace("\"", "\"\"")).append('"');
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TypeDescriptor)) {
            return false;
        }
        TypeDescriptor o = (TypeDescriptor) other;
        return kind == o.kind &&
            precision == o.precision &&
            scale == o.scale &&
            length == o.length &&
            maxElements == o.maxElements &&
            intervalRange == o.intervalRange &&
            Objects.equals(element, o.element) &&
            Objects.equals(fields, o.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, precision, scale, length, maxElements,
                            intervalRange, element, fields);
    }

    @Override
    public String toString() {
        return getTypeName();
    }
}
