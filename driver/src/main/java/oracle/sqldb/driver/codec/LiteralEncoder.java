/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.codec;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.util.List;

import oracle.sqldb.driver.EncodingTypeMismatchException;
import oracle.sqldb.driver.types.RowField;
import oracle.sqldb.driver.types.TypeDescriptor;
import oracle.sqldb.driver.values.FieldValue;
import oracle.sqldb.driver.values.RowValue;

/**
 * Produces SQL literal text for a value of a given type, for use when
 * values are interpolated into statement text.
 * <p>
 * NULL is written as {@code NULL} at any level. Containers are written
 * {@code ARRAY[e1,e2]}, {@code SET[e1,e2]} and {@code ROW(e1,e2)}, without
 * field names. The outermost container is followed by a
 * {@code ::type} cast when the server could not infer its type from the
 * elements alone: when it holds an empty container, a NULL, a ROW or a
 * scalar whose literal does not identify its type. Only BOOLEAN, INTEGER
 * and VARCHAR literals do.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class LiteralEncoder {

    private final ScalarCodec scalar;

    public LiteralEncoder(ScalarCodec scalar) {
        requireNonNull(scalar, "LiteralEncoder: scalar must be non-null");
        this.scalar = scalar;
    }

    /**
     * Encodes a value as a literal of the given type.
     *
     * @param value the value
     * @param type the target type
     *
     * @return the literal
     *
     * @throws EncodingTypeMismatchException if the value cannot be
     * represented by the type
     */
    public String encode(FieldValue value, TypeDescriptor type) {
        requireNonNull(value, "LiteralEncoder.encode: value must be non-null");
        requireNonNull(type, "LiteralEncoder.encode: type must be non-null");
        StringBuilder sb = new StringBuilder();
        encodeValue(value, type, sb);
        if (type.isContainer() && !value.isNull() && needsCast(value, type)) {
            sb.append("::").append(type.getTypeName());
        }
        return sb.toString();
    }

    private void encodeValue(FieldValue value,
                             TypeDescriptor type,
                             StringBuilder sb) {
        if (value.isNull()) {
            sb.append("NULL");
            return;
        }
        switch (type.getKind()) {
        case ARRAY:
            checkShape(value.isArray(), value, type);
            sb.append("ARRAY");
            encodeElements(value.asArray(), type.getElement(), sb);
            break;
        case SET:
            checkShape(value.isSet(), value, type);
            sb.append("SET");
            encodeElements(value.asSet(), type.getElement(), sb);
            break;
        case ROW:
            checkShape(value.isRow(), value, type);
            encodeRow(value.asRow(), type, sb);
            break;
        default:
            checkShape(!value.isContainer(), value, type);
            sb.append(scalar.encode(value, type));
        }
    }

    private void encodeElements(Iterable<FieldValue> elements,
                                TypeDescriptor elementType,
                                StringBuilder sb) {
        sb.append('[');
        boolean first = true;
        for (FieldValue element : elements) {
            if (!first) {
                sb.append(',');
            }
            encodeValue(element, elementType, sb);
            first = false;
        }
        sb.append(']');
    }

    private void encodeRow(RowValue row, TypeDescriptor type, StringBuilder sb) {
        List<RowField> fields = type.getFields();
        if (row.size() != fields.size()) {
            throw new EncodingTypeMismatchException(
                "Row with " + row.size() + " fields cannot be encoded as " +
                type.getTypeName(), type.getTypeName(), row.toString());
        }
        sb.append("ROW(");
        List<FieldValue> values = row.values();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            encodeValue(values.get(i), fields.get(i).getType(), sb);
        }
        sb.append(')');
    }

    /*
     * Returns true if the literal of a container does not identify its
     * type by itself.
     */
    private static boolean needsCast(FieldValue value, TypeDescriptor type) {
        if (value.isNull()) {
            return true;
        }
        switch (type.getKind()) {
        case ARRAY:
        case SET: {
            Iterable<FieldValue> elements = value.isArray() ?
                value.asArray() : value.asSet();
            boolean empty = true;
            for (FieldValue element : elements) {
                empty = false;
                if (needsCast(element, type.getElement())) {
                    return true;
                }
            }
            return empty;
        }
        case ROW:
            return true;
        case BOOLEAN:
        case INTEGER:
        case VARCHAR:
            return false;
        default:
            return true;
        }
    }

    private static void checkShape(boolean matches,
                                   FieldValue value,
                                   TypeDescriptor type) {
        if (!matches) {
            throw new EncodingTypeMismatchException(
                "Value of type " + value.getType() + " cannot be encoded as " +
                type.getTypeName(), type.getTypeName(), value.toString());
        }
    }
}
