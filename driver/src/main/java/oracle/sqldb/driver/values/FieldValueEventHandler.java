/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Map;

/**
 * @hidden
 * FieldValueEventHandler is an event-driven interface that allows multiple
 * implementations of serializers and deserializers for a {@link FieldValue}.
 * The events correspond to the data model exposed by {@link FieldValue}.
 * <p>
 * Sets are reported as arrays. Scalar values that have no JSON counterpart
 * (temporal values, UUIDs and intervals) are reported as strings in their
 * text form.
 * <p>
 * Example usage
 * <pre>
 *    RowValue row = new RowValue();
 *    row.put("name", "some name");
 *    JsonSerializer js = new JsonSerializer();
 *    FieldValueEventHandler.generate(row, js);
 *    String json = js.toString();
 * </pre>
 */
public interface FieldValueEventHandler {

    /**
     * Start a row. This method accepts the size of the row in number of
     * fields.
     * @param size the number of fields
     * @throws IOException conditionally, based on implementation
     */
    default void startRow(int size) throws IOException {}

    /**
     * Start an array. Also used for sets.
     * @param size the number of elements
     * @throws IOException conditionally, based on implementation
     */
    default void startArray(int size) throws IOException {}

    default void endRow(int size) throws IOException {}

    default void endArray(int size) throws IOException {}

    /**
     * Start a field in a row. This is followed by the event for the value
     * and then {@link #endRowField}.
     * @param key the name of the field
     * @throws IOException conditionally, based on implementation
     */
    default void startRowField(String key) throws IOException {}

    default void endRowField(String key) throws IOException {}

    default void endArrayField(int index) throws IOException {}

    default void booleanValue(boolean value) throws IOException {}

    default void binaryValue(byte[] byteArray) throws IOException {}

    default void stringValue(String value) throws IOException {}

    default void longValue(long value) throws IOException {}

    default void doubleValue(double value) throws IOException {}

    default void numberValue(BigDecimal value) throws IOException {}

    default void nullValue() throws IOException {}

    /**
     * Generates events for the value and all of its nested values.
     *
     * @param value the value
     * @param handler the handler receiving the events
     * @throws IOException if the handler throws
     */
    public static void generate(FieldValue value,
                                FieldValueEventHandler handler)
        throws IOException {

        FieldValue.Type type = value.getType();
        switch (type) {
            case ARRAY:
                generateForIterable(value.asArray(), value.asArray().size(),
                                    handler);
                break;
            case SET:
                generateForIterable(value.asSet(), value.asSet().size(),
                                    handler);
                break;
            case ROW:
                generateForRow(value.asRow(), handler);
                break;
            case BINARY:
                handler.binaryValue(value.getBinary());
                break;
            case BOOLEAN:
                handler.booleanValue(value.getBoolean());
                break;
            case DOUBLE:
                handler.doubleValue(value.getDouble());
                break;
            case INTEGER:
                handler.longValue(value.getLong());
                break;
            case NUMBER:
                handler.numberValue(value.getNumber());
                break;
            case STRING:
                handler.stringValue(value.getString());
                break;
            case UUID:
                handler.stringValue(value.getUuid().toString());
                break;
            case DATE:
                handler.stringValue(value.asDate().formatValue());
                break;
            case TIME:
                handler.stringValue(value.asTime().formatValue());
                break;
            case TIMETZ:
                handler.stringValue(value.asTimeTz().formatValue());
                break;
            case TIMESTAMP:
                handler.stringValue(value.asTimestamp().formatValue());
                break;
            case TIMESTAMPTZ:
                handler.stringValue(value.asTimestampTz().formatValue());
                break;
            case INTERVAL:
                handler.stringValue(value.asInterval().toIsoString());
                break;
            case NULL:
                handler.nullValue();
                break;
            default:
                throw new IllegalStateException(
                    "FieldValueEventHandler, unknown type " + type);
        }
    }

    static void generateForRow(RowValue row, FieldValueEventHandler handler)
        throws IOException {

        handler.startRow(row.size());
        for (Map.Entry<String, FieldValue> entry : row) {
            handler.startRowField(entry.getKey());
            generate(entry.getValue(), handler);
            handler.endRowField(entry.getKey());
        }
        handler.endRow(row.size());
    }

    static void generateForIterable(Iterable<FieldValue> elements,
                                    int size,
                                    FieldValueEventHandler handler)
        throws IOException {

        handler.startArray(size);
        int index = 0;
        for (FieldValue element : elements) {
            generate(element, handler);
            handler.endArrayField(index++);
        }
        handler.endArray(size);
    }
}
