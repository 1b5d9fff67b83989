/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import java.math.BigDecimal;

import com.fasterxml.jackson.core.io.CharTypes;

/**
 * JsonSerializer is a {@link FieldValueEventHandler} instance that creates
 * a JSON string value without pretty printing.
 * @hidden
 */
public class JsonSerializer implements FieldValueEventHandler {

    protected final StringBuilder sb;

    /**
     * Constants use for serialization
     */
    protected static final String START_OBJECT = "{";
    protected static final String END_OBJECT = "}";
    protected static final String START_ARRAY = "[";
    protected static final String END_ARRAY = "]";
    protected static final String FIELD_SEP = ",";
    protected static final String QUOTE = "\"";
    protected static final String KEY_SEP = ":";

    /**
     * Creates a new JsonSerializer.
     */
    public JsonSerializer() {
        sb = new StringBuilder();
    }

    @Override
    public void startRow(int size) {
        sb.append(START_OBJECT);
    }

    @Override
    public void startArray(int size) {
        sb.append(START_ARRAY);
    }

    @Override
    public void endRow(int size) {
        trimSeparator();
        sb.append(END_OBJECT);
    }

    @Override
    public void endArray(int size) {
        trimSeparator();
        sb.append(END_ARRAY);
    }

    @Override
    public void startRowField(String key) {
        sb.append(QUOTE);
        CharTypes.appendQuoted(sb, key);
        sb.append(QUOTE).append(KEY_SEP);
    }

    @Override
    public void endRowField(String key) {
        sb.append(FIELD_SEP);
    }

    @Override
    public void endArrayField(int index) {
        sb.append(FIELD_SEP);
    }

    @Override
    public void booleanValue(boolean value) {
        sb.append(Boolean.toString(value));
    }

    @Override
    public void binaryValue(byte[] byteArray) {
        sb.append(QUOTE).append(BinaryValue.encodeBase64(byteArray))
            .append(QUOTE);
    }

    @Override
    public void stringValue(String value) {
        sb.append(QUOTE);
        CharTypes.appendQuoted(sb, value);
        sb.append(QUOTE);
    }

    @Override
    public void longValue(long value) {
        sb.append(Long.toString(value));
    }

    /*
     * NaN and the infinities are written as bare tokens, as accepted by
     * Jackson with ALLOW_NON_NUMERIC_NUMBERS.
     */
    @Override
    public void doubleValue(double value) {
        sb.append(Double.toString(value));
    }

    @Override
    public void numberValue(BigDecimal value) {
        sb.append(value.toString());
    }

    @Override
    public void nullValue() {
        sb.append("null");
    }

    private void trimSeparator() {
        int len = sb.length() - 1;
        if (len > 0 && sb.charAt(len) == ',') {
            sb.setLength(len);
        }
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
