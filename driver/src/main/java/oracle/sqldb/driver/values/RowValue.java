/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RowValue represents an ordered list of named {@link FieldValue}
 * instances, the decoded form of a ROW type. Field order is the order of
 * the fields in the row type and is significant: two rows with the same
 * fields in a different order are not equal. Field names are unique within
 * a row; putting a value under an existing name replaces the value and
 * keeps the position.
 * <p>
 * A row with no fields is valid and is distinct from {@link NullValue}.
 */
public class RowValue extends FieldValue
    implements Iterable<Map.Entry<String, FieldValue>> {

    private final LinkedHashMap<String, FieldValue> values;

    /**
     * Creates an empty RowValue
     */
    public RowValue() {
        super();
        values = new LinkedHashMap<String, FieldValue>();
    }

    /**
     * Creates an empty RowValue with the specified number of fields
     *
     * @param size the initial capacity
     */
    public RowValue(int size) {
        super();
        values = new LinkedHashMap<String, FieldValue>(size);
    }

    @Override
    public Type getType() {
        return Type.ROW;
    }

    @Override
    public Iterator<Map.Entry<String, FieldValue>> iterator() {
        return Collections.unmodifiableMap(values).entrySet().iterator();
    }

    /**
     * Returns the number of fields
     *
     * @return the number of fields
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns the field values, in order.
     *
     * @return a new list of the values
     */
    public List<FieldValue> values() {
        return new ArrayList<FieldValue>(values.values());
    }

    /**
     * Returns the field value with the specified name.
     *
     * @param name the name of the field
     *
     * @return the field value, or null if there is no such field
     */
    public FieldValue get(String name) {
        requireNonNull(name, "RowValue.get: name must be non-null");
        return values.get(name);
    }

    /**
     * Returns the field value at the specified position.
     *
     * @param index the position
     *
     * @return the field value
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public FieldValue get(int index) {
        if (index < 0 || index >= values.size()) {
            throw new IndexOutOfBoundsException(
                "RowValue.get: index " + index + ", size " + values.size());
        }
        Iterator<FieldValue> iter = values.values().iterator();
        for (int i = 0; i < index; i++) {
            iter.next();
        }
        return iter.next();
    }

    public boolean contains(String name) {
        requireNonNull(name, "RowValue.contains: name must be non-null");
        return values.containsKey(name);
    }

    /**
     * Sets the named field.
     *
     * @param name the name of the field
     * @param value the value
     *
     * @return this
     */
    public RowValue put(String name, FieldValue value) {
        validateName(name, value);
        values.put(name, value);
        return this;
    }

    public RowValue put(String name, long value) {
        return put(name, new LongValue(value));
    }

    public RowValue put(String name, String value) {
        return put(name, new StringValue(value));
    }

    public RowValue put(String name, boolean value) {
        return put(name, BooleanValue.getInstance(value));
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof RowValue)) {
            return false;
        }
        RowValue o = (RowValue) other;
        if (values.size() != o.values.size()) {
            return false;
        }
        Iterator<Map.Entry<String, FieldValue>> iter =
            o.values.entrySet().iterator();
        for (Map.Entry<String, FieldValue> entry : values.entrySet()) {
            if (!entry.equals(iter.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }
}
