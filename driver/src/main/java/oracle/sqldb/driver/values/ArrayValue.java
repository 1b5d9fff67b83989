/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * ArrayValue represents an ordered list of {@link FieldValue} instances.
 * Elements may be of any type including {@link NullValue} and other
 * containers. An empty ArrayValue is distinct from {@link NullValue}.
 */
public class ArrayValue extends FieldValue implements Iterable<FieldValue> {

    private final ArrayList<FieldValue> array;

    /**
     * Creates an empty ArrayValue
     */
    public ArrayValue() {
        super();
        array = new ArrayList<FieldValue>();
    }

    /**
     * Creates an empty ArrayValue with the specified size
     *
     * @param size the initial capacity of the array
     */
    public ArrayValue(int size) {
        super();
        array = new ArrayList<FieldValue>(size);
    }

    @Override
    public Type getType() {
        return Type.ARRAY;
    }

    /**
     * Returns the size of the array
     *
     * @return the size
     */
    public int size() {
        return array.size();
    }

    /**
     * Returns the element at the specified index.
     *
     * @param index the index of the value to return
     *
     * @return the value at the index
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public FieldValue get(int index) {
        return array.get(index);
    }

    /**
     * Adds a new value at the end of the array
     *
     * @param value the value to add
     *
     * @return this
     */
    public ArrayValue add(FieldValue value) {
        requireNonNull(value, "ArrayValue.add: value must be non-null");
        array.add(value);
        return this;
    }

    /**
     * Adds all of the values in the Stream to the end of the array in the
     * order they are returned by the stream.
     *
     * @param stream the stream of values to add
     *
     * @return this
     */
    public ArrayValue addAll(Stream<? extends FieldValue> stream) {
        requireNonNull(stream, "ArrayValue.addAll: stream must be non-null");
        stream.forEachOrdered(v -> add(v));
        return this;
    }

    public ArrayValue add(long value) {
        return add(new LongValue(value));
    }

    public ArrayValue add(double value) {
        return add(new DoubleValue(value));
    }

    public ArrayValue add(BigDecimal value) {
        return add(new NumberValue(value));
    }

    public ArrayValue add(String value) {
        return add(new StringValue(value));
    }

    public ArrayValue add(boolean value) {
        return add(BooleanValue.getInstance(value));
    }

    /**
     * Adds a SQL NULL element.
     *
     * @return this
     */
    public ArrayValue addNull() {
        return add(NullValue.getInstance());
    }

    @Override
    public Iterator<FieldValue> iterator() {
        return Collections.unmodifiableList(array).iterator();
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof ArrayValue) {
            return array.equals(((ArrayValue)other).array);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return array.hashCode();
    }
}
