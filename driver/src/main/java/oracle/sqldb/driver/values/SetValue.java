/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * SetValue represents a collection of distinct {@link FieldValue}
 * instances. Membership uses value equality, so adding a value equal to one
 * already present has no effect and the set holds at most one
 * {@link NullValue}. Iteration follows insertion order.
 */
public class SetValue extends FieldValue implements Iterable<FieldValue> {

    private final LinkedHashSet<FieldValue> values;

    public SetValue() {
        super();
        values = new LinkedHashSet<FieldValue>();
    }

    @Override
    public Type getType() {
        return Type.SET;
    }

    public int size() {
        return values.size();
    }

    public boolean contains(FieldValue value) {
        requireNonNull(value, "SetValue.contains: value must be non-null");
        return values.contains(value);
    }

    /**
     * Adds a value unless an equal value is already present.
     *
     * @param value the value to add
     *
     * @return this
     */
    public SetValue add(FieldValue value) {
        requireNonNull(value, "SetValue.add: value must be non-null");
        values.add(value);
        return this;
    }

    public SetValue add(long value) {
        return add(new LongValue(value));
    }

    public SetValue add(String value) {
        return add(new StringValue(value));
    }

    @Override
    public Iterator<FieldValue> iterator() {
        return Collections.unmodifiableSet(values).iterator();
    }

    /**
     * Two sets are equal if they have the same members, regardless of
     * order.
     */
    @Override
    public boolean equals(Object other) {
        if (other instanceof SetValue) {
            return values.equals(((SetValue)other).values);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }
}
