/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

/**
 * A FieldValue instance representing a 64-bit signed integer, the decoded
 * form of the INTEGER family of server types.
 */
public class LongValue extends FieldValue {

    private final long value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public LongValue(long value) {
        super();
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.INTEGER;
    }

    /**
     * Returns the long value of this object
     *
     * @return the long value
     */
    public long getValue() {
        return value;
    }

    @Override
    public String toJson() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof LongValue) {
            return value == ((LongValue)other).value;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return ((Long) value).hashCode();
    }
}
