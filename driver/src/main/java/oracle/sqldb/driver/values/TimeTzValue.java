/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.time.OffsetTime;

import oracle.sqldb.driver.util.TemporalUtil;

/**
 * A FieldValue instance representing a time of day with a UTC offset. Two
 * instances are equal only if both the local time and the offset are equal.
 */
public class TimeTzValue extends FieldValue {

    private final OffsetTime value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public TimeTzValue(OffsetTime value) {
        super();
        requireNonNull(value, "TimeTzValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.TIMETZ;
    }

    /**
     * Returns the value of this object
     *
     * @return the value
     */
    public OffsetTime getValue() {
        return value;
    }

    /**
     * Returns the value in the server's text format.
     *
     * @return the formatted value
     */
    public String formatValue() {
        return TemporalUtil.formatTimeTz(value);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof TimeTzValue) {
            return value.equals(((TimeTzValue)other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
