/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.time.LocalTime;

import oracle.sqldb.driver.util.TemporalUtil;

/**
 * A FieldValue instance representing a time of day without zone.
 */
public class TimeValue extends FieldValue {

    private final LocalTime value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public TimeValue(LocalTime value) {
        super();
        requireNonNull(value, "TimeValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.TIME;
    }

    /**
     * Returns the value of this object
     *
     * @return the value
     */
    public LocalTime getValue() {
        return value;
    }

    /**
     * Returns the value in the server's text format.
     *
     * @return the formatted value
     */
    public String formatValue() {
        return TemporalUtil.formatTime(value);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof TimeValue) {
            return value.equals(((TimeValue)other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
