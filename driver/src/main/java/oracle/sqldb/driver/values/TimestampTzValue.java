/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.time.OffsetDateTime;

import oracle.sqldb.driver.util.TemporalUtil;

/**
 * A FieldValue instance representing a date and time of day with a UTC
 * offset. The offset is the one the value was decoded with, normally that of
 * the session time zone; equality compares both the local date-time and the
 * offset.
 */
public class TimestampTzValue extends FieldValue {

    private final OffsetDateTime value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public TimestampTzValue(OffsetDateTime value) {
        super();
        requireNonNull(value, "TimestampTzValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.TIMESTAMPTZ;
    }

    /**
     * Returns the value of this object
     *
     * @return the value
     */
    public OffsetDateTime getValue() {
        return value;
    }

    /**
     * Returns the value in the server's text format.
     *
     * @return the formatted value
     */
    public String formatValue() {
        return TemporalUtil.formatTimestampTz(value);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof TimestampTzValue) {
            return value.equals(((TimestampTzValue)other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
