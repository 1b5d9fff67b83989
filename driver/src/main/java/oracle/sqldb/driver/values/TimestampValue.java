/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.time.LocalDateTime;

import oracle.sqldb.driver.util.TemporalUtil;

/**
 * A FieldValue instance representing a date and time of day without zone.
 */
public class TimestampValue extends FieldValue {

    private final LocalDateTime value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public TimestampValue(LocalDateTime value) {
        super();
        requireNonNull(value, "TimestampValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.TIMESTAMP;
    }

    /**
     * Returns the value of this object
     *
     * @return the value
     */
    public LocalDateTime getValue() {
        return value;
    }

    /**
     * Returns the value in the server's text format.
     *
     * @return the formatted value
     */
    public String formatValue() {
        return TemporalUtil.formatTimestamp(value);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof TimestampValue) {
            return value.equals(((TimestampValue)other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
