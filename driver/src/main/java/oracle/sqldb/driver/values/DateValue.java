/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.time.LocalDate;

import oracle.sqldb.driver.util.TemporalUtil;

/**
 * A FieldValue instance representing a calendar date in the proleptic
 * Gregorian calendar. Years in the BC era are stored as proleptic years, so
 * 44 BC is year -43.
 */
public class DateValue extends FieldValue {

    private final LocalDate value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public DateValue(LocalDate value) {
        super();
        requireNonNull(value, "DateValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.DATE;
    }

    /**
     * Returns the value of this object
     *
     * @return the value
     */
    public LocalDate getValue() {
        return value;
    }

    /**
     * Returns the value in the server's text format.
     *
     * @return the formatted value
     */
    public String formatValue() {
        return TemporalUtil.formatDate(value);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof DateValue) {
            return value.equals(((DateValue)other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
