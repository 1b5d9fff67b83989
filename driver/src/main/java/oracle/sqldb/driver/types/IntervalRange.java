/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.types;

import oracle.sqldb.driver.UnsupportedTypeException;

/**
 * The field range of an INTERVAL type. Only these 13 ranges exist; the
 * first three are year-month ranges, the others day-time ranges.
 */
public enum IntervalRange {
    YEAR(IntervalUnit.YEAR, IntervalUnit.YEAR),
    YEAR_TO_MONTH(IntervalUnit.YEAR, IntervalUnit.MONTH),
    MONTH(IntervalUnit.MONTH, IntervalUnit.MONTH),
    DAY(IntervalUnit.DAY, IntervalUnit.DAY),
    DAY_TO_HOUR(IntervalUnit.DAY, IntervalUnit.HOUR),
    DAY_TO_MINUTE(IntervalUnit.DAY, IntervalUnit.MINUTE),
    DAY_TO_SECOND(IntervalUnit.DAY, IntervalUnit.SECOND),
    HOUR(IntervalUnit.HOUR, IntervalUnit.HOUR),
    HOUR_TO_MINUTE(IntervalUnit.HOUR, IntervalUnit.MINUTE),
    HOUR_TO_SECOND(IntervalUnit.HOUR, IntervalUnit.SECOND),
    MINUTE(IntervalUnit.MINUTE, IntervalUnit.MINUTE),
    MINUTE_TO_SECOND(IntervalUnit.MINUTE, IntervalUnit.SECOND),
    SECOND(IntervalUnit.SECOND, IntervalUnit.SECOND);

    private final IntervalUnit start;
    private final IntervalUnit end;

    private IntervalRange(IntervalUnit start, IntervalUnit end) {
        this.start = start;
        this.end = end;
    }

    public IntervalUnit getStart() {
        return start;
    }

    public IntervalUnit getEnd() {
        return end;
    }

    public boolean isYearMonth() {
        return start.isYearMonth();
    }

    /**
     * Returns true if the unit lies between the start and end field,
     * inclusive.
     *
     * @param unit the unit
     * @return true if the range contains the unit
     */
    public boolean contains(IntervalUnit unit) {
        return !start.isFinerThan(unit) && !unit.isFinerThan(end);
    }

    /**
     * Returns the SQL spelling, e.g. "DAY TO SECOND".
     *
     * @return the range name
     */
    public String getTypeName() {
        if (start == end) {
            return start.name();
        }
        return start.name() + " TO " + end.name();
    }

    /**
     * Returns the range with the given start and end field.
     *
     * @param start the start field
     * @param end the end field, the same as start for single field ranges
     * @return the range
     *
     * @throws UnsupportedTypeException if no such range exists
     */
    public static IntervalRange of(IntervalUnit start, IntervalUnit end) {
        for (IntervalRange range : values()) {
            if (range.start == start && range.end == end) {
                return range;
            }
        }
        throw new UnsupportedTypeException(
            "Invalid interval range: " + start + " TO " + end,
            "INTERVAL " + start + " TO " + end);
    }
}
