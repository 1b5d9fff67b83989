/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.types;

/**
 * The fields of an interval, from coarsest to finest.
 */
public enum IntervalUnit {
    YEAR,
    MONTH,
    DAY,
    HOUR,
    MINUTE,
    SECOND;

    /**
     * @return true for YEAR and MONTH
     */
    public boolean isYearMonth() {
        return this == YEAR || this == MONTH;
    }

    /**
     * @param other another unit
     * @return true if this unit is finer than the other
     */
    public boolean isFinerThan(IntervalUnit other) {
        return ordinal() > other.ordinal();
    }
}
