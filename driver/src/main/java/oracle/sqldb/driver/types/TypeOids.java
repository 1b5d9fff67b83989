/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.types;

import oracle.sqldb.driver.UnsupportedTypeException;

/**
 * Maps the scalar type oids and type modifiers reported in column metadata
 * to {@link TypeDescriptor} instances. Container columns are described by
 * composing the descriptors of their elements and fields with
 * {@link TypeDescriptor#arrayOf}, {@link TypeDescriptor#setOf} and
 * {@link TypeDescriptor#row}.
 * <p>
 * A type modifier of -1 means that the column has no modifier.
 */
public class TypeOids {

    public static final int BOOL = 5;
    public static final int INT8 = 6;
    public static final int FLOAT8 = 7;
    public static final int CHAR = 8;
    public static final int VARCHAR = 9;
    public static final int DATE = 10;
    public static final int TIME = 11;
    public static final int TIMESTAMP = 12;
    public static final int TIMESTAMPTZ = 13;
    public static final int INTERVAL = 14;
    public static final int TIMETZ = 15;
    public static final int NUMERIC = 16;
    public static final int VARBINARY = 17;
    public static final int UUID = 20;
    public static final int INTERVALYM = 114;
    public static final int LONGVARCHAR = 115;
    public static final int LONGVARBINARY = 116;
    public static final int BINARY = 117;

    /* length modifiers carry a 4 byte header */
    private static final int VARHDRSZ = 4;

    /*
     * Interval field masks, as found in the upper 16 bits of an interval
     * type modifier.
     */
    private static final int MASK_MONTH = 1 << 1;
    private static final int MASK_YEAR = 1 << 2;
    private static final int MASK_DAY = 1 << 3;
    private static final int MASK_HOUR = 1 << 10;
    private static final int MASK_MINUTE = 1 << 11;
    private static final int MASK_SECOND = 1 << 12;

    /* Precision value meaning "unspecified" in an interval modifier */
    private static final int INTERVAL_FULL_PRECISION = 0xFFFF;

    /**
     * Returns the descriptor for a scalar column.
     *
     * @param oid the type oid
     * @param typmod the type modifier, or -1
     * @return the descriptor
     *
     * @throws UnsupportedTypeException if the oid is unknown or the
     * modifier is invalid for the type
     */
    public static TypeDescriptor toDescriptor(int oid, int typmod) {
        switch (oid) {
        case BOOL:
            return TypeDescriptor.booleanType();
        case INT8:
            return TypeDescriptor.integerType();
        case FLOAT8:
            return TypeDescriptor.floatType();
        case NUMERIC:
            if (typmod < VARHDRSZ) {
                return TypeDescriptor.decimalType();
            }
            return TypeDescriptor.decimalType(
                ((typmod - VARHDRSZ) >> 16) & 0xFFFF,
                (typmod - VARHDRSZ) & 0xFF);
        case CHAR:
            return TypeDescriptor.charType(length(typmod));
        case VARCHAR:
        case LONGVARCHAR:
            return TypeDescriptor.varcharType(length(typmod));
        case BINARY:
            return TypeDescriptor.binaryType(length(typmod));
        case VARBINARY:
        case LONGVARBINARY:
            return TypeDescriptor.varbinaryType(length(typmod));
        case UUID:
            return TypeDescriptor.uuidType();
        case DATE:
            return TypeDescriptor.dateType();
        case TIME:
            return TypeDescriptor.timeType(timePrecision(typmod));
        case TIMETZ:
            return TypeDescriptor.timeTzType(timePrecision(typmod));
        case TIMESTAMP:
            return TypeDescriptor.timestampType(timePrecision(typmod));
        case TIMESTAMPTZ:
            return TypeDescriptor.timestampTzType(timePrecision(typmod));
        case INTERVAL:
            return interval(typmod, IntervalRange.DAY_TO_SECOND);
        case INTERVALYM:
            return interval(typmod, IntervalRange.YEAR_TO_MONTH);
        default:
            throw new UnsupportedTypeException(
                "Unsupported type oid " + oid, "oid " + oid);
        }
    }

    /**
     * Returns the interval range encoded in an interval type modifier.
     *
     * @param typmod the type modifier
     * @return the range, or null if the modifier is -1
     *
     * @throws UnsupportedTypeException if the mask is not a valid range
     */
    public static IntervalRange intervalRange(int typmod) {
        if (typmod < 0) {
            return null;
        }
        int mask = typmod >>> 16;
        IntervalUnit start = null;
        IntervalUnit end = null;
        int[] masks = {MASK_YEAR, MASK_MONTH, MASK_DAY, MASK_HOUR,
                       MASK_MINUTE, MASK_SECOND};
        IntervalUnit[] units = IntervalUnit.values();
        for (int i = 0; i < masks.length; i++) {
            if ((mask & masks[i]) != 0) {
                if (start == null) {
                    start = units[i];
                }
                end = units[i];
            }
        }
        if (start == null) {
            throw new UnsupportedTypeException(
                "Invalid interval type modifier " + typmod, "INTERVAL");
        }
        return IntervalRange.of(start, end);
    }

    private static TypeDescriptor interval(int typmod,
                                           IntervalRange defaultRange) {
        if (typmod < 0) {
            return TypeDescriptor.intervalType(defaultRange);
        }
        int precision = typmod & 0xFFFF;
        return TypeDescriptor.intervalType(
            intervalRange(typmod),
            (precision == INTERVAL_FULL_PRECISION ? -1 : precision));
    }

    private static int length(int typmod) {
        return (typmod < VARHDRSZ ? -1 : typmod - VARHDRSZ);
    }

    private static int timePrecision(int typmod) {
        return (typmod < 0 ? -1 : typmod);
    }
}
