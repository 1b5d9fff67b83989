/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.codec;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import oracle.sqldb.driver.CodecTestBase;
import oracle.sqldb.driver.EncodingTypeMismatchException;
import oracle.sqldb.driver.ValueFormatException;
import oracle.sqldb.driver.ValueOverflowException;
import oracle.sqldb.driver.types.IntervalRange;
import oracle.sqldb.driver.values.IntervalValue;

import org.junit.Test;

/**
 * Tests parsing and formatting of interval text for each field range.
 */
public class IntervalCodecTest extends CodecTestBase {

    /**
     * Day-time forms with a day component.
     */
    @Test
    public void testDayToSecond() {
        assertInterval(IntervalValue.of(0, 0, 1, 2, 3, 4, 500),
                       "1 02:03:04.0005", IntervalRange.DAY_TO_SECOND);
        assertInterval(IntervalValue.of(0, 0, 0, 2, 3, 0, 0),
                       "02:03", IntervalRange.DAY_TO_SECOND);
        assertInterval(IntervalValue.of(0, 0, 1, 2, 0, 0, 0),
                       "1 02", IntervalRange.DAY_TO_SECOND);
        assertInterval(IntervalValue.of(0, 0, 3, 0, 0, 0, 0),
                       "3", IntervalRange.DAY_TO_SECOND);
        assertInterval(IntervalValue.of(0, 0, -1, -2, -3, -4, 0),
                       "-1 02:03:04", IntervalRange.DAY_TO_SECOND);
        /* a sign on the time group applies to that group only */
        assertInterval(IntervalValue.of(0, 0, 0, 21, 57, 0, 0),
                       "1 -02:03", IntervalRange.DAY_TO_SECOND);
    }

    /**
     * A bare number counts units of the start field.
     */
    @Test
    public void testBareNumbers() {
        assertInterval(IntervalValue.of(0, 0, 6, 0, 0, 0, 0),
                       "6", IntervalRange.DAY_TO_HOUR);
        assertInterval(IntervalValue.of(0, 0, 1, 8, 0, 0, 0),
                       "32", IntervalRange.HOUR);
        assertInterval(IntervalValue.of(0, 0, 0, 0, -34, 0, 0),
                       "-34", IntervalRange.MINUTE);
        assertInterval(IntervalValue.of(0, 0, 2, 12, 15, 1, 24000),
                       "216901.024", IntervalRange.SECOND);
        /* finer than the end field is dropped */
        assertInterval(IntervalValue.of(0, 0, 0, 1, 0, 0, 0),
                       "1.75", IntervalRange.HOUR);
        assertInterval(IntervalValue.of(0, 0, 0, 1, 45, 0, 0),
                       "1.75", IntervalRange.HOUR_TO_MINUTE);
    }

    /**
     * Colon forms in ranges that do not start at DAY.
     */
    @Test
    public void testColonForms() {
        assertInterval(IntervalValue.of(0, 0, 0, 2, 3, 0, 0),
                       "02:03:04", IntervalRange.HOUR_TO_MINUTE);
        assertInterval(IntervalValue.of(0, 0, 0, -2, -3, 0, 0),
                       "-02:03", IntervalRange.HOUR_TO_MINUTE);
        assertInterval(IntervalValue.of(0, 0, 0, 0, 0, 4, 500),
                       "00:04.0005", IntervalRange.MINUTE_TO_SECOND);
        assertInterval(IntervalValue.of(0, 0, 0, 0, 3, 4, 0),
                       "03:04", IntervalRange.MINUTE_TO_SECOND);
        assertInterval(IntervalValue.of(0, 0, 1, 1, 0, 0, 0),
                       "25:00", IntervalRange.HOUR_TO_MINUTE);
        assertInterval(IntervalValue.of(0, 0, 1, 2, 0, 0, 0),
                       "1 02:03", IntervalRange.DAY_TO_HOUR);
    }

    /**
     * Year-month forms.
     */
    @Test
    public void testYearMonth() {
        assertInterval(IntervalValue.of(1, 10, 0, 0, 0, 0, 0),
                       "1y 10m", IntervalRange.YEAR_TO_MONTH);
        assertInterval(IntervalValue.of(0, -10, 0, 0, 0, 0, 0),
                       "10m ago", IntervalRange.YEAR_TO_MONTH);
        assertInterval(IntervalValue.of(-1, 0, 0, 0, 0, 0, 0),
                       "1y ago", IntervalRange.YEAR);
        assertInterval(IntervalValue.of(1, 10, 0, 0, 0, 0, 0),
                       "1y 10m", IntervalRange.MONTH);
        assertInterval(IntervalValue.of(1, 0, 0, 0, 0, 0, 0),
                       "1y 10m", IntervalRange.YEAR);
        assertInterval(IntervalValue.of(2, 3, 0, 0, 0, 0, 0),
                       "2 years 3 months", IntervalRange.YEAR_TO_MONTH);
        assertInterval(IntervalValue.of(-1, -2, 0, 0, 0, 0, 0),
                       "-1-2", IntervalRange.YEAR_TO_MONTH);
        assertInterval(IntervalValue.of(1, 2, 0, 0, 0, 0, 0),
                       "14", IntervalRange.MONTH);
        assertInterval(IntervalValue.of(14, 0, 0, 0, 0, 0, 0),
                       "14", IntervalRange.YEAR_TO_MONTH);
    }

    /**
     * A leading minus and "ago" negate once, a later sign only its
     * component.
     */
    @Test
    public void testSigns() {
        assertInterval(IntervalValue.of(-1, -2, 0, 0, 0, 0, 0),
                       "-1y 2m", IntervalRange.YEAR_TO_MONTH);
        assertInterval(IntervalValue.of(0, 10, 0, 0, 0, 0, 0),
                       "1y -2m", IntervalRange.YEAR_TO_MONTH);
        assertInterval(IntervalValue.of(-1, 0, 0, 0, 0, 0, 0),
                       "-1y ago", IntervalRange.YEAR_TO_MONTH);
        assertInterval(IntervalValue.of(0, -10, 0, 0, 0, 0, 0),
                       "1y -2m ago", IntervalRange.YEAR_TO_MONTH);
    }

    /**
     * Malformed text and out of range values.
     */
    @Test
    public void testInvalid() {
        expectInvalid("", IntervalRange.DAY_TO_SECOND);
        expectInvalid("abc", IntervalRange.DAY_TO_SECOND);
        expectInvalid("1 02:03", IntervalRange.HOUR_TO_MINUTE);
        expectInvalid("01:02", IntervalRange.SECOND);
        expectInvalid("02:60", IntervalRange.HOUR_TO_MINUTE);
        expectInvalid("02:03.5", IntervalRange.HOUR_TO_MINUTE);
        expectInvalid("1 day", IntervalRange.DAY_TO_SECOND);
        expectInvalid("2 weeks", IntervalRange.YEAR_TO_MONTH);
        expectInvalid("1-12", IntervalRange.YEAR_TO_MONTH);
        expectInvalid("ago", IntervalRange.YEAR);
        expectInvalid("1 ago", IntervalRange.DAY_TO_SECOND);

        try {
            IntervalCodec.parse("99999999999999999999",
                                IntervalRange.DAY_TO_SECOND);
            fail("Expected ValueOverflowException");
        } catch (ValueOverflowException voe) {
            assertEquals("INTERVAL DAY TO SECOND", voe.getTypeName());
        }
        try {
            IntervalCodec.parse("999999999999999999y",
                                IntervalRange.YEAR_TO_MONTH);
            fail("Expected ValueOverflowException");
        } catch (ValueOverflowException voe) {
            assertEquals("INTERVAL YEAR TO MONTH", voe.getTypeName());
        }
    }

    /**
     * Formatting for each range start.
     */
    @Test
    public void testFormat() {
        IntervalValue v = IntervalValue.of(0, 0, 1, 2, 3, 4, 500);
        assertEquals("1 02:03:04.0005",
                     IntervalCodec.format(v, IntervalRange.DAY_TO_SECOND));
        assertEquals("26:03:04.0005",
                     IntervalCodec.format(v, IntervalRange.HOUR_TO_SECOND));
        assertEquals("1563:04.0005",
                     IntervalCodec.format(v, IntervalRange.MINUTE_TO_SECOND));
        assertEquals("93784.0005",
                     IntervalCodec.format(v, IntervalRange.SECOND));
        assertEquals("-1 02:03", IntervalCodec.format(
                         IntervalValue.of(0, 0, -1, -2, -3, 0, 0),
                         IntervalRange.DAY_TO_MINUTE));
        assertEquals("6", IntervalCodec.format(
                         IntervalValue.of(0, 0, 6, 0, 0, 0, 0),
                         IntervalRange.DAY));

        IntervalValue ym = IntervalValue.ofMonths(-22);
        assertEquals("-1-10",
                     IntervalCodec.format(ym, IntervalRange.YEAR_TO_MONTH));
        assertEquals("-22", IntervalCodec.format(ym, IntervalRange.MONTH));
        assertEquals("3", IntervalCodec.format(IntervalValue.ofMonths(36),
                                               IntervalRange.YEAR));

        expectMismatch(ym, IntervalRange.YEAR);
        expectMismatch(ym, IntervalRange.DAY_TO_SECOND);
        expectMismatch(v, IntervalRange.YEAR_TO_MONTH);
        expectMismatch(v, IntervalRange.DAY_TO_MINUTE);
    }

    /**
     * Formatted text parses back to the normalized value.
     */
    @Test
    public void testFormatParse() {
        IntervalValue[] dayTime = {
            IntervalValue.ofMicros(0),
            IntervalValue.of(0, 0, 1, 2, 3, 4, 500),
            IntervalValue.of(0, 0, -3, -23, -59, -59, -999999),
            IntervalValue.of(0, 0, 0, 0, 0, 7, 1)
        };
        for (IntervalValue v : dayTime) {
            for (IntervalRange r : new IntervalRange[] {
                    IntervalRange.DAY_TO_SECOND, IntervalRange.HOUR_TO_SECOND,
                    IntervalRange.MINUTE_TO_SECOND, IntervalRange.SECOND}) {
                assertEquals(v, IntervalCodec.parse(
                                 IntervalCodec.format(v, r), r));
            }
        }
        IntervalValue ym = IntervalValue.ofMonths(-27);
        for (IntervalRange r : new IntervalRange[] {
                IntervalRange.YEAR_TO_MONTH, IntervalRange.MONTH}) {
            assertEquals(ym, IntervalCodec.parse(
                             IntervalCodec.format(ym, r), r));
        }
    }

    private static void assertInterval(IntervalValue expected,
                                       String text,
                                       IntervalRange range) {
        assertEquals(text + " as " + range, expected,
                     IntervalCodec.parse(text, range));
    }

    private static void expectInvalid(String text, IntervalRange range) {
        try {
            IntervalValue v = IntervalCodec.parse(text, range);
            fail("Expected ValueFormatException for '" + text + "' as " +
                 range + ", got " + v);
        } catch (ValueFormatException vfe) {
            assertEquals("INTERVAL " + range.getTypeName(),
                         vfe.getTypeName());
        }
    }

    private static void expectMismatch(IntervalValue v, IntervalRange range) {
        try {
            String s = IntervalCodec.format(v, range);
            fail("Expected EncodingTypeMismatchException for " + v + " as " +
                 range + ", got " + s);
        } catch (EncodingTypeMismatchException etme) {
            /* success */
        }
    }
}
