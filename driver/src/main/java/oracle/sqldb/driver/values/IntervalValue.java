/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import java.time.Duration;
import java.time.Period;

/**
 * A FieldValue instance representing an interval. An interval has signed
 * year, month, day, hour, minute, second and microsecond components.
 * <p>
 * Year-month intervals only use years and months; day-time intervals only
 * use the remaining components. The server never mixes the two families in
 * one value, and the factories {@link #ofMonths} and {@link #ofMicros}
 * produce normalized values: every non-zero component has the same sign,
 * months are in the range -11..11, hours -23..23 and so on. Day-time
 * overflow carries into days, never into months, because the number of days
 * in a month is not fixed.
 * <p>
 * Equality is component-wise, so a non-normalized instance created with
 * {@link #of} is not equal to its normalized form.
 */
public class IntervalValue extends FieldValue {

    public static final long MICROS_PER_SECOND = 1_000_000L;
    public static final long MICROS_PER_MINUTE = 60 * MICROS_PER_SECOND;
    public static final long MICROS_PER_HOUR = 60 * MICROS_PER_MINUTE;
    public static final long MICROS_PER_DAY = 24 * MICROS_PER_HOUR;

    private final long years;
    private final long months;
    private final long days;
    private final long hours;
    private final long minutes;
    private final long seconds;
    private final long micros;

    private IntervalValue(long years, long months, long days, long hours,
                          long minutes, long seconds, long micros) {
        super();
        this.years = years;
        this.months = months;
        this.days = days;
        this.hours = hours;
        this.minutes = minutes;
        this.seconds = seconds;
        this.micros = micros;
    }

    /**
     * Creates an interval from its components, as given.
     *
     * @param years the years
     * @param months the months
     * @param days the days
     * @param hours the hours
     * @param minutes the minutes
     * @param seconds the seconds
     * @param micros the microseconds
     *
     * @return the interval
     */
    public static IntervalValue of(long years, long months, long days,
                                   long hours, long minutes, long seconds,
                                   long micros) {
        return new IntervalValue(years, months, days, hours, minutes,
                                 seconds, micros);
    }

    /**
     * Creates a normalized year-month interval.
     *
     * @param totalMonths the signed number of months
     *
     * @return the interval
     */
    public static IntervalValue ofMonths(long totalMonths) {
        return new IntervalValue(totalMonths / 12, totalMonths % 12,
                                 0, 0, 0, 0, 0);
    }

    /**
     * Creates a normalized day-time interval.
     *
     * @param totalMicros the signed number of microseconds
     *
     * @return the interval
     */
    public static IntervalValue ofMicros(long totalMicros) {
        long rem = totalMicros;
        long d = rem / MICROS_PER_DAY;
        rem %= MICROS_PER_DAY;
        long h = rem / MICROS_PER_HOUR;
        rem %= MICROS_PER_HOUR;
        long m = rem / MICROS_PER_MINUTE;
        rem %= MICROS_PER_MINUTE;
        long s = rem / MICROS_PER_SECOND;
        rem %= MICROS_PER_SECOND;
        return new IntervalValue(0, 0, d, h, m, s, rem);
    }

    @Override
    public Type getType() {
        return Type.INTERVAL;
    }

    public long getYears() {
        return years;
    }

    public long getMonths() {
        return months;
    }

    public long getDays() {
        return days;
    }

    public long getHours() {
        return hours;
    }

    public long getMinutes() {
        return minutes;
    }

    public long getSeconds() {
        return seconds;
    }

    public long getMicros() {
        return micros;
    }

    /**
     * Returns years and months as a number of months.
     *
     * @return the total months
     *
     * @throws ArithmeticException if the result overflows a long
     */
    public long getTotalMonths() {
        return Math.addExact(Math.multiplyExact(years, 12L), months);
    }

    /**
     * Returns the day-time components as a number of microseconds, counting
     * a day as 24 hours.
     *
     * @return the total microseconds
     *
     * @throws ArithmeticException if the result overflows a long
     */
    public long getTotalMicros() {
        long total = Math.multiplyExact(days, MICROS_PER_DAY);
        total = Math.addExact(total, Math.multiplyExact(hours,
                                                        MICROS_PER_HOUR));
        total = Math.addExact(total, Math.multiplyExact(minutes,
                                                        MICROS_PER_MINUTE));
        total = Math.addExact(total, Math.multiplyExact(seconds,
                                                        MICROS_PER_SECOND));
        return Math.addExact(total, micros);
    }

    /**
     * @return true if no day-time component is set
     */
    public boolean isYearMonth() {
        return days == 0 && hours == 0 && minutes == 0 && seconds == 0 &&
            micros == 0;
    }

    /**
     * @return true if neither years nor months are set
     */
    public boolean isDayTime() {
        return years == 0 && months == 0;
    }

    /**
     * Returns the years, months and days as a Period.
     *
     * @return the period
     *
     * @throws ArithmeticException if a component does not fit an int
     */
    public Period toPeriod() {
        return Period.of(Math.toIntExact(years), Math.toIntExact(months),
                         Math.toIntExact(days));
    }

    /**
     * Returns the day-time components as a Duration, counting a day as 24
     * hours. Years and months are not included.
     *
     * @return the duration
     */
    public Duration toDuration() {
        return Duration.ofDays(days)
            .plusHours(hours)
            .plusMinutes(minutes)
            .plusSeconds(seconds)
            .plusNanos(micros * 1000);
    }

    /**
     * Returns the ISO-8601 representation, for example "P1Y10M" or
     * "P1DT2H3M4.0005S". A zero interval is "PT0S".
     *
     * @return the ISO-8601 string
     */
    public String toIsoString() {
        StringBuilder sb = new StringBuilder("P");
        appendUnit(sb, years, 'Y');
        appendUnit(sb, months, 'M');
        appendUnit(sb, days, 'D');
        if (hours != 0 || minutes != 0 || seconds != 0 || micros != 0) {
            sb.append('T');
            appendUnit(sb, hours, 'H');
            appendUnit(sb, minutes, 'M');
            if (seconds != 0 || micros != 0) {
                if ((seconds < 0 || micros < 0) && seconds == 0) {
                    sb.append('-');
                }
                sb.append(seconds);
                if (micros != 0) {
                    String frac = Long.toString(1_000_000L + Math.abs(micros))
                        .substring(1);
                    int end = frac.length();
                    while (frac.charAt(end - 1) == '0') {
                        end--;
                    }
                    sb.append('.').append(frac, 0, end);
                }
                sb.append('S');
            }
        }
        if (sb.length() == 1) {
            sb.append("T0S");
        }
        return sb.toString();
    }

    private static void appendUnit(StringBuilder sb, long value, char unit) {
        if (value != 0) {
            sb.append(value).append(unit);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof IntervalValue)) {
            return false;
        }
        IntervalValue o = (IntervalValue) other;
        return years == o.years && months == o.months && days == o.days &&
            hours == o.hours && minutes == o.minutes &&
            seconds == o.seconds && micros == o.micros;
    }

    @Override
    public int hashCode() {
        long h = years;
        h = 31 * h + months;
        h = 31 * h + days;
        h = 31 * h + hours;
        h = 31 * h + minutes;
        h = 31 * h + seconds;
        h = 31 * h + micros;
        return Long.hashCode(h);
    }
}
