/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.codec;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;
import static oracle.sqldb.driver.values.IntervalValue.MICROS_PER_DAY;
import static oracle.sqldb.driver.values.IntervalValue.MICROS_PER_HOUR;
import static oracle.sqldb.driver.values.IntervalValue.MICROS_PER_MINUTE;
import static oracle.sqldb.driver.values.IntervalValue.MICROS_PER_SECOND;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import oracle.sqldb.driver.EncodingTypeMismatchException;
import oracle.sqldb.driver.ValueFormatException;
import oracle.sqldb.driver.ValueOverflowException;
import oracle.sqldb.driver.types.IntervalRange;
import oracle.sqldb.driver.types.IntervalUnit;
import oracle.sqldb.driver.values.IntervalValue;

/**
 * Parses and formats interval text for each of the interval field ranges.
 * <p>
 * Year-month ranges accept "Ny", "Ny Nm", "Nm" (also with the unit words
 * year, years, mon, mons, month, months), the SQL standard form "Y-M" and a
 * bare integer. A trailing "ago" negates the interval.
 * <p>
 * Day-time ranges accept "D HH:MM:SS.ffffff", "D HH:MM:SS", "D HH:MM",
 * "D HH", "HH:MM:SS.ffffff", "HH:MM:SS", "HH:MM" ("MM:SS" when the range
 * starts at MINUTE) and a bare, possibly fractional, number. A day component
 * is only accepted when the range starts at DAY.
 * <p>
 * A bare number counts units of the range's start field; the result is
 * normalized, so 32 under INTERVAL HOUR is 1 day 8 hours. Components finer
 * than the range's end field are dropped.
 * <p>
 * A leading "-" negates the whole interval. A sign on a later component
 * applies to that component only, and "ago" has no further effect on an
 * interval that is already negated by a leading "-".
 */
public class IntervalCodec {

    private static final Pattern YM_STANDARD =
        Pattern.compile("([+-])?(\\d+)-(\\d+)");

    private static final Pattern BARE_INTEGER = Pattern.compile("[+-]?\\d+");

    private static final Pattern YM_COMPONENT =
        Pattern.compile("([+-])?(\\d+)\\s*([A-Za-z]+)");

    private static final Pattern BARE_NUMBER =
        Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    private static final Pattern DAY_FORM =
        Pattern.compile("(\\d+)\\s+([+-])?(\\d+(?::\\d+)*(?:\\.\\d+)?)");

    private static final Pattern TIME_FORM =
        Pattern.compile("(\\d+)(?::(\\d+))?(?::(\\d+))?(?:\\.(\\d+))?");

    private static final String AGO = "ago";

    /* number of fraction digits kept, microseconds */
    private static final int FRACTION_DIGITS = 6;

    /**
     * Parses interval text.
     *
     * @param text the text
     * @param range the field range of the interval type
     * @return the normalized interval
     *
     * @throws ValueFormatException if the text is not a valid interval for
     * the range
     * @throws ValueOverflowException if the interval does not fit the
     * value representation
     */
    public static IntervalValue parse(String text, IntervalRange range) {
        requireNonNull(text, "IntervalCodec.parse: text must be non-null");
        requireNonNull(range, "IntervalCodec.parse: range must be non-null");
        String t = text.trim();
        if (t.isEmpty()) {
            throw formatError("empty interval", text, range);
        }
        try {
            return range.isYearMonth() ? parseYearMonth(t, text, range) :
                parseDayTime(t, text, range);
        } catch (ArithmeticException ae) {
            throw new ValueOverflowException(
                "Interval out of range: " + ae.getMessage(), typeName(range),
                text, ae);
        }
    }

    /**
     * Formats an interval as text that {@link #parse} reads back to the
     * same normalized value.
     *
     * @param value the interval
     * @param range the field range of the target type
     * @return the text
     *
     * @throws EncodingTypeMismatchException if the interval has components
     * the range cannot represent
     */
    public static String format(IntervalValue value, IntervalRange range) {
        requireNonNull(value, "IntervalCodec.format: value must be non-null");
        requireNonNull(range, "IntervalCodec.format: range must be non-null");
        try {
            return range.isYearMonth() ? formatYearMonth(value, range) :
                formatDayTime(value, range);
        } catch (ArithmeticException ae) {
            throw new ValueOverflowException(
                "Interval out of range: " + ae.getMessage(), typeName(range),
                value.toIsoString(), ae);
        }
    }

    private static IntervalValue parseYearMonth(String t,
                                                String text,
                                                IntervalRange range) {
        String body = t;
        boolean ago = false;
        if (body.toLowerCase(Locale.ROOT).endsWith(AGO)) {
            ago = true;
            body = body.substring(0, body.length() - AGO.length()).trim();
            if (body.isEmpty()) {
                throw formatError("missing value before 'ago'", text, range);
            }
        }

        long years = 0;
        long months = 0;
        boolean leadingMinus = body.startsWith("-");

        Matcher m = YM_STANDARD.matcher(body);
        if (m.matches()) {
            years = parseDigits(m.group(2));
            months = parseDigits(m.group(3));
            if (months > 11) {
                throw formatError("month field out of range", text, range);
            }
            if (leadingMinus) {
                years = -years;
                months = -months;
            }
        } else if (BARE_INTEGER.matcher(body).matches()) {
            long n = parseSigned(body);
            if (range.getStart() == IntervalUnit.YEAR) {
                years = n;
            } else {
                months = n;
            }
        } else {
            Matcher c = YM_COMPONENT.matcher(body);
            int pos = 0;
            int len = body.length();
            boolean first = true;
            while (pos < len) {
                if (Character.isWhitespace(body.charAt(pos))) {
                    pos++;
                    continue;
                }
                if (!c.find(pos) || c.start() != pos) {
                    throw formatError("unexpected text '" +
                                      body.substring(pos) + "'", text, range);
                }
                String sign = c.group(1);
                long v = parseDigits(c.group(2));
                if ("-".equals(sign) || (sign == null && leadingMinus)) {
                    v = -v;
                } else if (first && "+".equals(sign)) {
                    leadingMinus = false;
                }
                String unit = c.group(3).toLowerCase(Locale.ROOT);
                switch (unit) {
                case "y":
                case "yr":
                case "yrs":
                case "year":
                case "years":
                    years = Math.addExact(years, v);
                    break;
                case "m":
                case "mon":
                case "mons":
                case "month":
                case "months":
                    months = Math.addExact(months, v);
                    break;
                default:
                    throw formatError("unknown unit '" + c.group(3) + "'",
                                      text, range);
                }
                first = false;
                pos = c.end();
            }
        }

        long total = Math.addExact(Math.multiplyExact(years, 12L), months);
        if (range.getEnd() == IntervalUnit.YEAR) {
            total = (total / 12) * 12;
        }
        if (ago && !leadingMinus) {
            total = Math.negateExact(total);
        }
        return IntervalValue.ofMonths(total);
    }

    private static IntervalValue parseDayTime(String t,
                                              String text,
                                              IntervalRange range) {
        String body = t;
        boolean negative = false;
        if (body.startsWith("-") || body.startsWith("+")) {
            negative = body.charAt(0) == '-';
            body = body.substring(1);
        }

        long total;
        if (BARE_NUMBER.matcher(body).matches()) {
            BigDecimal micros = new BigDecimal(body).multiply(
                BigDecimal.valueOf(unitMicros(range.getStart())));
            total = micros.setScale(0, RoundingMode.DOWN).longValueExact();
            total = truncate(total, range.getEnd());
        } else {
            Matcher day = DAY_FORM.matcher(body);
            long dayMicros = 0;
            long timeMicros;
            if (day.matches()) {
                if (range.getStart() != IntervalUnit.DAY) {
                    throw formatError("a day component is not allowed",
                                      text, range);
                }
                dayMicros = Math.multiplyExact(parseDigits(day.group(1)),
                                               MICROS_PER_DAY);
                timeMicros = parseTimeGroup(day.group(3), true, text, range);
                if ("-".equals(day.group(2))) {
                    timeMicros = -timeMicros;
                }
            } else {
                timeMicros = parseTimeGroup(body, false, text, range);
            }
            total = Math.addExact(dayMicros, timeMicros);
        }
        if (negative) {
            total = Math.negateExact(total);
        }
        return IntervalValue.ofMicros(total);
    }

    /*
     * Returns the unsigned magnitude of a colon separated time group,
     * truncated to the end field of the range.
     */
    private static long parseTimeGroup(String group,
                                       boolean afterDay,
                                       String text,
                                       IntervalRange range) {
        Matcher tm = TIME_FORM.matcher(group);
        if (!tm.matches()) {
            throw formatError("invalid time component '" + group + "'",
                              text, range);
        }
        String g1 = tm.group(1);
        String g2 = tm.group(2);
        String g3 = tm.group(3);
        String frac = tm.group(4);

        long hours = 0;
        long minutes = 0;
        long seconds = 0;
        if (g2 == null) {
            if (!afterDay || frac != null) {
                throw formatError("invalid time component '" + group + "'",
                                  text, range);
            }
            hours = parseDigits(g1);
        } else {
            if (!afterDay && range.getStart() == IntervalUnit.SECOND) {
                throw formatError("colon form not allowed", text, range);
            }
            if (g3 != null) {
                hours = parseDigits(g1);
                minutes = checkSexagesimal(parseDigits(g2), text, range);
                seconds = checkSexagesimal(parseDigits(g3), text, range);
            } else if (!afterDay &&
                       range.getStart() == IntervalUnit.MINUTE) {
                minutes = parseDigits(g1);
                seconds = checkSexagesimal(parseDigits(g2), text, range);
            } else {
                if (frac != null) {
                    throw formatError("fraction only allowed on seconds",
                                      text, range);
                }
                hours = parseDigits(g1);
                minutes = checkSexagesimal(parseDigits(g2), text, range);
            }
        }

        long total = Math.multiplyExact(hours, MICROS_PER_HOUR);
        total = Math.addExact(total,
                              Math.multiplyExact(minutes, MICROS_PER_MINUTE));
        total = Math.addExact(total,
                              Math.multiplyExact(seconds, MICROS_PER_SECOND));
        if (frac != null) {
            total = Math.addExact(total, fractionMicros(frac));
        }
        return truncate(total, range.getEnd());
    }

    private static String formatYearMonth(IntervalValue value,
                                          IntervalRange range) {
        if (!value.isYearMonth()) {
            throw mismatch("day-time components", value, range);
        }
        long total = value.getTotalMonths();
        long abs = Math.abs(total);
        if (total == Long.MIN_VALUE) {
            throw new ArithmeticException("long overflow");
        }
        StringBuilder sb = new StringBuilder();
        if (total < 0) {
            sb.append('-');
        }
        switch (range) {
        case YEAR:
            if (abs % 12 != 0) {
                throw mismatch("a month component", value, range);
            }
            sb.append(abs / 12);
            break;
        case MONTH:
            sb.append(abs);
            break;
        default:
            sb.append(abs / 12).append('-').append(abs % 12);
        }
        return sb.toString();
    }

    private static String formatDayTime(IntervalValue value,
                                        IntervalRange range) {
        if (!value.isDayTime()) {
            throw mismatch("year-month components", value, range);
        }
        long total = value.getTotalMicros();
        if (total != truncate(total, range.getEnd())) {
            throw mismatch("components finer than " + range.getEnd(), value,
                           range);
        }
        long abs = Math.abs(total);
        if (total == Long.MIN_VALUE) {
            throw new ArithmeticException("long overflow");
        }
        IntervalUnit end = range.getEnd();
        StringBuilder sb = new StringBuilder();
        if (total < 0) {
            sb.append('-');
        }
        switch (range.getStart()) {
        case DAY:
            sb.append(abs / MICROS_PER_DAY);
            if (end != IntervalUnit.DAY) {
                long rem = abs % MICROS_PER_DAY;
                sb.append(' ');
                appendTwo(sb, rem / MICROS_PER_HOUR);
                appendMinutesSeconds(sb, rem % MICROS_PER_HOUR, end);
            }
            break;
        case HOUR:
            sb.append(abs / MICROS_PER_HOUR);
            appendMinutesSeconds(sb, abs % MICROS_PER_HOUR, end);
            break;
        case MINUTE:
            sb.append(abs / MICROS_PER_MINUTE);
            if (end == IntervalUnit.SECOND) {
                sb.append(':');
                appendTwo(sb, (abs % MICROS_PER_MINUTE) / MICROS_PER_SECOND);
                appendFraction(sb, abs % MICROS_PER_SECOND);
            }
            break;
        default:
            sb.append(abs / MICROS_PER_SECOND);
            appendFraction(sb, abs % MICROS_PER_SECOND);
        }
        return sb.toString();
    }

    /* appends ":MM[:SS[.f]]" for the part of an hour */
    private static void appendMinutesSeconds(StringBuilder sb,
                                             long micros,
                                             IntervalUnit end) {
        if (end == IntervalUnit.MINUTE || end == IntervalUnit.SECOND) {
            sb.append(':');
            appendTwo(sb, micros / MICROS_PER_MINUTE);
            if (end == IntervalUnit.SECOND) {
                sb.append(':');
                appendTwo(sb, (micros % MICROS_PER_MINUTE) /
                          MICROS_PER_SECOND);
                appendFraction(sb, micros % MICROS_PER_SECOND);
            }
        }
    }

    private static void appendTwo(StringBuilder sb, long value) {
        if (value < 10) {
            sb.append('0');
        }
        sb.append(value);
    }

    private static void appendFraction(StringBuilder sb, long micros) {
        if (micros == 0) {
            return;
        }
        String frac = Long.toString(MICROS_PER_SECOND + micros).substring(1);
        int end = frac.length();
        while (frac.charAt(end - 1) == '0') {
            end--;
        }
        sb.append('.').append(frac, 0, end);
    }

    private static long unitMicros(IntervalUnit unit) {
        switch (unit) {
        case DAY:
            return MICROS_PER_DAY;
        case HOUR:
            return MICROS_PER_HOUR;
        case MINUTE:
            return MICROS_PER_MINUTE;
        default:
            return MICROS_PER_SECOND;
        }
    }

    /* drops the components finer than the end field */
    private static long truncate(long micros, IntervalUnit end) {
        if (end == IntervalUnit.SECOND) {
            return micros;
        }
        return micros - micros % unitMicros(end);
    }

    private static long fractionMicros(String digits) {
        StringBuilder sb = new StringBuilder(FRACTION_DIGITS);
        for (int i = 0; i < FRACTION_DIGITS; i++) {
            sb.append(i < digits.length() ? digits.charAt(i) : '0');
        }
        return Long.parseLong(sb.toString());
    }

    private static long checkSexagesimal(long value,
                                         String text,
                                         IntervalRange range) {
        if (value > 59) {
            throw formatError("minute or second field " + value +
                              " out of range", text, range);
        }
        return value;
    }

    private static long parseDigits(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException nfe) {
            throw new ArithmeticException("'" + digits + "' overflows");
        }
    }

    private static long parseSigned(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException nfe) {
            throw new ArithmeticException("'" + text + "' overflows");
        }
    }

    private static String typeName(IntervalRange range) {
        return "INTERVAL " + range.getTypeName();
    }

    private static ValueFormatException formatError(String msg,
                                                    String text,
                                                    IntervalRange range) {
        return new ValueFormatException(
            "Invalid interval '" + text + "' for " + typeName(range) + ": " +
            msg, typeName(range), text);
    }

    private static EncodingTypeMismatchException mismatch(
        String what, IntervalValue value, IntervalRange range) {
        return new EncodingTypeMismatchException(
            "Interval with " + what + " cannot be encoded as " +
            typeName(range), typeName(range), value.toIsoString());
    }
}
