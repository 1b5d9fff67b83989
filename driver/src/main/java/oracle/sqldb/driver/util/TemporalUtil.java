/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.util;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import oracle.sqldb.driver.ValueFormatException;

/**
 * @hidden
 * Utility methods to parse/format dates, times and timestamps from/to the
 * text form used by the server.
 * <p>
 * The text form is "Y-MM-DD[ HH:MM:SS[.f]][offset][ BC]" where the year has
 * any number of digits, 'T' may be used in place of the space, the
 * fractional second has up to 9 digits and the offset is either numeric
 * (+HH, +HHMM, +HH:MM, +HH:MM:SS, +HHMMSS), "Z", or a region name separated
 * from the time by whitespace. Years in the BC era are written as positive
 * years followed by " BC"; year 1 BC is proleptic year 0.
 * <p>
 * All parse methods throw IllegalArgumentException on malformed input.
 */
public class TemporalUtil {

    /* The maximum number of digits in fractional second */
    private final static int MAX_NUMBER_FRACSEC = 9;

    /* The maximum number of digits in the year component */
    private final static int MAX_NUMBER_YEAR = 9;

    private final static String BC_SUFFIX = " BC";

    /*
     * The name of components.
     */
    private final static String compNames[] = {
        "year", "month", "day", "hour", "minute", "second", "fractional second"
    };

    /**
     * Parses a date string.
     *
     * @param text the string value
     * @return the date
     */
    public static LocalDate parseDate(String text) {
        requireNonNull(text, "Date string must be non-null");
        Parsed p = new Parsed(text);
        p.parseDate();
        p.requireEnd();
        return p.toDate();
    }

    /**
     * Parses a time string "HH:MM[:SS[.f]]".
     *
     * @param text the string value
     * @return the time
     */
    public static LocalTime parseTime(String text) {
        requireNonNull(text, "Time string must be non-null");
        Parsed p = new Parsed(text);
        if (p.bc) {
            raiseParseError(text, "BC is not allowed in a time value");
        }
        p.parseTime();
        p.requireEnd();
        return p.toTime();
    }

    /**
     * Parses a timestamp string without zone. A missing time part means
     * midnight.
     *
     * @param text the string value
     * @return the timestamp
     */
    public static LocalDateTime parseTimestamp(String text) {
        requireNonNull(text, "Timestamp string must be non-null");
        Parsed p = new Parsed(text);
        p.parseDate();
        if (!p.atEnd()) {
            p.parseDateTimeSeparator();
            p.parseTime();
        }
        p.requireEnd();
        return LocalDateTime.of(p.toDate(), p.toTime());
    }

    /**
     * Parses a time string with an optional zone. A time without zone takes
     * the offset of the session zone. A region name is resolved at the
     * optional leading date, or at the current date.
     *
     * @param text the string value
     * @param sessionZone the zone used when the text has none
     * @return the time with offset
     */
    public static OffsetTime parseTimeTz(String text, ZoneId sessionZone) {
        requireNonNull(text, "Time string must be non-null");
        requireNonNull(sessionZone, "Session zone must be non-null");
        Parsed p = new Parsed(text);
        LocalDate date = null;
        if (p.startsWithDate()) {
            p.parseDate();
            p.parseDateTimeSeparator();
            date = p.toDate();
        } else if (p.bc) {
            raiseParseError(text, "BC is not allowed in a time value");
        }
        p.parseTime();
        LocalTime time = p.toTime();
        String zone = p.rest();
        ZoneId zoneId = (zone.isEmpty() ? sessionZone : parseZoneSuffix(text,
                                                                       zone));
        if (zoneId instanceof ZoneOffset) {
            return OffsetTime.of(time, (ZoneOffset) zoneId);
        }
        if (date == null) {
            date = LocalDate.now(zoneId);
        }
        ZoneOffset offset =
            zoneId.getRules().getOffset(LocalDateTime.of(date, time));
        return OffsetTime.of(time, offset);
    }

    /**
     * Parses a timestamp string with an optional zone. A timestamp without
     * zone is interpreted in the session zone.
     *
     * @param text the string value
     * @param sessionZone the zone used when the text has none
     * @return the timestamp with offset
     */
    public static OffsetDateTime parseTimestampTz(String text,
                                                  ZoneId sessionZone) {
        requireNonNull(text, "Timestamp string must be non-null");
        requireNonNull(sessionZone, "Session zone must be non-null");
        Parsed p = new Parsed(text);
        p.parseDate();
        if (!p.atEnd() && !p.atZoneStart()) {
            p.parseDateTimeSeparator();
            p.parseTime();
        }
        LocalDateTime ldt = LocalDateTime.of(p.toDate(), p.toTime());
        String zone = p.rest();
        ZoneId zoneId = (zone.isEmpty() ? sessionZone : parseZoneSuffix(text,
                                                                       zone));
        if (zoneId instanceof ZoneOffset) {
            return OffsetDateTime.of(ldt, (ZoneOffset) zoneId);
        }
        try {
            return ZonedDateTime.ofLocal(ldt, zoneId, null).toOffsetDateTime();
        } catch (DateTimeException dte) {
            throw new IllegalArgumentException(
                "Failed to resolve zone of '" + text + "': " +
                dte.getMessage(), dte);
        }
    }

    /**
     * Resolves a timezone setting as reported by the server: a region name
     * (matched case-insensitively), "UTC", "GMT+3" or a numeric offset.
     *
     * @param name the timezone name
     * @return the zone
     *
     * @throws ValueFormatException if the name is not a known zone
     */
    public static ZoneId parseZone(String name) {
        requireNonNull(name, "Zone name must be non-null");
        try {
            return resolveZone(name.trim());
        } catch (IllegalArgumentException iae) {
            throw new ValueFormatException(
                "Unknown time zone: " + iae.getMessage(), "TIMEZONE", name,
                iae);
        }
    }

    /**
     * Parses a numeric offset: +HH, +HHMM, +HH:MM, +HH:MM:SS or +HHMMSS.
     *
     * @param text the offset
     * @return the offset
     */
    public static ZoneOffset parseOffset(String text) {
        requireNonNull(text, "Offset string must be non-null");
        int len = text.length();
        if (len < 2 || (text.charAt(0) != '+' && text.charAt(0) != '-')) {
            throw new IllegalArgumentException(
                "Invalid offset '" + text + "': must start with a sign");
        }
        boolean negative = text.charAt(0) == '-';

        int[] comps = new int[3];
        int comp = 0;
        int i = 1;
        while (i < len) {
            if (comp > 2) {
                throw new IllegalArgumentException(
                    "Invalid offset '" + text + "': too many components");
            }
            int start = i;
            while (i < len && isDigit(text.charAt(i)) && i - start < 2) {
                i++;
            }
            if (i == start) {
                throw new IllegalArgumentException(
                    "Invalid offset '" + text + "': expected digits at " + i);
            }
            comps[comp++] = Integer.parseInt(text.substring(start, i));
            if (i < len && text.charAt(i) == ':') {
                i++;
                if (i == len) {
                    throw new IllegalArgumentException(
                        "Invalid offset '" + text + "': trailing ':'");
                }
            } else if (i < len && !isDigit(text.charAt(i))) {
                throw new IllegalArgumentException(
                    "Invalid offset '" + text + "': unexpected character '" +
                    text.charAt(i) + "'");
            }
        }
        try {
            if (negative) {
                return ZoneOffset.ofHoursMinutesSeconds(
                    -comps[0], -comps[1], -comps[2]);
            }
            return ZoneOffset.ofHoursMinutesSeconds(
                comps[0], comps[1], comps[2]);
        } catch (DateTimeException dte) {
            throw new IllegalArgumentException(
                "Invalid offset '" + text + "': " + dte.getMessage(), dte);
        }
    }

    /**
     * Formats a date as "YYYY-MM-DD[ BC]".
     *
     * @param date the date
     * @return the string
     */
    public static String formatDate(LocalDate date) {
        requireNonNull(date, "Date must be non-null");
        StringBuilder sb = new StringBuilder();
        appendDate(sb, date);
        appendEra(sb, date.getYear());
        return sb.toString();
    }

    /**
     * Formats a time as "HH:MM:SS[.f]" with trailing zeros of the fractional
     * second removed.
     *
     * @param time the time
     * @return the string
     */
    public static String formatTime(LocalTime time) {
        requireNonNull(time, "Time must be non-null");
        StringBuilder sb = new StringBuilder();
        appendTime(sb, time);
        return sb.toString();
    }

    public static String formatTimestamp(LocalDateTime ts) {
        requireNonNull(ts, "Timestamp must be non-null");
        StringBuilder sb = new StringBuilder();
        appendDate(sb, ts.toLocalDate());
        sb.append(' ');
        appendTime(sb, ts.toLocalTime());
        appendEra(sb, ts.getYear());
        return sb.toString();
    }

    public static String formatTimeTz(OffsetTime time) {
        requireNonNull(time, "Time must be non-null");
        StringBuilder sb = new StringBuilder();
        appendTime(sb, time.toLocalTime());
        sb.append(formatOffset(time.getOffset()));
        return sb.toString();
    }

    public static String formatTimestampTz(OffsetDateTime ts) {
        requireNonNull(ts, "Timestamp must be non-null");
        StringBuilder sb = new StringBuilder();
        appendDate(sb, ts.toLocalDate());
        sb.append(' ');
        appendTime(sb, ts.toLocalTime());
        sb.append(formatOffset(ts.getOffset()));
        appendEra(sb, ts.getYear());
        return sb.toString();
    }

    /**
     * Formats an offset as "+HH:MM", or "+HH:MM:SS" when it has seconds.
     *
     * @param offset the offset
     * @return the string
     */
    public static String formatOffset(ZoneOffset offset) {
        requireNonNull(offset, "Offset must be non-null");
        int total = offset.getTotalSeconds();
        int abs = Math.abs(total);
        StringBuilder sb = new StringBuilder();
        sb.append(total < 0 ? '-' : '+');
        appendPadded(sb, abs / 3600, 2);
        sb.append(':');
        appendPadded(sb, (abs / 60) % 60, 2);
        if (abs % 60 != 0) {
            sb.append(':');
            appendPadded(sb, abs % 60, 2);
        }
        return sb.toString();
    }

    private static void appendDate(StringBuilder sb, LocalDate date) {
        int year = date.getYear();
        appendPadded(sb, (year <= 0 ? 1 - year : year), 4);
        sb.append('-');
        appendPadded(sb, date.getMonthValue(), 2);
        sb.append('-');
        appendPadded(sb, date.getDayOfMonth(), 2);
    }

    private static void appendTime(StringBuilder sb, LocalTime time) {
        appendPadded(sb, time.getHour(), 2);
        sb.append(':');
        appendPadded(sb, time.getMinute(), 2);
        sb.append(':');
        appendPadded(sb, time.getSecond(), 2);
        int nanos = time.getNano();
        if (nanos != 0) {
            StringBuilder frac = new StringBuilder();
            appendPadded(frac, nanos, MAX_NUMBER_FRACSEC);
            int end = frac.length();
            while (frac.charAt(end - 1) == '0') {
                end--;
            }
            sb.append('.').append(frac, 0, end);
        }
    }

    private static void appendEra(StringBuilder sb, int year) {
        if (year <= 0) {
            sb.append(BC_SUFFIX);
        }
    }

    private static void appendPadded(StringBuilder sb, int value, int width) {
        String s = Integer.toString(value);
        for (int i = s.length(); i < width; i++) {
            sb.append('0');
        }
        sb.append(s);
    }

    private static ZoneId parseZoneSuffix(String text, String zone) {
        char first = zone.charAt(0);
        if (first == '+' || first == '-') {
            return parseOffset(zone);
        }
        if (zone.equals("Z") || zone.equals("z")) {
            return ZoneOffset.UTC;
        }
        if (!Character.isWhitespace(first)) {
            raiseParseError(text, "unexpected text '" + zone +
                            "' after the time");
        }
        return resolveZone(zone.trim());
    }

    private static ZoneId resolveZone(String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("empty zone name");
        }
        char first = name.charAt(0);
        if (first == '+' || first == '-') {
            return parseOffset(name);
        }
        if (name.equalsIgnoreCase("Z")) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(name);
        } catch (DateTimeException dte) {
            for (String id : ZoneId.getAvailableZoneIds()) {
                if (id.equalsIgnoreCase(name)) {
                    return ZoneId.of(id);
                }
            }
            throw new IllegalArgumentException(
                "'" + name + "': " + dte.getMessage(), dte);
        }
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static void raiseParseError(String text, String err) {
        throw new IllegalArgumentException(
            "Failed to parse the temporal string '" + text + "': " + err);
    }

    /*
     * Parse state for one temporal string. Components are indexed from 0 to
     * 6 mapping to year, month, day, hour, minute, second and nanosecond.
     */
    private static final class Parsed {
        private final String source;
        private final String text;
        private final boolean bc;
        private final int[] comps = new int[7];
        private int pos;

        Parsed(String source) {
            this.source = source;
            String t = source.trim();
            if (t.length() > BC_SUFFIX.length() &&
                t.regionMatches(true, t.length() - BC_SUFFIX.length(),
                                BC_SUFFIX, 0, BC_SUFFIX.length())) {
                bc = true;
                t = t.substring(0, t.length() - BC_SUFFIX.length());
            } else {
                bc = false;
            }
            if (t.isEmpty()) {
                raiseParseError(source, "empty value");
            }
            text = t;
            comps[1] = 1;
            comps[2] = 1;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        boolean atZoneStart() {
            char ch = text.charAt(pos);
            return ch == '+' || ch == '-' || ch == 'Z' || ch == 'z';
        }

        boolean startsWithDate() {
            int i = 0;
            while (i < text.length() && isDigit(text.charAt(i))) {
                i++;
            }
            return i > 0 && i < text.length() && text.charAt(i) == '-';
        }

        String rest() {
            return text.substring(pos);
        }

        void requireEnd() {
            if (!atEnd()) {
                raiseParseError(source, "unexpected text '" + rest() + "'");
            }
        }

        void parseDate() {
            comps[0] = parseComponent(0, 1, MAX_NUMBER_YEAR);
            expect('-', 0);
            comps[1] = parseComponent(1, 1, 2);
            expect('-', 1);
            comps[2] = parseComponent(2, 1, 2);
        }

        void parseDateTimeSeparator() {
            if (atEnd()) {
                raiseParseError(source, "missing time component");
            }
            char ch = text.charAt(pos);
            if (ch != ' ' && ch != 'T' && ch != 't') {
                raiseParseError(source, "invalid character '" + ch +
                                "' between date and time");
            }
            pos++;
        }

        void parseTime() {
            comps[3] = parseComponent(3, 1, 2);
            expect(':', 3);
            comps[4] = parseComponent(4, 2, 2);
            if (!atEnd() && text.charAt(pos) == ':') {
                pos++;
                comps[5] = parseComponent(5, 2, 2);
                if (!atEnd() && text.charAt(pos) == '.') {
                    pos++;
                    int start = pos;
                    int nanos = parseComponent(6, 1, MAX_NUMBER_FRACSEC);
                    for (int n = pos - start; n < MAX_NUMBER_FRACSEC; n++) {
                        nanos *= 10;
                    }
                    comps[6] = nanos;
                }
            }
        }

        LocalDate toDate() {
            int year = bc ? 1 - comps[0] : comps[0];
            if (bc && comps[0] == 0) {
                raiseParseError(source, "there is no year 0 BC");
            }
            try {
                return LocalDate.of(year, comps[1], comps[2]);
            } catch (DateTimeException dte) {
                throw new IllegalArgumentException(
                    "Invalid date '" + source + "': " + dte.getMessage(), dte);
            }
        }

        LocalTime toTime() {
            try {
                return LocalTime.of(comps[3], comps[4], comps[5], comps[6]);
            } catch (DateTimeException dte) {
                throw new IllegalArgumentException(
                    "Invalid time '" + source + "': " + dte.getMessage(), dte);
            }
        }

        private void expect(char sep, int comp) {
            if (atEnd() || text.charAt(pos) != sep) {
                raiseParseError(source, "expected '" + sep + "' after " +
                                compNames[comp]);
            }
            pos++;
        }

        private int parseComponent(int comp, int minDigits, int maxDigits) {
            int start = pos;
            long val = 0;
            while (pos < text.length() && isDigit(text.charAt(pos))) {
                val = val * 10 + (text.charAt(pos) - '0');
                pos++;
                if (pos - start > maxDigits) {
                    raiseParseError(source, "component " + compNames[comp] +
                                    " has more than " + maxDigits +
                                    " digits");
                }
            }
            if (pos - start < minDigits) {
                raiseParseError(source, "component " + compNames[comp] +
                                (pos == start ? " is missing" :
                                 " has too few digits"));
            }
            return (int) val;
        }
    }
}
