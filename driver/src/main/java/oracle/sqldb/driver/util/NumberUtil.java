/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.util;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * @hidden
 * Parsing of the numeric text forms sent by the server.
 * <p>
 * Malformed text raises IllegalArgumentException; text that is well formed
 * but out of the range of the target representation raises
 * ArithmeticException.
 */
public class NumberUtil {

    private static final BigInteger LONG_MIN =
        BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX =
        BigInteger.valueOf(Long.MAX_VALUE);

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

    private static final Pattern FLOAT = Pattern.compile(
        "[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    /**
     * Parses a base-10 integer with an optional sign.
     *
     * @param text the text
     * @return the value
     *
     * @throws ArithmeticException if the value does not fit a long
     */
    public static long parseLong(String text) {
        requireNonNull(text, "Integer string must be non-null");
        if (!INTEGER.matcher(text).matches()) {
            throw new IllegalArgumentException(
                "Invalid integer: '" + text + "'");
        }
        BigInteger val = new BigInteger(text);
        if (val.compareTo(LONG_MIN) < 0 || val.compareTo(LONG_MAX) > 0) {
            throw new ArithmeticException(
                "Integer out of 64-bit range: " + text);
        }
        return val.longValue();
    }

    /**
     * Parses a floating point number. Besides decimal and scientific
     * notation this accepts Infinity, Inf and NaN, with an optional sign and
     * in any case.
     *
     * @param text the text
     * @return the value
     */
    public static double parseDouble(String text) {
        requireNonNull(text, "Float string must be non-null");
        String lower = text.toLowerCase(Locale.ROOT);
        switch (lower) {
        case "nan":
        case "+nan":
        case "-nan":
            return Double.NaN;
        case "infinity":
        case "+infinity":
        case "inf":
        case "+inf":
            return Double.POSITIVE_INFINITY;
        case "-infinity":
        case "-inf":
            return Double.NEGATIVE_INFINITY;
        default:
            break;
        }
        if (!FLOAT.matcher(text).matches()) {
            throw new IllegalArgumentException(
                "Invalid floating point number: '" + text + "'");
        }
        return Double.parseDouble(text);
    }

    /**
     * Parses a decimal number without going through binary floating point.
     * The scale of the result is the number of fraction digits minus the
     * exponent, so "1.50" has scale 2 and "1.5E3" has scale -2.
     *
     * @param text the text
     * @return the value
     *
     * @throws ArithmeticException if the scale does not fit an int
     */
    public static BigDecimal parseDecimal(String text) {
        requireNonNull(text, "Decimal string must be non-null");
        int len = text.length();
        int i = 0;
        boolean negative = false;
        if (i < len && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
            negative = text.charAt(i) == '-';
            i++;
        }
        StringBuilder digits = new StringBuilder(len);
        int intStart = i;
        while (i < len && isDigit(text.charAt(i))) {
            digits.append(text.charAt(i++));
        }
        int intDigits = i - intStart;
        int fracDigits = 0;
        if (i < len && text.charAt(i) == '.') {
            i++;
            int fracStart = i;
            while (i < len && isDigit(text.charAt(i))) {
                digits.append(text.charAt(i++));
            }
            fracDigits = i - fracStart;
        }
        if (intDigits + fracDigits == 0) {
            throw new IllegalArgumentException(
                "Invalid decimal: '" + text + "': no digits");
        }
        long exponent = 0;
        if (i < len && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            i++;
            String exp = text.substring(i);
            if (!INTEGER.matcher(exp).matches()) {
                throw new IllegalArgumentException(
                    "Invalid decimal: '" + text + "': bad exponent");
            }
            BigInteger e = new BigInteger(exp);
            if (e.bitLength() > 31) {
                throw new ArithmeticException(
                    "Decimal exponent out of range: " + text);
            }
            exponent = e.longValue();
            i = len;
        }
        if (i != len) {
            throw new IllegalArgumentException(
                "Invalid decimal: '" + text + "': unexpected character '" +
                text.charAt(i) + "'");
        }
        long scale = fracDigits - exponent;
        if (scale < Integer.MIN_VALUE || scale > Integer.MAX_VALUE) {
            throw new ArithmeticException(
                "Decimal scale out of range: " + text);
        }
        BigInteger unscaled = new BigInteger(digits.toString());
        if (negative) {
            unscaled = unscaled.negate();
        }
        return new BigDecimal(unscaled, (int) scale);
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
