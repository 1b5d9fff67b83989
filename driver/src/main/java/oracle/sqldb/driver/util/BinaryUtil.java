/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.util;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * @hidden
 * Conversions between byte arrays and the textual forms used for BINARY and
 * VARBINARY values: the backslash-escaped wire text sent by the server and
 * the hex digits used in HEX_TO_BINARY() literals.
 */
public class BinaryUtil {

    /*
     * Symbols used to converting hex string
     */
    private static final String HEX = "0123456789abcdef";

    /**
     * Convert a hex string to byte array. An optional "0x" prefix is
     * skipped, upper and lower case digits are accepted. An odd number of
     * digits is treated as having a leading zero.
     *
     * @param hexString the string
     * @return the bytes
     *
     * @throws IllegalArgumentException if the string holds a non-hex
     * character
     */
    public static byte[] convertHexToBytes(String hexString) {
        requireNonNull(hexString, "convertHexToBytes: string must be non-null");

        String hex = hexString;
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        if (hex.length() % 2 != 0) {
            hex = "0" + hex;
        }

        final byte[] result = new byte[hex.length()/2];

        final int n = hex.length();

        for (int i = 0; i < n; i += 2) {
            /* high bits */
            final int hb = hexDigit(hex.charAt(i), hexString);
            /* low bits */
            final int lb = hexDigit(hex.charAt(i + 1), hexString);
            result[i/2] = (byte)((hb << 4 ) | lb);
        }
        return result;
    }

    /**
     * Convert a byte array to a lowercase hex string
     * @param byteArray the bytes
     * @return the string
     */
    public static String convertBytesToHex(byte[] byteArray) {
        requireNonNull(byteArray, "convertBytesToHex: bytes must be non-null");

        final char[] hexValue = new char[byteArray.length * 2];

        final char[] hexSymbols = HEX.toCharArray();

        for (int i = 0; i < byteArray.length; i++) {
            final int current = byteArray[i] & 0xff;
            /* determine the Hex symbol for the last 4 bits */
            hexValue[i*2 + 1] = hexSymbols[current & 0x0f];
            /* determine the Hex symbol for the first 4 bits */
            hexValue[i*2] = hexSymbols[current >> 4];
        }
        return new String(hexValue);
    }

    /**
     * Decodes the escaped text form of a binary value. Printable characters
     * stand for their own UTF-8 bytes; a backslash introduces either another
     * backslash, three octal digits, or 'x' followed by two hex digits.
     *
     * @param text the escaped text
     * @return the bytes
     *
     * @throws IllegalArgumentException if an escape sequence is malformed
     */
    public static byte[] unescapeBinary(String text) {
        requireNonNull(text, "unescapeBinary: text must be non-null");

        ByteArrayOutputStream out = new ByteArrayOutputStream(text.length());
        int len = text.length();
        int i = 0;
        while (i < len) {
            char ch = text.charAt(i);
            if (ch != '\\') {
                int end = i + 1;
                while (end < len && text.charAt(end) != '\\') {
                    end++;
                }
                byte[] plain = text.substring(i, end)
                    .getBytes(StandardCharsets.UTF_8);
                out.write(plain, 0, plain.length);
                i = end;
                continue;
            }
            if (i + 1 >= len) {
                throw new IllegalArgumentException(
                    "dangling backslash at the end of binary text");
            }
            char next = text.charAt(i + 1);
            if (next == '\\') {
                out.write('\\');
                i += 2;
            } else if (next == 'x' || next == 'X') {
                if (i + 3 >= len) {
                    throw new IllegalArgumentException(
                        "incomplete hex escape at offset " + i);
                }
                int hb = hexDigit(text.charAt(i + 2), text);
                int lb = hexDigit(text.charAt(i + 3), text);
                out.write((hb << 4) | lb);
                i += 4;
            } else if (isOctal(next)) {
                if (i + 3 >= len || !isOctal(text.charAt(i + 2)) ||
                    !isOctal(text.charAt(i + 3))) {
                    throw new IllegalArgumentException(
                        "incomplete octal escape at offset " + i);
                }
                int val = ((next - '0') << 6) |
                    ((text.charAt(i + 2) - '0') << 3) |
                    (text.charAt(i + 3) - '0');
                if (val > 0xff) {
                    throw new IllegalArgumentException(
                        "octal escape out of range at offset " + i);
                }
                out.write(val);
                i += 4;
            } else {
                throw new IllegalArgumentException(
                    "invalid escape '\\" + next + "' at offset " + i);
            }
        }
        return out.toByteArray();
    }

    private static boolean isOctal(char ch) {
        return ch >= '0' && ch <= '7';
    }

    /**
     * Returns the value of an ASCII hexadecimal digit, or -1 if the
     * character is not one of 0-9, a-f or A-F.
     *
     * @param ch the character
     *
     * @return the digit value or -1
     */
    public static int hexValue(char ch) {
        if (ch >= '0' && ch <= '9') {
            return ch - '0';
        }
        if (ch >= 'a' && ch <= 'f') {
            return ch - 'a' + 10;
        }
        if (ch >= 'A' && ch <= 'F') {
            return ch - 'A' + 10;
        }
        return -1;
    }

    private static int hexDigit(char ch, String source) {
        int val = hexValue(ch);
        if (val < 0) {
            throw new IllegalArgumentException(
                "invalid hex digit '" + ch + "' in '" + source + "'");
        }
        return val;
    }
}
