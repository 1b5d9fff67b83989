/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.codec;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

import oracle.sqldb.driver.EncodingTypeMismatchException;
import oracle.sqldb.driver.ValueFormatException;
import oracle.sqldb.driver.ValueOverflowException;
import oracle.sqldb.driver.types.TypeDescriptor;
import oracle.sqldb.driver.util.BinaryUtil;
import oracle.sqldb.driver.util.NumberUtil;
import oracle.sqldb.driver.util.TemporalUtil;
import oracle.sqldb.driver.values.BinaryValue;
import oracle.sqldb.driver.values.BooleanValue;
import oracle.sqldb.driver.values.DateValue;
import oracle.sqldb.driver.values.DoubleValue;
import oracle.sqldb.driver.values.FieldValue;
import oracle.sqldb.driver.values.IntervalValue;
import oracle.sqldb.driver.values.LongValue;
import oracle.sqldb.driver.values.NumberValue;
import oracle.sqldb.driver.values.StringValue;
import oracle.sqldb.driver.values.TimeTzValue;
import oracle.sqldb.driver.values.TimeValue;
import oracle.sqldb.driver.values.TimestampTzValue;
import oracle.sqldb.driver.values.TimestampValue;
import oracle.sqldb.driver.values.UuidValue;

/**
 * Converts between the text of a single scalar value and a
 * {@link FieldValue}. Decoding reads the text the server sends for a column
 * of the given type; encoding produces a SQL literal for the value.
 * <p>
 * Parse failures in the utility parsers surface as
 * {@link IllegalArgumentException} or {@link ArithmeticException} and are
 * converted here into {@link ValueFormatException} and
 * {@link ValueOverflowException}, with the type name and text attached.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class ScalarCodec {

    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-" +
        "[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final boolean padFixedLength;
    private final boolean standardConformingStrings;

    public ScalarCodec(CodecOptions options) {
        requireNonNull(options, "ScalarCodec: options must be non-null");
        this.padFixedLength = options.getPadFixedLength();
        this.standardConformingStrings =
            options.getStandardConformingStrings();
    }

    /**
     * Decodes the text of a scalar value.
     *
     * @param text the text, already unescaped if it was a container element
     * @param type the scalar type
     * @param zone the session zone, used for zone-less TIMETZ and
     * TIMESTAMPTZ values
     *
     * @return the value
     *
     * @throws ValueFormatException if the text does not match the type's
     * grammar, or the type is a container type
     * @throws ValueOverflowException if the value is out of range for the
     * type
     */
    public FieldValue decode(String text, TypeDescriptor type, ZoneId zone) {
        requireNonNull(text, "ScalarCodec.decode: text must be non-null");
        requireNonNull(type, "ScalarCodec.decode: type must be non-null");
        try {
            return decodeInternal(text, type, zone);
        } catch (ArithmeticException ae) {
            throw new ValueOverflowException(
                "Value out of range for " + type.getTypeName() + ": " +
                ae.getMessage(), type.getTypeName(), text, ae);
        } catch (IllegalArgumentException iae) {
            throw new ValueFormatException(
                "Invalid " + type.getTypeName() + " value '" + text + "': " +
                iae.getMessage(), type.getTypeName(), text, iae);
        }
    }

    private FieldValue decodeInternal(String text,
                                      TypeDescriptor type,
                                      ZoneId zone) {
        switch (type.getKind()) {
        case BOOLEAN:
            return decodeBoolean(text);
        case INTEGER:
            return new LongValue(NumberUtil.parseLong(text.trim()));
        case FLOAT:
            return new DoubleValue(NumberUtil.parseDouble(text.trim()));
        case DECIMAL:
            return new NumberValue(NumberUtil.parseDecimal(text.trim()));
        case CHAR:
            return new StringValue(padChar(text, type));
        case VARCHAR:
            return new StringValue(text);
        case BINARY:
        case VARBINARY:
            return new BinaryValue(
                padBinary(BinaryUtil.unescapeBinary(text), type));
        case UUID:
            return decodeUuid(text);
        case DATE:
            return new DateValue(TemporalUtil.parseDate(text.trim()));
        case TIME:
            return new TimeValue(TemporalUtil.parseTime(text.trim()));
        case TIMETZ:
            requireNonNull(zone, "ScalarCodec.decode: zone must be non-null");
            return new TimeTzValue(
                TemporalUtil.parseTimeTz(text.trim(), zone));
        case TIMESTAMP:
            return new TimestampValue(
                TemporalUtil.parseTimestamp(text.trim()));
        case TIMESTAMPTZ:
            requireNonNull(zone, "ScalarCodec.decode: zone must be non-null");
            return new TimestampTzValue(
                TemporalUtil.parseTimestampTz(text.trim(), zone));
        case INTERVAL:
            return IntervalCodec.parse(text, type.getIntervalRange());
        default:
            throw new ValueFormatException(
                "A scalar value cannot be decoded as " + type.getTypeName(),
                type.getTypeName(), text);
        }
    }

    private static FieldValue decodeBoolean(String text) {
        String t = text.trim().toLowerCase(Locale.ROOT);
        switch (t) {
        case "t":
        case "true":
            return BooleanValue.trueInstance();
        case "f":
        case "false":
            return BooleanValue.falseInstance();
        default:
            throw new IllegalArgumentException(
                "expected t, true, f or false");
        }
    }

    private static FieldValue decodeUuid(String text) {
        String t = text.trim();
        if (!UUID_PATTERN.matcher(t).matches()) {
            throw new IllegalArgumentException(
                "expected 8-4-4-4-12 hexadecimal digits");
        }
        return new UuidValue(UUID.fromString(t));
    }

    /*
     * The declared length of CHAR is in octets, so multi-byte characters
     * take more than one position.
     */
    private String padChar(String text, TypeDescriptor type) {
        int length = type.getLength();
        if (!padFixedLength || length <= 0) {
            return text;
        }
        int octets = text.getBytes(StandardCharsets.UTF_8).length;
        if (octets >= length) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text);
        for (int i = octets; i < length; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }

    /**
     * Pads a BINARY value with zero bytes to its declared length. Other
     * types, and values that already fill the length, are returned as is.
     *
     * @param bytes the value
     * @param type the type
     *
     * @return the padded value
     */
    byte[] padBinary(byte[] bytes, TypeDescriptor type) {
        int length = type.getLength();
        if (!padFixedLength || type.getKind() != TypeDescriptor.Kind.BINARY ||
            length <= bytes.length) {
            return bytes;
        }
        return Arrays.copyOf(bytes, length);
    }

    /**
     * Encodes a scalar value as a SQL literal of the given type.
     *
     * @param value the value, not a NullValue or container
     * @param type the scalar target type
     *
     * @return the literal
     *
     * @throws EncodingTypeMismatchException if the value cannot be
     * represented by the type
     */
    public String encode(FieldValue value, TypeDescriptor type) {
        requireNonNull(value, "ScalarCodec.encode: value must be non-null");
        requireNonNull(type, "ScalarCodec.encode: type must be non-null");
        FieldValue.Type vt = value.getType();
        switch (type.getKind()) {
        case BOOLEAN:
            checkValueType(vt == FieldValue.Type.BOOLEAN, value, type);
            return value.getBoolean() ? "TRUE" : "FALSE";
        case INTEGER:
            checkValueType(vt == FieldValue.Type.INTEGER, value, type);
            return signed(Long.toString(value.getLong()));
        case FLOAT:
            if (vt == FieldValue.Type.INTEGER) {
                return signed(Long.toString(value.getLong()));
            }
            checkValueType(vt == FieldValue.Type.DOUBLE, value, type);
            return encodeDouble(value.getDouble());
        case DECIMAL:
            if (vt == FieldValue.Type.INTEGER) {
                return signed(Long.toString(value.getLong()));
            }
            checkValueType(vt == FieldValue.Type.NUMBER, value, type);
            return signed(encodeDecimal(value.getNumber()));
        case CHAR:
        case VARCHAR:
            checkValueType(vt == FieldValue.Type.STRING, value, type);
            return quote(value.getString(), type);
        case BINARY:
        case VARBINARY:
            checkValueType(vt == FieldValue.Type.BINARY, value, type);
            return "HEX_TO_BINARY('0x" +
                BinaryUtil.convertBytesToHex(value.getBinary()) + "')";
        case UUID:
            checkValueType(vt == FieldValue.Type.UUID, value, type);
            return "'" + value.getUuid().toString().toLowerCase(Locale.ROOT) +
                "'";
        case DATE:
            checkValueType(vt == FieldValue.Type.DATE, value, type);
            return "'" + TemporalUtil.formatDate(value.getDate()) + "'";
        case TIME:
            checkValueType(vt == FieldValue.Type.TIME, value, type);
            return "'" + TemporalUtil.formatTime(value.getTime()) + "'";
        case TIMETZ:
            checkValueType(vt == FieldValue.Type.TIMETZ, value, type);
            return "'" + TemporalUtil.formatTimeTz(value.getTimeTz()) + "'";
        case TIMESTAMP:
            checkValueType(vt == FieldValue.Type.TIMESTAMP, value, type);
            return "'" + TemporalUtil.formatTimestamp(value.getTimestamp()) +
                "'";
        case TIMESTAMPTZ:
            checkValueType(vt == FieldValue.Type.TIMESTAMPTZ, value, type);
            return "'" +
                TemporalUtil.formatTimestampTz(value.getTimestampTz()) + "'";
        case INTERVAL:
            checkValueType(vt == FieldValue.Type.INTERVAL, value, type);
            return "'" + IntervalCodec.format((IntervalValue) value,
                                              type.getIntervalRange()) + "'";
        default:
            throw new EncodingTypeMismatchException(
                "Type " + type.getTypeName() + " is not a scalar type",
                type.getTypeName(), value.toString());
        }
    }

    private static String encodeDouble(double d) {
        if (Double.isNaN(d)) {
            return "'NaN'::FLOAT";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "'Infinity'::FLOAT" : "'-Infinity'::FLOAT";
        }
        return signed(Double.toString(d));
    }

    /*
     * Parenthesizes a negative number, so that a '-' written before it in
     * the statement text cannot form a "--" comment.
     */
    private static String signed(String number) {
        return number.startsWith("-") ? "(" + number + ")" : number;
    }

    /* a negative scale needs the exponent form to survive a round trip */
    private static String encodeDecimal(BigDecimal bd) {
        return bd.scale() < 0 ? bd.toString() : bd.toPlainString();
    }

    /**
     * Quotes character data as a string literal. The escaped E'...' form is
     * used for text holding control characters, and for text holding a
     * backslash when the server does not use standard conforming strings.
     *
     * @param text the text
     * @param type the target type, for error reporting
     *
     * @return the literal
     *
     * @throws EncodingTypeMismatchException if the text holds a NUL
     * character
     */
    String quote(String text, TypeDescriptor type) {
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == 0) {
                throw new EncodingTypeMismatchException(
                    "NUL characters cannot be encoded as " +
                    type.getTypeName(), type.getTypeName(), text);
            }
            if (ch < 0x20 || ch == 0x7f ||
                (ch == '\\' && !standardConformingStrings)) {
                escaped = true;
            }
        }
        if (!escaped) {
            return "'" + text.replace("'", "''") + "'";
        }
        StringBuilder sb = new StringBuilder(text.length() + 8);
        sb.append("E'");
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
            case '\\':
                sb.append("\\\\");
                break;
            case '\'':
                sb.append("\\'");
                break;
            case '\n':
                sb.append("\\n");
                break;
            case '\r':
                sb.append("\\r");
                break;
            case '\t':
                sb.append("\\t");
                break;
            case '\b':
                sb.append("\\b");
                break;
            case '\f':
                sb.append("\\f");
                break;
            default:
                if (ch < 0x20 || ch == 0x7f) {
                    sb.append("\\x");
                    sb.append(Character.forDigit(ch >> 4, 16));
                    sb.append(Character.forDigit(ch & 0xf, 16));
                } else {
                    sb.append(ch);
                }
            }
        }
        sb.append('\'');
        return sb.toString();
    }

    private static void checkValueType(boolean matches,
                                       FieldValue value,
                                       TypeDescriptor type) {
        if (!matches) {
            throw new EncodingTypeMismatchException(
                "Value of type " + value.getType() + " cannot be encoded as " +
                type.getTypeName(), type.getTypeName(), value.toString());
        }
    }
}
