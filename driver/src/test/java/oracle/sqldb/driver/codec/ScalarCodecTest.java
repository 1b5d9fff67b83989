/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.codec;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import oracle.sqldb.driver.CodecTestBase;
import oracle.sqldb.driver.ValueFormatException;
import oracle.sqldb.driver.values.BinaryValue;
import oracle.sqldb.driver.values.BooleanValue;
import oracle.sqldb.driver.values.DateValue;
import oracle.sqldb.driver.values.DoubleValue;
import oracle.sqldb.driver.values.FieldValue;
import oracle.sqldb.driver.values.IntervalValue;
import oracle.sqldb.driver.values.LongValue;
import oracle.sqldb.driver.values.NumberValue;
import oracle.sqldb.driver.values.StringValue;
import oracle.sqldb.driver.values.TimeValue;
import oracle.sqldb.driver.values.TimestampTzValue;
import oracle.sqldb.driver.values.TimestampValue;
import oracle.sqldb.driver.values.UuidValue;

import org.junit.Test;

/**
 * Tests decoding and encoding of scalar values.
 */
public class ScalarCodecTest extends CodecTestBase {

    @Test
    public void testBoolean() {
        assertSame(BooleanValue.trueInstance(), decode("t", "BOOLEAN"));
        assertSame(BooleanValue.trueInstance(), decode("TRUE", "BOOLEAN"));
        assertSame(BooleanValue.falseInstance(), decode("f", "BOOLEAN"));
        assertEquals("TRUE", encode(BooleanValue.trueInstance(), "BOOLEAN"));
        assertEquals("FALSE", encode(BooleanValue.falseInstance(), "BOOL"));
        expectFormatError("yes", "BOOLEAN");
    }

    @Test
    public void testInteger() {
        assertEquals(new LongValue(-17), decode("-17", "INTEGER"));
        assertEquals("9223372036854775807",
                     encode(new LongValue(Long.MAX_VALUE), "INTEGER"));
        expectOverflow("9223372036854775808", "INTEGER");
        ValueFormatException vfe = expectFormatError("1.5", "INTEGER");
        assertEquals("INTEGER", vfe.getTypeName());
    }

    @Test
    public void testFloat() {
        assertEquals(new DoubleValue(1.5e10), decode("1.5e10", "FLOAT"));
        assertEquals(new DoubleValue(Double.NEGATIVE_INFINITY),
                     decode("-Infinity", "FLOAT"));
        assertTrue(Double.isNaN(decode("NaN", "FLOAT").getDouble()));

        assertEquals("0.1", encode(new DoubleValue(0.1), "FLOAT"));
        assertEquals("'NaN'::FLOAT",
                     encode(new DoubleValue(Double.NaN), "FLOAT"));
        assertEquals("'-Infinity'::FLOAT",
                     encode(new DoubleValue(Double.NEGATIVE_INFINITY),
                            "FLOAT"));
        assertEquals("3", encode(new LongValue(3), "FLOAT"));
        expectFormatError("1,5", "FLOAT");
    }

    /**
     * Decimals keep their digits and scale through decode and encode.
     */
    @Test
    public void testDecimal() {
        FieldValue v = decode("0.0000000000", "NUMERIC(18,10)");
        assertEquals(new NumberValue(new BigDecimal("0.0000000000")), v);
        assertEquals("0.0000000000", encode(v, "NUMERIC(18,10)"));

        v = decode("-12345678901234567890.123456789", "NUMERIC");
        assertEquals("-12345678901234567890.123456789",
                     v.getNumber().toPlainString());

        /* negative scale survives encoding */
        v = decode("1E+3", "NUMERIC");
        assertEquals(-3, v.getNumber().scale());
        String literal = assertRoundTrip(v, "NUMERIC");
        assertEquals("1E+3", literal);

        expectOverflow("1e99999999999", "NUMERIC");
        expectFormatError("1.2.3", "NUMERIC");
        expectMismatch(new DoubleValue(1.5), "NUMERIC");
    }

    /**
     * CHAR pads to its length in octets, VARCHAR is verbatim.
     */
    @Test
    public void testCharacter() {
        assertEquals("a  ", decode("a", "CHAR(3)").getString());
        /* a three octet character fills CHAR(3) */
        assertEquals("ᚱ", decode("ᚱ", "CHAR(3)").getString());
        assertEquals("abcd", decode("abcd", "CHAR(3)").getString());
        assertEquals(" a ", decode(" a ", "VARCHAR").getString());

        ValueCodec unpadded =
            new ValueCodec(new CodecOptions().setPadFixedLength(false));
        assertEquals("a", unpadded.decode("a", type("CHAR(3)"), UTC)
                     .getString());
    }

    /**
     * String literal quoting.
     */
    @Test
    public void testQuoting() {
        assertEquals("'it''s'", encode(new StringValue("it's"), "VARCHAR"));
        assertEquals("'a\\b'", encode(new StringValue("a\\b"), "VARCHAR"));
        assertEquals("E'a\\nb\\tc\\x01'",
                     encode(new StringValue("a\nb\tc\u0001"), "VARCHAR"));
        assertEquals("E'it\\'s\\n'",
                     encode(new StringValue("it's\n"), "VARCHAR"));

        ValueCodec legacy = new ValueCodec(
            new CodecOptions().setStandardConformingStrings(false));
        assertEquals("E'a\\\\b'",
                     legacy.encode(new StringValue("a\\b"), "VARCHAR"));

        expectMismatch(new StringValue("a\u0000b"), "VARCHAR");
        expectMismatch(new LongValue(1), "VARCHAR");
    }

    @Test
    public void testBinary() {
        assertArrayEquals(new byte[] {'A', 0},
                          decode("\\x41", "BINARY(2)").getBinary());
        assertArrayEquals(new byte[] {'a', 'b', (byte) 0xff},
                          decode("ab\\377", "VARBINARY").getBinary());
        assertEquals("HEX_TO_BINARY('0x41ff')",
                     encode(new BinaryValue(new byte[] {0x41, (byte) 0xff}),
                            "VARBINARY"));
        expectFormatError("\\q", "VARBINARY");
    }

    @Test
    public void testUuid() {
        UUID uuid = UUID.fromString("a0eebc99-9c0b-4ef8-bb6d-6bb9bd380a11");
        assertEquals(new UuidValue(uuid),
                     decode("A0EEBC99-9C0B-4EF8-BB6D-6BB9BD380A11", "UUID"));
        assertEquals("'a0eebc99-9c0b-4ef8-bb6d-6bb9bd380a11'",
                     encode(new UuidValue(uuid), "UUID"));
        expectFormatError("a0eebc999c0b4ef8bb6d6bb9bd380a11", "UUID");
    }

    /**
     * Temporal values, including wide years, BC and fractions.
     */
    @Test
    public void testTemporal() {
        assertEquals(new DateValue(LocalDate.of(-43, 3, 15)),
                     decode("0044-03-15 BC", "DATE"));
        assertEquals(new TimeValue(LocalTime.of(23, 59, 59, 999_999_000)),
                     decode("23:59:59.999999", "TIME"));
        assertEquals(new TimestampValue(LocalDateTime.of(12345, 6, 7, 8, 9)),
                     decode("12345-06-07 08:09:00", "TIMESTAMP"));
        assertEquals(new TimestampTzValue(OffsetDateTime.of(
                         2001, 12, 1, 10, 0, 0, 0, ZoneOffset.ofHours(2))),
                     decode("2001-12-01 10:00:00+02", "TIMESTAMPTZ"));

        assertEquals("'0044-03-15 BC'",
                     encode(new DateValue(LocalDate.of(-43, 3, 15)), "DATE"));
        assertEquals("'2001-12-01 10:00:00.25'",
                     encode(new TimestampValue(LocalDateTime.of(
                         2001, 12, 1, 10, 0, 0, 250_000_000)),
                            "TIMESTAMP"));

        expectFormatError("2001-13-01", "DATE");
        expectFormatError("10:00:00 Mars/Base", "TIMETZ");
        expectMismatch(new DateValue(LocalDate.of(2001, 1, 1)), "TIMESTAMP");
    }

    @Test
    public void testInterval() {
        assertEquals(IntervalValue.of(0, 0, 1, 2, 3, 4, 500),
                     decode("1 02:03:04.0005", "INTERVAL DAY TO SECOND"));
        assertEquals("'1 02:03:04.0005'",
                     encode(IntervalValue.of(0, 0, 1, 2, 3, 4, 500),
                            "INTERVAL"));
        assertEquals("'1-10'", encode(IntervalValue.ofMonths(22),
                                      "INTERVAL YEAR TO MONTH"));
        expectMismatch(IntervalValue.ofMonths(22), "INTERVAL DAY TO SECOND");
    }

    /**
     * Values of each scalar type survive encode and decodeLiteral.
     */
    @Test
    public void testRoundTrip() {
        assertRoundTrip(new LongValue(Long.MIN_VALUE), "INTEGER");
        assertRoundTrip(new DoubleValue(-0.000123), "FLOAT");
        assertRoundTrip(new DoubleValue(Double.POSITIVE_INFINITY), "FLOAT");
        assertRoundTrip(new NumberValue(new BigDecimal("-1.50")),
                        "NUMERIC(10,2)");
        assertRoundTrip(new StringValue("it's a \\ \"test\"\r\n"),
                        "VARCHAR");
        assertRoundTrip(new BinaryValue(new byte[] {0, 1, 2, (byte) 0x80}),
                        "VARBINARY");
        assertRoundTrip(new TimeValue(LocalTime.of(1, 2, 3, 4)), "TIME");
        assertRoundTrip(new TimestampTzValue(OffsetDateTime.of(
                            -100, 1, 1, 0, 0, 0, 0,
                            ZoneOffset.ofHoursMinutesSeconds(5, 30, 15))),
                        "TIMESTAMPTZ");
        assertRoundTrip(IntervalValue.ofMicros(-123456789L),
                        "INTERVAL HOUR TO SECOND");
        assertRoundTrip(BooleanValue.falseInstance(), "BOOLEAN");
    }
}
