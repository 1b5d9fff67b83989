/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.types;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import oracle.sqldb.driver.CodecTestBase;
import oracle.sqldb.driver.UnsupportedTypeException;

import org.junit.Test;

/**
 * Tests type descriptors, the type text parser and the oid mapping.
 */
public class TypeDescriptorTest extends CodecTestBase {

    /**
     * Synonyms map to the same descriptor.
     */
    @Test
    public void testSynonyms() {
        assertSame(TypeDescriptor.integerType(), type("bigint"));
        assertSame(TypeDescriptor.integerType(), type("INT"));
        assertSame(TypeDescriptor.floatType(), type("double precision"));
        assertSame(TypeDescriptor.floatType(), type("FLOAT(53)"));
        assertSame(TypeDescriptor.booleanType(), type("bool"));
        assertEquals(TypeDescriptor.decimalType(18, 4), type("money"));
        assertEquals(TypeDescriptor.varcharType(10),
                     type("character varying(10)"));
        assertEquals(TypeDescriptor.charType(1), type("char"));
        assertEquals(TypeDescriptor.binaryType(1), type("binary"));
        assertEquals(TypeDescriptor.varbinaryType(), type("bytea"));
        assertEquals(TypeDescriptor.varcharType(), type("long varchar"));
        assertEquals(TypeDescriptor.timestampTzType(),
                     type("timestamp with time zone"));
        assertEquals(TypeDescriptor.timestampType(3),
                     type("TIMESTAMP(3) WITHOUT TIME ZONE"));
        assertEquals(TypeDescriptor.timeTzType(), type("timetz"));
    }

    @Test
    public void testKindGroups() {
        assertTrue(type("NUMERIC(10,2)").isNumeric());
        assertTrue(type("INT").isNumeric());
        assertTrue(type("REAL").isNumeric());
        assertFalse(type("VARCHAR").isNumeric());
        assertTrue(type("CHAR(3)").isCharacter());
        assertFalse(type("BYTEA").isCharacter());
        assertTrue(type("BYTEA").isBinary());
        assertFalse(type("ARRAY[INTEGER]").isNumeric());
    }

    /**
     * Interval types, with precision before or after the range.
     */
    @Test
    public void testIntervals() {
        assertEquals(TypeDescriptor.intervalType(IntervalRange.DAY_TO_SECOND),
                     type("interval"));
        TypeDescriptor td = type("INTERVAL HOUR TO MINUTE");
        assertEquals(IntervalRange.HOUR_TO_MINUTE, td.getIntervalRange());
        assertEquals(TypeDescriptor.intervalType(IntervalRange.DAY_TO_SECOND,
                                                 3),
                     type("interval day to second(3)"));
        assertEquals(TypeDescriptor.intervalType(IntervalRange.SECOND, 2),
                     type("interval(2) second"));
        assertTrue(type("interval year to month").getIntervalRange()
                   .isYearMonth());
        assertEquals("INTERVAL MINUTE TO SECOND",
                     type("interval minute to second").getTypeName());

        expectUnsupported("interval month to year");
        expectUnsupported("interval second to day");
        expectUnsupported("interval day to");
    }

    /**
     * Every legal range has a start no finer than its end.
     */
    @Test
    public void testIntervalRanges() {
        assertEquals(13, IntervalRange.values().length);
        for (IntervalRange range : IntervalRange.values()) {
            assertSame(range, IntervalRange.of(range.getStart(),
                                               range.getEnd()));
            assertFalse(range.getStart().isFinerThan(range.getEnd()));
            assertTrue(range.contains(range.getStart()));
        }
        assertTrue(IntervalRange.DAY_TO_SECOND.contains(IntervalUnit.HOUR));
        assertFalse(IntervalRange.HOUR.contains(IntervalUnit.DAY));
        try {
            IntervalRange.of(IntervalUnit.MONTH, IntervalUnit.DAY);
            fail("Expected UnsupportedTypeException");
        } catch (UnsupportedTypeException ute) {
            /* success */
        }
    }

    /**
     * Nested containers and their canonical names.
     */
    @Test
    public void testContainers() {
        TypeDescriptor td = type("array[array[integer]]");
        assertEquals(TypeDescriptor.Kind.ARRAY, td.getKind());
        assertEquals(TypeDescriptor.Kind.ARRAY, td.getElement().getKind());
        assertEquals("ARRAY[ARRAY[INTEGER]]", td.getTypeName());
        assertTrue(td.isContainer());

        td = type("SET[VARCHAR(5), 10]");
        assertEquals(10, td.getMaxElements());
        assertEquals("SET[VARCHAR(5),10]", td.getTypeName());

        td = type("ROW(name VARCHAR(10), b ARRAY[NUMERIC(10,2)])");
        List<RowField> fields = td.getFields();
        assertEquals(2, fields.size());
        assertEquals("name", fields.get(0).getName());
        assertEquals(TypeDescriptor.decimalType(10, 2),
                     fields.get(1).getType().getElement());
        assertEquals("ROW(name VARCHAR(10), b ARRAY[NUMERIC(10,2)])",
                     td.getTypeName());

        /* anonymous fields are named by position */
        td = type("ROW(varchar, int, int)");
        assertEquals("f0", td.getFields().get(0).getName());
        assertEquals("f2", td.getFields().get(2).getName());
        assertEquals(TypeDescriptor.row(), type("row()"));

        td = type("ROW(\"my field\" INTEGER)");
        assertEquals("my field", td.getFields().get(0).getName());
        assertEquals("ROW(\"my field\" INTEGER)", td.getTypeName());

        /* the canonical name parses back to an equal descriptor */
        String name =
            "ROW(a INTERVAL DAY TO SECOND(3), b SET[TIMESTAMPTZ(6),4])";
        assertEquals(type(name), type(type(name).getTypeName()));
    }

    /**
     * Invalid type text.
     */
    @Test
    public void testInvalid() {
        expectUnsupported("");
        expectUnsupported("blob");
        expectUnsupported("array[integer");
        expectUnsupported("array integer");
        expectUnsupported("numeric(2,5)");
        expectUnsupported("row(a int, a int)");
        expectUnsupported("varchar(10) junk");
        expectUnsupported("timestamp with zone");
    }

    /**
     * Column metadata oids and modifiers.
     */
    @Test
    public void testOids() {
        assertSame(TypeDescriptor.booleanType(),
                   TypeOids.toDescriptor(TypeOids.BOOL, -1));
        assertEquals(TypeDescriptor.decimalType(),
                     TypeOids.toDescriptor(TypeOids.NUMERIC, -1));
        assertEquals(TypeDescriptor.decimalType(10, 2),
                     TypeOids.toDescriptor(TypeOids.NUMERIC,
                                           ((10 << 16) | 2) + 4));
        assertEquals(TypeDescriptor.charType(3),
                     TypeOids.toDescriptor(TypeOids.CHAR, 7));
        assertEquals(TypeDescriptor.varcharType(),
                     TypeOids.toDescriptor(TypeOids.LONGVARCHAR, -1));
        assertEquals(TypeDescriptor.binaryType(2),
                     TypeOids.toDescriptor(TypeOids.BINARY, 6));
        assertEquals(TypeDescriptor.timestampTzType(3),
                     TypeOids.toDescriptor(TypeOids.TIMESTAMPTZ, 3));
        assertEquals(TypeDescriptor.intervalType(IntervalRange.DAY_TO_SECOND),
                     TypeOids.toDescriptor(TypeOids.INTERVAL, -1));
        assertEquals(TypeDescriptor.intervalType(IntervalRange.YEAR_TO_MONTH),
                     TypeOids.toDescriptor(TypeOids.INTERVALYM, -1));

        /* HOUR TO MINUTE with unspecified precision */
        int typmod = (((1 << 10) | (1 << 11)) << 16) | 0xFFFF;
        assertEquals(TypeDescriptor.intervalType(IntervalRange.HOUR_TO_MINUTE),
                     TypeOids.toDescriptor(TypeOids.INTERVAL, typmod));
        /* MONTH */
        assertEquals(IntervalRange.MONTH,
                     TypeOids.intervalRange(((1 << 1) << 16) | 0xFFFF));
        assertNull(TypeOids.intervalRange(-1));

        try {
            TypeOids.toDescriptor(999, -1);
            fail("Expected UnsupportedTypeException");
        } catch (UnsupportedTypeException ute) {
            assertEquals("oid 999", ute.getTypeName());
        }
    }

    private static void expectUnsupported(String text) {
        try {
            TypeDescriptor td = type(text);
            fail("Expected UnsupportedTypeException for '" + text +
                 "', got " + td);
        } catch (UnsupportedTypeException ute) {
            assertEquals(text, ute.getTypeName());
        }
    }
}
