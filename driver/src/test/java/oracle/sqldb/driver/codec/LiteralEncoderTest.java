/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.codec;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.math.BigDecimal;
import java.time.LocalDate;

import oracle.sqldb.driver.CodecTestBase;
import oracle.sqldb.driver.values.ArrayValue;
import oracle.sqldb.driver.values.BinaryValue;
import oracle.sqldb.driver.values.DateValue;
import oracle.sqldb.driver.values.DoubleValue;
import oracle.sqldb.driver.values.IntervalValue;
import oracle.sqldb.driver.values.LongValue;
import oracle.sqldb.driver.values.NullValue;
import oracle.sqldb.driver.values.NumberValue;
import oracle.sqldb.driver.values.RowValue;
import oracle.sqldb.driver.values.SetValue;
import oracle.sqldb.driver.values.StringValue;

import org.junit.Test;

/**
 * Tests literal text produced for containers and NULL.
 */
public class LiteralEncoderTest extends CodecTestBase {

    /**
     * Literals whose elements identify their type carry no cast.
     */
    @Test
    public void testNoCast() {
        assertEquals("ARRAY[1,2]",
                     encode(new ArrayValue().add(1).add(2), "ARRAY[INTEGER]"));
        assertEquals("ARRAY['a','it''s']",
                     encode(new ArrayValue().add("a").add("it's"),
                            "ARRAY[VARCHAR]"));
        assertEquals("ARRAY[TRUE,FALSE]",
                     encode(new ArrayValue().add(true).add(false),
                            "ARRAY[BOOLEAN]"));
        assertEquals("ARRAY[ARRAY[1],ARRAY[2,3]]",
                     encode(new ArrayValue()
                            .add(new ArrayValue().add(1))
                            .add(new ArrayValue().add(2).add(3)),
                            "ARRAY[ARRAY[INTEGER]]"));
        assertEquals("SET[1,2]",
                     encode(new SetValue().add(1).add(2), "SET[INTEGER]"));
    }

    /**
     * The outermost container is cast when its literal is ambiguous.
     */
    @Test
    public void testCast() {
        assertEquals("ARRAY[1,NULL]::ARRAY[INTEGER]",
                     encode(new ArrayValue().add(1).addNull(),
                            "ARRAY[INTEGER]"));
        assertEquals("ARRAY[]::ARRAY[INTEGER]",
                     encode(new ArrayValue(), "array[int]"));
        assertEquals("ARRAY[ARRAY[1],ARRAY[]]::ARRAY[ARRAY[INTEGER]]",
                     encode(new ArrayValue()
                            .add(new ArrayValue().add(1))
                            .add(new ArrayValue()),
                            "ARRAY[ARRAY[INTEGER]]"));
        assertEquals("ARRAY[1.50]::ARRAY[NUMERIC(10,2)]",
                     encode(new ArrayValue().add(new BigDecimal("1.50")),
                            "ARRAY[NUMERIC(10,2)]"));
        assertEquals("ARRAY['2001-12-01']::ARRAY[DATE]",
                     encode(new ArrayValue()
                            .add(new DateValue(LocalDate.of(2001, 12, 1))),
                            "ARRAY[DATE]"));
        assertEquals("ROW(1,'x')::ROW(a INTEGER, b VARCHAR)",
                     encode(new RowValue().put("a", 1).put("b", "x"),
                            "ROW(a INTEGER, b VARCHAR)"));
    }

    @Test
    public void testNull() {
        assertEquals("NULL", encode(NullValue.getInstance(), "INTEGER"));
        assertEquals("NULL", encode(NullValue.getInstance(), "ARRAY[DATE]"));
        assertEquals("ROW(NULL)::ROW(f0 INTEGER)",
                     encode(new RowValue().put("f0", NullValue.getInstance()),
                            "ROW(INTEGER)"));
    }

    /**
     * Negative numbers are parenthesized, so a minus sign written before
     * the literal cannot start a comment.
     */
    @Test
    public void testNegativeNumbers() {
        String literal = encode(new LongValue(-3), "INTEGER");
        assertEquals("(-3)", literal);
        String sql = "SELECT 1-" + literal + ", " +
            encode(new StringValue("\nOR 1=1"), "VARCHAR");
        assertFalse(sql, sql.contains("--"));

        assertEquals("(-3)", encode(new LongValue(-3), "FLOAT"));
        assertEquals("(-3)", encode(new LongValue(-3), "NUMERIC"));
        assertEquals("(-2.5)", encode(new DoubleValue(-2.5), "FLOAT"));
        assertEquals("(-0.0)", encode(new DoubleValue(-0.0), "FLOAT"));
        assertEquals("(-1.5)",
                     encode(new NumberValue(new BigDecimal("-1.5")),
                            "NUMERIC"));
        assertEquals("(-1E+3)",
                     encode(new NumberValue(new BigDecimal("-1E+3")),
                            "NUMERIC"));
        assertEquals("ARRAY[(-1),2]",
                     encode(new ArrayValue().add(-1).add(2),
                            "ARRAY[INTEGER]"));

        assertRoundTrip(new LongValue(-3), "INTEGER");
        assertRoundTrip(new DoubleValue(-2.5), "FLOAT");
        assertRoundTrip(new NumberValue(new BigDecimal("-1E+3")), "NUMERIC");
        assertRoundTrip(new ArrayValue().add(-1).addNull().add(2),
                        "ARRAY[INTEGER]");
        assertRoundTrip(new ArrayValue().add(new BigDecimal("-1.50")),
                        "ARRAY[NUMERIC(10,2)]");
        assertRoundTrip(new RowValue().put("a", -1), "ROW(a INTEGER)");
    }

    /**
     * Values whose shape does not match the type are rejected.
     */
    @Test
    public void testMismatch() {
        expectMismatch(new SetValue().add(1), "ARRAY[INTEGER]");
        expectMismatch(new ArrayValue().add(1), "SET[INTEGER]");
        expectMismatch(new ArrayValue().add(1), "INTEGER");
        expectMismatch(new LongValue(1), "ARRAY[INTEGER]");
        expectMismatch(new ArrayValue().add("x"), "ARRAY[INTEGER]");
        expectMismatch(new RowValue().put("a", 1), "ROW(INTEGER, INTEGER)");
        expectMismatch(new RowValue().put("a", 1).put("b", 2),
                       "ROW(INTEGER)");
        expectMismatch(new ArrayValue().add(new ArrayValue().add(1)),
                       "ARRAY[INTEGER]");
    }

    /**
     * Container literals decode back to the encoded value.
     */
    @Test
    public void testRoundTrip() {
        assertRoundTrip(new ArrayValue().add(1).addNull().add(-3),
                        "ARRAY[INTEGER]");
        assertRoundTrip(new ArrayValue().add("a\nb").add("c,d]").add("'")
                        .addNull(), "ARRAY[VARCHAR]");
        assertRoundTrip(new ArrayValue()
                        .add(new BinaryValue(new byte[] {0, 1}))
                        .addNull(), "ARRAY[VARBINARY]");
        assertRoundTrip(new SetValue().add("x").add("y"), "SET[VARCHAR]");
        assertRoundTrip(new ArrayValue(), "ARRAY[ARRAY[INTEGER]]");

        RowValue row = new RowValue()
            .put("a", IntervalValue.of(0, 0, 1, 2, 3, 4, 0))
            .put("b", new ArrayValue().add("x\ty").add("z"))
            .put("c", NullValue.getInstance());
        String literal = assertRoundTrip(
            row, "ROW(a INTERVAL DAY TO SECOND, b ARRAY[VARCHAR], c DATE)");
        assertEquals("ROW('1 02:03:04',ARRAY[E'x\\ty','z'],NULL)::" +
                     type("ROW(a INTERVAL DAY TO SECOND, b ARRAY[VARCHAR], " +
                          "c DATE)").getTypeName(), literal);
    }
}
