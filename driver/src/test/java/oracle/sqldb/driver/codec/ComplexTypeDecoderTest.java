/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.codec;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigDecimal;
import java.time.LocalDate;

import oracle.sqldb.driver.CodecTestBase;
import oracle.sqldb.driver.ValueFormatException;
import oracle.sqldb.driver.values.ArrayValue;
import oracle.sqldb.driver.values.BooleanValue;
import oracle.sqldb.driver.values.DateValue;
import oracle.sqldb.driver.values.FieldValue;
import oracle.sqldb.driver.values.IntervalValue;
import oracle.sqldb.driver.values.NullValue;
import oracle.sqldb.driver.values.NumberValue;
import oracle.sqldb.driver.values.RowValue;
import oracle.sqldb.driver.values.SetValue;

import org.junit.Test;

/**
 * Tests decoding of ARRAY, SET and ROW text.
 */
public class ComplexTypeDecoderTest extends CodecTestBase {

    /**
     * Nested arrays with NULL and empty elements.
     */
    @Test
    public void testNestedArrays() {
        FieldValue v = decode(
            "ARRAY[ARRAY[1,2],ARRAY[3,4],NULL,ARRAY[5,NULL],ARRAY[]]",
            "ARRAY[ARRAY[INTEGER]]");
        ArrayValue expected = new ArrayValue()
            .add(new ArrayValue().add(1).add(2))
            .add(new ArrayValue().add(3).add(4))
            .addNull()
            .add(new ArrayValue().add(5).addNull())
            .add(new ArrayValue());
        assertEquals(expected, v);

        /* the keyword and the cast are optional */
        assertEquals(expected, decode(
            "[[1,2],[3,4],null,[5,null],[]]::ARRAY[ARRAY[INTEGER]]",
            "ARRAY[ARRAY[INTEGER]]"));
        assertEquals(new ArrayValue(), decode("[ ]", "ARRAY[INTEGER]"));
    }

    /**
     * The JSON form sent by the server.
     */
    @Test
    public void testJsonForms() {
        assertEquals(new ArrayValue().add(-500).add(0).addNull().add(500),
                     decode("[-500,0,null,500]", "ARRAY[INTEGER]"));

        FieldValue v = decode("{\"f0\":true,\"f1\":[null,false]}",
                              "ROW(BOOLEAN, ARRAY[BOOLEAN])");
        RowValue expected = new RowValue()
            .put("f0", true)
            .put("f1", new ArrayValue().addNull().add(false));
        assertEquals(expected, v);

        assertEquals(new ArrayValue().add("a\"b").add("\u00e9"),
                     decode("[\"a\\\"b\",\"\\u00e9\"]", "ARRAY[VARCHAR]"));
    }

    /**
     * Rows with quoted strings and NULL fields.
     */
    @Test
    public void testRows() {
        FieldValue v = decode("ROW('Amy', -3, NULL)",
                              "ROW(name VARCHAR, n INTEGER, d DATE)");
        RowValue expected = new RowValue()
            .put("name", "Amy")
            .put("n", -3)
            .put("d", NullValue.getInstance());
        assertEquals(expected, v);

        assertEquals(new RowValue(), decode("ROW()", "ROW()"));
        assertEquals(new RowValue(), decode("()", "ROW()"));

        /* a quoted NULL is text */
        v = decode("('NULL', 'it''s')", "ROW(VARCHAR, VARCHAR)");
        assertEquals("NULL", v.asRow().get("f0").getString());
        assertEquals("it's", v.asRow().get("f1").getString());
    }

    /**
     * Sets drop duplicates, keeping one NULL.
     */
    @Test
    public void testSets() {
        FieldValue v = decode("SET[1,2,2,NULL,1,NULL]", "SET[INTEGER]");
        assertTrue(v.isSet());
        SetValue set = v.asSet();
        assertEquals(3, set.size());
        assertEquals(new SetValue().add(1).add(2)
                     .add(NullValue.getInstance()), set);
    }

    /**
     * Element quoting forms and embedded delimiters.
     */
    @Test
    public void testElementForms() {
        ArrayValue expected = new ArrayValue()
            .add("a,b")
            .add("c]d")
            .add("e'f")
            .add("g\nh")
            .add("i\"j")
            .add("k\\l");
        assertEquals(expected, decode(
            "['a,b', c\\]d, E'e\\'f', E'g\\nh', \"i\\\"j\", k\\\\l]",
            "ARRAY[VARCHAR]"));

        assertEquals(new ArrayValue().add("A").add("\u0007"),
                     decode("[E'\\x41', E'\\007']", "ARRAY[VARCHAR]"));

        FieldValue v = decode("[HEX_TO_BINARY('0x41'),'\\x42\\x43']",
                              "ARRAY[BINARY(2)]");
        assertArrayEquals(new byte[] {0x41, 0},
                          v.asArray().get(0).getBinary());
        assertArrayEquals(new byte[] {0x42, 0x43},
                          v.asArray().get(1).getBinary());

        v = decode("ROW('2001-12-01'::DATE, 1.50::NUMERIC(3,2))",
                   "ROW(DATE, NUMERIC)");
        assertEquals(new DateValue(LocalDate.of(2001, 12, 1)),
                     v.asRow().get(0));
        assertEquals(new NumberValue(new BigDecimal("1.50")),
                     v.asRow().get(1));
    }

    /**
     * Scalars nested in containers are decoded by their element type.
     */
    @Test
    public void testTypedElements() {
        FieldValue v = decode(
            "ROW(1.50, ['1 day 02:00'], [t, f])",
            "ROW(a NUMERIC, b ARRAY[VARCHAR], c SET[BOOLEAN])");
        RowValue row = v.asRow();
        assertEquals(new NumberValue(new BigDecimal("1.50")), row.get("a"));
        assertEquals("1 day 02:00", row.get("b").asArray().get(0).getString());
        assertEquals(new SetValue().add(BooleanValue.trueInstance())
                     .add(BooleanValue.falseInstance()), row.get("c"));

        v = decode("['1 02:03', '-00:01']", "ARRAY[INTERVAL DAY TO MINUTE]");
        assertEquals(IntervalValue.of(0, 0, 1, 2, 3, 0, 0),
                     v.asArray().get(0));
        assertEquals(IntervalValue.of(0, 0, 0, 0, -1, 0, 0),
                     v.asArray().get(1));
    }

    /**
     * Malformed container text.
     */
    @Test
    public void testMalformed() {
        expectFormatError("[1,2", "ARRAY[INTEGER]");
        expectFormatError("1,2]", "ARRAY[INTEGER]");
        expectFormatError("[1,,2]", "ARRAY[INTEGER]");
        expectFormatError("[1,2,]", "ARRAY[INTEGER]");
        expectFormatError("[1,2] junk", "ARRAY[INTEGER]");
        expectFormatError("[1,(2]", "ARRAY[INTEGER]");
        expectFormatError("['abc]", "ARRAY[VARCHAR]");
        expectFormatError("[1,2,3]", "ARRAY[INTEGER,2]");
        expectFormatError("(1,2)", "ROW(INTEGER)");
        expectFormatError("[1]", "ROW(INTEGER)");
        expectFormatError("[[1]]", "ARRAY[INTEGER]");
        expectFormatError("[1]", "ARRAY[ARRAY[INTEGER]]");
        expectFormatError("[HEX_TO_BINARY('0x41')]", "ARRAY[VARCHAR]");
        expectFormatError("['a' 'b']", "ARRAY[VARCHAR]");
        expectFormatError("{1}", "ROW(INTEGER)");
        expectFormatError("[HEX_TO_BINARY('0x\uff11\uff11')]",
                          "ARRAY[VARBINARY]");
        expectFormatError("[E'\\x\uff11']", "ARRAY[VARCHAR]");
        expectFormatError("[(a)]", "ARRAY[VARCHAR]");
        expectFormatError("[((-1))]", "ARRAY[INTEGER]");

        /* errors inside an element name the element's type */
        try {
            decode("[1,x]", "ARRAY[INTEGER]");
            fail("Expected ValueFormatException");
        } catch (ValueFormatException vfe) {
            assertEquals("INTEGER", vfe.getTypeName());
            assertEquals("x", vfe.getText());
        }
    }
}
