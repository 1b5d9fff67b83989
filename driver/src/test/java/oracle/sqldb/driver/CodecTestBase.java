/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.ZoneId;
import java.time.ZoneOffset;

import oracle.sqldb.driver.codec.ValueCodec;
import oracle.sqldb.driver.types.TypeDescriptor;
import oracle.sqldb.driver.types.TypeNameParser;
import oracle.sqldb.driver.values.FieldValue;

/**
 * A common base for codec tests, holding a default codec and helpers that
 * take the column type as SQL type text.
 */
public class CodecTestBase {

    protected static final ZoneId UTC = ZoneOffset.UTC;

    protected static final ValueCodec codec = new ValueCodec();

    protected static TypeDescriptor type(String typeText) {
        return TypeNameParser.parse(typeText);
    }

    protected static FieldValue decode(String raw, String typeText) {
        return codec.decode(raw, type(typeText), UTC);
    }

    protected static String encode(FieldValue value, String typeText) {
        return codec.encode(value, typeText);
    }

    /*
     * Encodes the value, decodes the literal and checks that the result
     * equals the value. Returns the literal.
     */
    protected static String assertRoundTrip(FieldValue value,
                                            String typeText) {
        String literal = codec.encode(value, typeText);
        FieldValue back = codec.decodeLiteral(literal, type(typeText), UTC);
        assertEquals("round trip of " + literal, value, back);
        return literal;
    }

    protected static ValueFormatException expectFormatError(String raw,
                                                            String typeText) {
        try {
            FieldValue val = decode(raw, typeText);
            fail("Expected ValueFormatException for '" + raw + "' as " +
                 typeText + ", got " + val);
            return null;
        } catch (ValueFormatException vfe) {
            assertTrue(vfe.getTypeName() != null && vfe.getText() != null);
            return vfe;
        }
    }

    protected static void expectOverflow(String raw, String typeText) {
        try {
            FieldValue val = decode(raw, typeText);
            fail("Expected ValueOverflowException for '" + raw + "' as " +
                 typeText + ", got " + val);
        } catch (ValueOverflowException voe) {
            assertTrue(voe.getTypeName() != null);
        }
    }

    protected static void expectMismatch(FieldValue value, String typeText) {
        try {
            String literal = encode(value, typeText);
            fail("Expected EncodingTypeMismatchException for " + value +
                 " as " + typeText + ", got " + literal);
        } catch (EncodingTypeMismatchException etme) {
            assertTrue(etme.getTypeName() != null);
        }
    }
}
