/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.codec;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.time.ZoneId;
import java.util.logging.Logger;

import oracle.sqldb.driver.CodecException;
import oracle.sqldb.driver.EncodingTypeMismatchException;
import oracle.sqldb.driver.UnsupportedTypeException;
import oracle.sqldb.driver.ValueFormatException;
import oracle.sqldb.driver.ValueOverflowException;
import oracle.sqldb.driver.types.TypeDescriptor;
import oracle.sqldb.driver.types.TypeNameParser;
import oracle.sqldb.driver.util.LogUtil;
import oracle.sqldb.driver.values.FieldValue;
import oracle.sqldb.driver.values.NullValue;
import oracle.sqldb.driver.values.StringValue;

/**
 * ValueCodec converts column text received from the server into
 * {@link FieldValue} instances, and values into SQL literal text.
 * <p>
 * The type of each column is described by a {@link TypeDescriptor}, built
 * from result metadata with {@link oracle.sqldb.driver.types.TypeOids} or
 * from type text with {@link TypeNameParser}. Decoding of TIMETZ and
 * TIMESTAMPTZ values without an explicit zone uses the session zone passed
 * to each call, so one codec can serve connections in different zones.
 * <p>
 * A typical use:
 * <pre>
 *    ValueCodec codec = new ValueCodec();
 *    TypeDescriptor type = TypeNameParser.parse("ARRAY[NUMERIC(10,2)]");
 *    FieldValue value = codec.decode("[1.50,NULL,-3]", type, zone);
 *    String literal = codec.encode(value, type);
 * </pre>
 * ValueCodec is immutable and thread-safe.
 */
public class ValueCodec {

    private static final int LOG_TEXT_MAX = 64;

    private final Logger logger;
    private final boolean complexTypesAsText;
    private final ScalarCodec scalar;
    private final ComplexTypeDecoder complex;
    private final LiteralEncoder encoder;

    /**
     * Creates a codec with default options.
     */
    public ValueCodec() {
        this(new CodecOptions());
    }

    /**
     * Creates a codec using the given options. The options are copied.
     *
     * @param options the options
     */
    public ValueCodec(CodecOptions options) {
        requireNonNull(options, "ValueCodec: options must be non-null");
        this.logger = options.getLogger();
        this.complexTypesAsText = options.getComplexTypesAsText();
        this.scalar = new ScalarCodec(options);
        this.complex = new ComplexTypeDecoder(scalar);
        this.encoder = new LiteralEncoder(scalar);
    }

    /**
     * Decodes the text of a column value.
     * <p>
     * A null text is a SQL NULL. The bare text NULL is also a SQL NULL,
     * whatever the column type.
     *
     * @param raw the text sent by the server, or null
     * @param type the column type
     * @param sessionZone the session zone
     *
     * @return the value
     *
     * @throws ValueFormatException if the text is not valid for the type
     * @throws ValueOverflowException if the value is out of range for the
     * type
     */
    public FieldValue decode(String raw, TypeDescriptor type, ZoneId sessionZone) {
        requireNonNull(type, "ValueCodec.decode: type must be non-null");
        requireNonNull(sessionZone,
                       "ValueCodec.decode: sessionZone must be non-null");
        if (raw == null) {
            return NullValue.getInstance();
        }
        if (raw.trim().equalsIgnoreCase("NULL")) {
            return NullValue.getInstance();
        }
        try {
            if (type.isContainer()) {
                if (complexTypesAsText) {
                    if (LogUtil.isFineEnabled(logger)) {
                        LogUtil.logFine(logger, "Returning " +
                                        type.getTypeName() + " value as text");
                    }
                    return new StringValue(raw);
                }
                return complex.decode(raw, type, sessionZone);
            }
            return scalar.decode(raw, type, sessionZone);
        } catch (CodecException ce) {
            logFailure("decode", raw, type, ce);
            throw ce;
        }
    }

    /**
     * Decodes a literal in the form produced by {@link #encode}.
     *
     * @param literal the literal text
     * @param type the type of the value
     * @param sessionZone the session zone
     *
     * @return the value
     *
     * @throws ValueFormatException if the literal is not valid for the type
     */
    public FieldValue decodeLiteral(String literal,
                                    TypeDescriptor type,
                                    ZoneId sessionZone) {
        requireNonNull(literal,
                       "ValueCodec.decodeLiteral: literal must be non-null");
        requireNonNull(type, "ValueCodec.decodeLiteral: type must be non-null");
        requireNonNull(sessionZone,
                       "ValueCodec.decodeLiteral: sessionZone must be " +
                       "non-null");
        try {
            return complex.decodeElement(literal.trim(), type, sessionZone);
        } catch (CodecException ce) {
            logFailure("decode literal", literal, type, ce);
            throw ce;
        }
    }

    /**
     * Encodes a value as a SQL literal of the given type.
     *
     * @param value the value
     * @param type the target type
     *
     * @return the literal
     *
     * @throws EncodingTypeMismatchException if the value cannot be
     * represented by the type
     */
    public String encode(FieldValue value, TypeDescriptor type) {
        try {
            return encoder.encode(value, type);
        } catch (CodecException ce) {
            logFailure("encode", String.valueOf(value), type, ce);
            throw ce;
        }
    }

    /**
     * Encodes a value as a SQL literal of the type named by the text, for
     * example "ARRAY[INTERVAL DAY TO SECOND]".
     *
     * @param value the value
     * @param targetTypeText the target type
     *
     * @return the literal
     *
     * @throws UnsupportedTypeException if the type text is not valid
     * @throws EncodingTypeMismatchException if the value cannot be
     * represented by the type
     */
    public String encode(FieldValue value, String targetTypeText) {
        requireNonNull(targetTypeText,
                       "ValueCodec.encode: targetTypeText must be non-null");
        return encode(value, TypeNameParser.parse(targetTypeText));
    }

    private void logFailure(String op,
                            String text,
                            TypeDescriptor type,
                            CodecException ce) {
        if (LogUtil.isFineEnabled(logger)) {
            LogUtil.logFine(logger, "Failed to " + op + " '" +
                            LogUtil.abbreviate(text, LOG_TEXT_MAX) + "' as " +
                            type.getTypeName(), ce);
        }
    }
}
