/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.util.Arrays;

import com.fasterxml.jackson.core.Base64Variants;

/**
 * A FieldValue instance representing a byte string, the decoded form of
 * BINARY, VARBINARY and LONG VARBINARY values. When rendered as JSON the
 * bytes are encoded as Base64 using {@link #encodeBase64}.
 */
public class BinaryValue extends FieldValue {

    private final byte[] value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public BinaryValue(byte[] value) {
        super();
        requireNonNull(value, "BinaryValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.BINARY;
    }

    /**
     * Returns the binary value of this object. The array is not copied.
     *
     * @return the binary value
     */
    public byte[] getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof BinaryValue) {
            return Arrays.equals(value, ((BinaryValue)other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    /**
     * Encode the specified byte array into a Base64 encoded string.
     * This string can be decoded using {@link #decodeBase64}.
     *
     * @param buffer the input buffer
     *
     * @return the encoded string
     */
    public static String encodeBase64(byte[] buffer) {
        requireNonNull(buffer,
                       "BinaryValue.encodeBase64: buffer must be non-null");
        return Base64Variants.getDefaultVariant().encode(buffer);
    }

    /**
     * Decode the specified Base64 string into a byte array. The string must
     * have been encoded using {@link #encodeBase64} or the same algorithm.
     *
     * @param binString the encoded input string
     *
     * @return the decoded array
     *
     * @throws IllegalArgumentException if the value is not a valid Base64
     * string
     */
    public static byte[] decodeBase64(String binString) {
        requireNonNull(binString,
                       "BinaryValue.decodeBase64: binString must be non-null");
        return Base64Variants.getDefaultVariant().decode(binString);
    }
}
