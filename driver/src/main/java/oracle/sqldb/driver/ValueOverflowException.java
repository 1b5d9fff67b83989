/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver;

/**
 * Thrown when well-formed text holds a number that does not fit the target
 * representation, for example an INTEGER outside the 64-bit range, a DECIMAL
 * exponent that overflows the scale, or an INTERVAL whose microsecond total
 * overflows. The codec never wraps or truncates such values.
 */
public class ValueOverflowException extends CodecException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     * @param typeName the SQL type name
     * @param text the offending text
     * @param cause the cause, may be null
     */
    public ValueOverflowException(String msg,
                                  String typeName,
                                  String text,
                                  Throwable cause) {
        super(msg, typeName, text, cause);
    }
}
