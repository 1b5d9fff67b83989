/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver;

/**
 * Thrown when raw text does not match the grammar of the type it is decoded
 * as: a malformed number, an unparseable date, an unterminated container, a
 * row with the wrong number of fields and so on.
 */
public class ValueFormatException extends CodecException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     * @param typeName the SQL type name
     * @param text the offending text
     */
    public ValueFormatException(String msg, String typeName, String text) {
        super(msg, typeName, text);
    }

    /**
     * @hidden
     * @param msg the message
     * @param typeName the SQL type name
     * @param text the offending text
     * @param cause the cause
     */
    public ValueFormatException(String msg,
                                String typeName,
                                String text,
                                Throwable cause) {
        super(msg, typeName, text, cause);
    }
}
