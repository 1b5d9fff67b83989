/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver;

/**
 * Thrown by the literal encoder when a value's shape is incompatible with
 * the requested target type, for example a row value encoded as an INTEGER,
 * a row with the wrong number of fields, or an interval that cannot be
 * expressed in the target field range without losing information.
 */
public class EncodingTypeMismatchException extends CodecException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     * @param typeName the target SQL type name
     * @param text a rendering of the rejected value, may be null
     */
    public EncodingTypeMismatchException(String msg,
                                         String typeName,
                                         String text) {
        super(msg, typeName, text);
    }
}
