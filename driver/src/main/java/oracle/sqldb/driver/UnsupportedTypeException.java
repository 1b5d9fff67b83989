/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver;

/**
 * Thrown when a type cannot be handled by the codec: an unknown type name
 * or server type oid, malformed type text, or an interval field range that
 * is not one of the legal start/end combinations.
 */
public class UnsupportedTypeException extends CodecException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     * @param typeName the type name or type text that was rejected
     */
    public UnsupportedTypeException(String msg, String typeName) {
        super(msg, typeName, null);
    }
}
