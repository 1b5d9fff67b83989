/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver;

/**
 * A base exception for the exceptions thrown by the value codec. All of the
 * exceptions defined in this package extend this exception. The codec throws
 * Java exceptions such as {@link IllegalArgumentException} and
 * {@link NullPointerException} directly for invalid arguments.
 * <p>
 * Every instance carries the name of the SQL type being decoded or encoded
 * and, where one exists, the text that could not be handled. A failure never
 * produces a partial value: decoding or encoding a single field either
 * succeeds completely or throws.
 */
public class CodecException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String typeName;

    private final String text;

    /**
     * @hidden
     * @param msg the message
     * @param typeName the SQL type name, may be null
     * @param text the offending text, may be null
     */
    public /*protected*/ CodecException(String msg,
                                        String typeName,
                                        String text) {
        super(msg);
        this.typeName = typeName;
        this.text = text;
    }

    /**
     * @hidden
     * @param msg the message
     * @param typeName the SQL type name, may be null
     * @param text the offending text, may be null
     * @param cause the cause
     */
    public /*protected*/ CodecException(String msg,
                                        String typeName,
                                        String text,
                                        Throwable cause) {
        super(msg, cause);
        this.typeName = typeName;
        this.text = text;
    }

    /**
     * Returns the SQL type name involved in the failure, or null if it is
     * not known.
     *
     * @return the type name
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * Returns the raw text or literal that could not be handled, or null if
     * the failure is not tied to a piece of text.
     *
     * @return the text
     */
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append(": ")
            .append(getMessage());
        if (typeName != null) {
            sb.append(" [type=").append(typeName);
            if (text != null) {
                sb.append(", text='").append(text).append("'");
            }
            sb.append("]");
        }
        return sb.toString();
    }
}
