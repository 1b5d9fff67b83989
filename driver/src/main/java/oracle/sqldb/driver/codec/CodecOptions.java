/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.codec;

import java.util.logging.Logger;

import oracle.sqldb.driver.util.LogUtil;

/**
 * CodecOptions holds the settings used to create a {@link ValueCodec}.
 * Setters return this instance so calls can be chained:
 * <pre>
 *    ValueCodec codec = new ValueCodec(new CodecOptions()
 *        .setComplexTypesAsText(true)
 *        .setLogger(myLogger));
 * </pre>
 * The codec copies the settings when it is created; changing an instance
 * afterwards has no effect on codecs already built from it.
 */
public class CodecOptions {

    private Logger logger = LogUtil.getDefaultLogger();
    private boolean complexTypesAsText;
    private boolean standardConformingStrings = true;
    private boolean padFixedLength = true;

    /**
     * Sets the logger used by the codec. The default is the logger named
     * "oracle.sqldb.driver". A null logger disables logging.
     *
     * @param logger the logger
     *
     * @return this
     */
    public CodecOptions setLogger(Logger logger) {
        this.logger = logger;
        return this;
    }

    /**
     * Returns the logger, or null if logging is disabled.
     *
     * @return the logger
     */
    public Logger getLogger() {
        return logger;
    }

    /**
     * Tells the codec to return ARRAY, SET and ROW columns as the raw
     * {@link oracle.sqldb.driver.values.StringValue} sent by the server
     * rather than decoding them. Defaults to false.
     *
     * @param value true or false
     *
     * @return this
     */
    public CodecOptions setComplexTypesAsText(boolean value) {
        complexTypesAsText = value;
        return this;
    }

    public boolean getComplexTypesAsText() {
        return complexTypesAsText;
    }

    /**
     * Tells the encoder whether the server treats backslashes in ordinary
     * string literals as literal characters. When false, any string holding
     * a backslash is encoded in the escaped E'...' form. Defaults to true.
     *
     * @param value true or false
     *
     * @return this
     */
    public CodecOptions setStandardConformingStrings(boolean value) {
        standardConformingStrings = value;
        return this;
    }

    public boolean getStandardConformingStrings() {
        return standardConformingStrings;
    }

    /**
     * Tells the decoder to pad CHAR values with spaces, and BINARY values
     * with zero bytes, to their declared length. Defaults to true.
     *
     * @param value true or false
     *
     * @return this
     */
    public CodecOptions setPadFixedLength(boolean value) {
        padFixedLength = value;
        return this;
    }

    public boolean getPadFixedLength() {
        return padFixedLength;
    }
}
