/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

/**
 * Conversion between column text and values. {@link
 * oracle.sqldb.driver.codec.ValueCodec} is the entry point; it combines the
 * scalar codec, the recursive decoder for ARRAY, SET and ROW text and the
 * literal encoder, configured by {@link
 * oracle.sqldb.driver.codec.CodecOptions}.
 */
package oracle.sqldb.driver.codec;
