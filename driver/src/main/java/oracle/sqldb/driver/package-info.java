/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

/**
 * The value codec of the SQL database driver. The codec converts between
 * the textual wire representation of column values and typed
 * {@link oracle.sqldb.driver.values.FieldValue} instances, and encodes values
 * back into SQL literal text for statements executed without server-side
 * parameter binding.
 * <p>
 * The entry point is {@link oracle.sqldb.driver.codec.ValueCodec}. Column
 * types are described by {@link oracle.sqldb.driver.types.TypeDescriptor}.
 * This package holds the exceptions thrown by the codec, all of which extend
 * {@link oracle.sqldb.driver.CodecException}.
 */
package oracle.sqldb.driver;
