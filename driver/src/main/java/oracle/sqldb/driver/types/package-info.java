/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

/**
 * Descriptions of SQL types: {@link oracle.sqldb.driver.types.TypeDescriptor}
 * and its parts, a parser for SQL type text and the mapping from the type
 * oids found in column metadata.
 */
package oracle.sqldb.driver.types;
