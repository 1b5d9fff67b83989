/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

/**
 * The classes in this package represent values decoded from the text form
 * used by the database server. All data classes in this package are
 * instances of {@link oracle.sqldb.driver.values.FieldValue}. There is a
 * well-defined mapping between server types and instances of
 * {@link oracle.sqldb.driver.values.FieldValue}.
 * <table>
 *   <caption>The mappings between server types and driver classes</caption>
 *   <tr><th>Server Type</th><th>Class</th></tr>
 *   <tr><td>BOOLEAN</td>
 *       <td>{@link oracle.sqldb.driver.values.BooleanValue}</td></tr>
 *   <tr><td>INTEGER</td>
 *       <td>{@link oracle.sqldb.driver.values.LongValue}</td></tr>
 *   <tr><td>FLOAT</td>
 *       <td>{@link oracle.sqldb.driver.values.DoubleValue}</td></tr>
 *   <tr><td>NUMERIC</td>
 *       <td>{@link oracle.sqldb.driver.values.NumberValue}</td></tr>
 *   <tr><td>CHAR, VARCHAR</td>
 *       <td>{@link oracle.sqldb.driver.values.StringValue}</td></tr>
 *   <tr><td>BINARY, VARBINARY</td>
 *       <td>{@link oracle.sqldb.driver.values.BinaryValue}</td></tr>
 *   <tr><td>UUID</td><td>{@link oracle.sqldb.driver.values.UuidValue}</td></tr>
 *   <tr><td>DATE</td><td>{@link oracle.sqldb.driver.values.DateValue}</td></tr>
 *   <tr><td>TIME</td><td>{@link oracle.sqldb.driver.values.TimeValue}</td></tr>
 *   <tr><td>TIMETZ</td>
 *       <td>{@link oracle.sqldb.driver.values.TimeTzValue}</td></tr>
 *   <tr><td>TIMESTAMP</td>
 *       <td>{@link oracle.sqldb.driver.values.TimestampValue}</td></tr>
 *   <tr><td>TIMESTAMPTZ</td>
 *       <td>{@link oracle.sqldb.driver.values.TimestampTzValue}</td></tr>
 *   <tr><td>INTERVAL</td>
 *       <td>{@link oracle.sqldb.driver.values.IntervalValue}</td></tr>
 *   <tr><td>ARRAY</td><td>{@link oracle.sqldb.driver.values.ArrayValue}</td></tr>
 *   <tr><td>SET</td><td>{@link oracle.sqldb.driver.values.SetValue}</td></tr>
 *   <tr><td>ROW</td><td>{@link oracle.sqldb.driver.values.RowValue}</td></tr>
 * </table>
 * <p>
 * SQL NULL at any level is {@link oracle.sqldb.driver.values.NullValue}.
 */
package oracle.sqldb.driver.values;
