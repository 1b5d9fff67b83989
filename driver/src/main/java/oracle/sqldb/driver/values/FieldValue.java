/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNullIAE;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.util.UUID;

/**
 * FieldValue is the base class of all values decoded from, or encoded to,
 * the text form used by the database server. Each value is an instance of
 * FieldValue allowing access to its type and its value as well as additional
 * utility methods that operate on FieldValue.
 * <p>
 * FieldValue instances are typed, based on the {@link Type} enumeration.
 * Scalar types map to a single Java value, for example
 * {@link Type#NUMBER} holds a {@link BigDecimal} and
 * {@link Type#TIMESTAMPTZ} holds an {@link OffsetDateTime}. The container
 * types {@link Type#ARRAY}, {@link Type#SET} and {@link Type#ROW} hold other
 * FieldValue instances and may nest to any depth.
 * <p>
 * SQL NULL is always represented by the singleton {@link NullValue}, at the
 * top level as well as inside containers. A Java null is never a valid
 * FieldValue.
 * <p>
 * FieldValue has convenience interfaces to return values of the scalar
 * types. Unlike a database cast these do not coerce: asking for a value of
 * a type the instance does not have throws ClassCastException.
 * <p>
 * Scalar FieldValue instances are immutable. Container instances are
 * mutable while they are being built and are not thread-safe; values
 * returned by the codec are not modified by it afterwards.
 */
public abstract class FieldValue {

    /**
     * The type of a value.
     */
    public enum Type {
        /** The SQL NULL value */
        NULL,
        /** A boolean value */
        BOOLEAN,
        /** A 64-bit signed integer */
        INTEGER,
        /** A double precision floating point value */
        DOUBLE,
        /** An exact decimal value */
        NUMBER,
        /** A character string */
        STRING,
        /** A byte string */
        BINARY,
        /** A UUID */
        UUID,
        /** A calendar date */
        DATE,
        /** A time of day */
        TIME,
        /** A time of day with a UTC offset */
        TIMETZ,
        /** A date and time of day */
        TIMESTAMP,
        /** A date and time of day with a UTC offset */
        TIMESTAMPTZ,
        /** A year-month or day-time interval */
        INTERVAL,
        /** An ordered list of values */
        ARRAY,
        /** A collection of distinct values */
        SET,
        /** An ordered list of named values */
        ROW;
    }

    public FieldValue() {
    }

    /**
     * Returns the type of the object
     *
     * @return the type
     */
    public abstract Type getType();

    /**
     * Returns a long value for the field if the value is an integer.
     *
     * @return a long value
     *
     * @throws ClassCastException if this is not a LongValue
     */
    public long getLong() {
        return asLong().getValue();
    }

    /**
     * Returns a double value for the field if the value is a floating
     * point value.
     *
     * @return a double value
     *
     * @throws ClassCastException if this is not a DoubleValue
     */
    public double getDouble() {
        return asDouble().getValue();
    }

    /**
     * Returns a BigDecimal value for the field if the value is a decimal.
     *
     * @return a BigDecimal value
     *
     * @throws ClassCastException if this is not a NumberValue
     */
    public BigDecimal getNumber() {
        return asNumber().getValue();
    }

    /**
     * Returns a binary byte array value for the field if the value is
     * binary
     *
     * @return a byte array
     *
     * @throws ClassCastException if this is not a BinaryValue
     */
    public byte[] getBinary() {
        return asBinary().getValue();
    }

    /**
     * Returns a boolean value for the field if the value is a boolean.
     *
     * @return the boolean value
     *
     * @throws ClassCastException if this is not a BooleanValue
     */
    public boolean getBoolean() {
        return asBoolean().getValue();
    }

    /**
     * Returns a String value for the field if the value is a character
     * string.
     *
     * @return a String value
     *
     * @throws ClassCastException if this is not a StringValue
     */
    public String getString() {
        return asString().getValue();
    }

    /**
     * @return the UUID
     *
     * @throws ClassCastException if this is not a UuidValue
     */
    public UUID getUuid() {
        return asUuid().getValue();
    }

    /**
     * @return the date
     *
     * @throws ClassCastException if this is not a DateValue
     */
    public LocalDate getDate() {
        return asDate().getValue();
    }

    /**
     * @return the time
     *
     * @throws ClassCastException if this is not a TimeValue
     */
    public LocalTime getTime() {
        return asTime().getValue();
    }

    /**
     * @return the time with offset
     *
     * @throws ClassCastException if this is not a TimeTzValue
     */
    public OffsetTime getTimeTz() {
        return asTimeTz().getValue();
    }

    /**
     * @return the timestamp
     *
     * @throws ClassCastException if this is not a TimestampValue
     */
    public LocalDateTime getTimestamp() {
        return asTimestamp().getValue();
    }

    /**
     * @return the timestamp with offset
     *
     * @throws ClassCastException if this is not a TimestampTzValue
     */
    public OffsetDateTime getTimestampTz() {
        return asTimestampTz().getValue();
    }

    /**
     * Casts the object to LongValue.
     *
     * @return a LongValue
     *
     * @throws ClassCastException if this is not a LongValue
     */
    public LongValue asLong() {
        return (LongValue) this;
    }

    /**
     * Casts to DoubleValue.
     *
     * @return a DoubleValue
     *
     * @throws ClassCastException if this is not a DoubleValue
     */
    public DoubleValue asDouble() {
        return (DoubleValue) this;
    }

    /**
     * Casts the object to NumberValue.
     *
     * @return a NumberValue
     *
     * @throws ClassCastException if this is not a NumberValue
     */
    public NumberValue asNumber() {
        return (NumberValue) this;
    }

    /**
     * Casts to StringValue.
     *
     * @return a StringValue
     *
     * @throws ClassCastException if this is not a StringValue
     */
    public StringValue asString() {
        return (StringValue) this;
    }

    /**
     * Casts the object to BooleanValue.
     *
     * @return a BooleanValue
     *
     * @throws ClassCastException if this is not a BooleanValue
     */
    public BooleanValue asBoolean() {
        return (BooleanValue) this;
    }

    /**
     * Casts the object to BinaryValue.
     *
     * @return a BinaryValue
     *
     * @throws ClassCastException if this is not a BinaryValue
     */
    public BinaryValue asBinary() {
        return (BinaryValue) this;
    }

    public UuidValue asUuid() {
        return (UuidValue) this;
    }

    public DateValue asDate() {
        return (DateValue) this;
    }

    public TimeValue asTime() {
        return (TimeValue) this;
    }

    public TimeTzValue asTimeTz() {
        return (TimeTzValue) this;
    }

    public TimestampValue asTimestamp() {
        return (TimestampValue) this;
    }

    public TimestampTzValue asTimestampTz() {
        return (TimestampTzValue) this;
    }

    /**
     * Casts the object to IntervalValue.
     *
     * @return an IntervalValue
     *
     * @throws ClassCastException if this is not an IntervalValue
     */
    public IntervalValue asInterval() {
        return (IntervalValue) this;
    }

    /**
     * Casts the object to ArrayValue.
     *
     * @return a ArrayValue
     *
     * @throws ClassCastException if this is not a ArrayValue
     */
    public ArrayValue asArray() {
        return (ArrayValue) this;
    }

    /**
     * Casts the object to SetValue.
     *
     * @return a SetValue
     *
     * @throws ClassCastException if this is not a SetValue
     */
    public SetValue asSet() {
        return (SetValue) this;
    }

    /**
     * Casts the object to RowValue.
     *
     * @return a RowValue
     *
     * @throws ClassCastException if this is not a RowValue
     */
    public RowValue asRow() {
        return (RowValue) this;
    }

    /**
     * Casts to NullValue.
     *
     * @return a NullValue
     *
     * @throws ClassCastException if this is not a NullValue
     */
    public NullValue asNull() {
        return (NullValue) this;
    }

    /**
     * Returns whether this is an SQL NULL value.
     *
     * @return true if this FieldValue is of type NullValue, false otherwise
     */
    public boolean isNull() {
        return this == NullValue.getInstance();
    }

    /**
     * Returns whether this is an ArrayValue
     *
     * @return true if this FieldValue is of type ArrayValue, false otherwise
     */
    public boolean isArray() {
        return (getType() == Type.ARRAY);
    }

    /**
     * Returns whether this is a SetValue
     *
     * @return true if this FieldValue is of type SetValue, false otherwise
     */
    public boolean isSet() {
        return (getType() == Type.SET);
    }

    /**
     * Returns whether this is a RowValue
     *
     * @return true if this FieldValue is of type RowValue, false otherwise
     */
    public boolean isRow() {
        return (getType() == Type.ROW);
    }

    /**
     * Returns whether this is a container value, that is an array, set or
     * row value.
     *
     * @return Whether this is a container value.
     */
    public boolean isContainer() {
        Type t = getType();
        return (t == Type.ARRAY || t == Type.SET || t == Type.ROW);
    }

    /**
     * Returns whether this is a numeric value (integer, double or number).
     *
     * @return Whether this is a numeric value.
     */
    public boolean isNumeric() {
        Type t = getType();
        switch(t) {
        case INTEGER:
        case DOUBLE:
        case NUMBER:
            return true;
        default:
            return false;
        }
    }

    /**
     * Returns a JSON representation of the value. Temporal values are
     * rendered as strings in the server's text format, intervals as
     * ISO-8601 durations, binary values as Base64 strings, sets as arrays
     * and rows as objects.
     *
     * @return the JSON representation of this value.
     */
    public String toJson() {
        JsonSerializer handler = new JsonSerializer();
        try {
            FieldValueEventHandler.generate(this, handler);
            return handler.toString();
        } catch (IOException ioe) {
            throw new IllegalArgumentException(
                "Failed to serialize FieldValue into JSON: " +
                ioe.getMessage());
        }
    }

    /**
     * Returns a String representation of the value, consistent with
     * representation as JSON strings.
     *
     * @return the String value
     */
    @Override
    public String toString() {
        return toJson();
    }

    /*
     * Internal utility methods
     */
    static void validateName(String name, FieldValue value) {
        requireNonNullIAE(name, "Field name is null");
        requireNonNullIAE(value, "FieldValue is null");
    }
}
