/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.math.BigDecimal;

/**
 * A FieldValue instance representing an exact decimal value. The scale of
 * the {@link BigDecimal} is kept as decoded; "0.0000000000" and "0" are
 * different values for {@link #equals}. Use {@link #numericEquals} to
 * compare magnitudes.
 */
public class NumberValue extends FieldValue {

    private final BigDecimal value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public NumberValue(BigDecimal value) {
        super();
        requireNonNull(value, "NumberValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.NUMBER;
    }

    /**
     * Returns the number value of this object
     *
     * @return the number value
     */
    public BigDecimal getValue() {
        return value;
    }

    /**
     * Compares numeric value, ignoring scale.
     *
     * @param other the value to compare with
     *
     * @return true if both represent the same number
     */
    public boolean numericEquals(NumberValue other) {
        requireNonNull(other, "NumberValue.numericEquals: other must be " +
                       "non-null");
        return value.compareTo(other.value) == 0;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof NumberValue) {
            return value.equals(((NumberValue) other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
