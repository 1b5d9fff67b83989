/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

/**
 * A FieldValue instance representing a double precision floating point
 * value, including NaN and the infinities.
 */
public class DoubleValue extends FieldValue {

    private final double value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public DoubleValue(double value) {
        super();
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.DOUBLE;
    }

    /**
     * Returns the double value of this object
     *
     * @return the double value
     */
    public double getValue() {
        return value;
    }

    /**
     * Returns true if the value is NaN or one of the infinities.
     *
     * @return true for the special values
     */
    public boolean isSpecial() {
        return Double.isNaN(value) || Double.isInfinite(value);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof DoubleValue) {
            /* Use Double.compare to handle values like NaN */
            return Double.compare(value, ((DoubleValue)other).value) == 0;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return ((Double) value).hashCode();
    }
}
