/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

/**
 * A FieldValue instance representing a character string. CHAR, VARCHAR and
 * LONG VARCHAR values decode to StringValue, as do container columns when
 * the codec is configured to return complex types as text.
 */
public class StringValue extends FieldValue {

    private final String value;

    /**
     * Creates a new instance.
     *
     * @param value the value to use
     */
    public StringValue(String value) {
        super();
        requireNonNull(value, "StringValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.STRING;
    }

    /**
     * Returns the String value
     *
     * @return the String value of this object
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof StringValue) {
            return value.equals(((StringValue)other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
