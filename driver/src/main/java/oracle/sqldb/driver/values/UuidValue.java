/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

import java.util.UUID;

/**
 * A FieldValue instance representing a 128-bit UUID.
 */
public class UuidValue extends FieldValue {

    private final UUID value;

    public UuidValue(UUID value) {
        super();
        requireNonNull(value, "UuidValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.UUID;
    }

    public UUID getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof UuidValue) {
            return value.equals(((UuidValue)other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
