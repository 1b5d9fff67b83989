/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.types;

import static oracle.sqldb.driver.util.CheckNull.requireNonNull;

/**
 * A named field of a ROW type.
 */
public final class RowField {

    private final String name;
    private final TypeDescriptor type;

    public RowField(String name, TypeDescriptor type) {
        requireNonNull(name, "RowField: name must be non-null");
        requireNonNull(type, "RowField: type must be non-null");
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeDescriptor getType() {
        return type;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof RowField)) {
            return false;
        }
        RowField o = (RowField) other;
        return name.equals(o.name) && type.equals(o.type);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + type.hashCode();
    }

    @Override
    public String toString() {
        return name + " " + type.getTypeName();
    }
}
