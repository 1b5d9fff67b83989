/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.values;

/**
 * A FieldValue instance representing SQL NULL. It is a singleton; identity
 * comparison with {@link #getInstance} is sufficient. An empty container and
 * a container holding a NullValue are both distinct from NullValue.
 */
public class NullValue extends FieldValue {

    private static final NullValue INSTANCE = new NullValue();

    private NullValue() {
        super();
    }

    @Override
    public Type getType() {
        return Type.NULL;
    }

    /**
     * Returns an instance (singleton) of NullValue.
     *
     * @return the value
     */
    public static NullValue getInstance() {
        return INSTANCE;
    }

    @Override
    public String toJson() {
        return "null";
    }

    @Override
    public boolean equals(Object other) {
        return other == INSTANCE;
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }
}
