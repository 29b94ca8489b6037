package com.tessera.database.model;

/**
 * Converts an attribute between its stored form and the value callers see.
 *
 * <p>Implementations must satisfy {@code decode(encode(x)).equals(x)} for every value they accept,
 * and pass null through unchanged.
 */
public interface AttributeCast {

    /** Name used in {@code cast(attribute, name)} declarations. */
    String name();

    /** Caller value to stored value. */
    Object encode(Object value);

    /** Stored value (as the driver returned it) to caller value. */
    Object decode(Object value);
}
