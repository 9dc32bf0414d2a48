package com.hcltech.fuzz.common;

import com.hcltech.fuzz.common.exceptions.InvalidTypeException;

/**
 * Checks for values used as set members or map keys. Such values need value-based
 * {@code equals}/{@code hashCode}: {@code null} is refused, and so are arrays, whose hash is
 * their identity.
 */
public interface Hashing {

    static <T> T requireValueHashable(T value, String role) {
        if (value == null)
            throw new InvalidTypeException(role + " must not be null", null);
        if (value.getClass().isArray())
            throw new InvalidTypeException(role + " must be a hashable value, not an array", value);
        return value;
    }
}
