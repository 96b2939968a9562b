package com.routine.loader.util;

import java.nio.charset.StandardCharsets;

import lombok.experimental.UtilityClass;

/**
 * Conversions of values returned by JDBC for catalog queries.
 */
@UtilityClass
public class SqlValues {

    /**
     * Returns the value as a string. Binary strings, as some servers return for {@code describe}, are decoded
     * as UTF-8.
     */
    public String asString(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return value.toString();
    }
}
