package com.routine.loader.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A routine parameter whose value is a delimited list packed into a single string.
 * Declared with {@code -- param: <name> <type> [delimiter enclosure escape]}.
 */
@Value
@Builder
@Jacksonized
public class ExtendedParameter {
    public static final char DEFAULT_DELIMITER = ',';
    public static final char DEFAULT_ENCLOSURE = '"';
    public static final char DEFAULT_ESCAPE = '\\';

    String name;
    String dataType;
    @Builder.Default
    char delimiter = DEFAULT_DELIMITER;
    @Builder.Default
    char enclosure = DEFAULT_ENCLOSURE;
    @Builder.Default
    char escape = DEFAULT_ESCAPE;
}
