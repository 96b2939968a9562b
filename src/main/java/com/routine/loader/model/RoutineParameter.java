package com.routine.loader.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A parameter of a stored routine as reported by the database catalog, optionally merged with
 * the list codec of an {@link ExtendedParameter} of the same name.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RoutineParameter {
    String name;
    String dataType;
    String numericPrecision;
    String numericScale;
    String characterSetName;
    String collationName;
    String dtdIdentifier;
    String dataTypeDescriptor;

    // Set only for extended parameters.
    Character delimiter;
    Character enclosure;
    Character escape;

    /**
     * Returns a copy of this parameter with the list type and codec of the extended parameter.
     */
    public RoutineParameter mergeWith(ExtendedParameter extended) {
        return toBuilder()
                .dataType(extended.getDataType())
                .delimiter(extended.getDelimiter())
                .enclosure(extended.getEnclosure())
                .escape(extended.getEscape())
                .build();
    }

    @JsonIgnore
    public boolean isExtended() {
        return delimiter != null;
    }
}
