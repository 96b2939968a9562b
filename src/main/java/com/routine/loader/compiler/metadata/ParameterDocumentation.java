package com.routine.loader.compiler.metadata;

import com.routine.loader.compiler.mapper.WrapperType;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Documentation of one routine parameter for the wrapper generator.
 */
@Value
@Builder
@Jacksonized
public class ParameterDocumentation {
    String name;
    WrapperType wrapperType;
    String dataTypeDescriptor;
    // null when the doc block has no @param for this parameter
    String description;
}
