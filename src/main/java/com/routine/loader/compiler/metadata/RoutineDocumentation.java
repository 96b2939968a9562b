package com.routine.loader.compiler.metadata;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Documentation of a stored routine for the wrapper generator.
 */
@Value
@Builder
@Jacksonized
public class RoutineDocumentation {
    String shortDescription;
    String longDescription;
    @Builder.Default
    List<ParameterDocumentation> parameters = List.of();
}
