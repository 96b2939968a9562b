package com.routine.loader.parser;

import java.util.Map;
import java.util.SortedMap;

import com.routine.loader.model.Designation;
import com.routine.loader.model.ExtendedParameter;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything the annotation scanner found in the source of a stored routine.
 */
@Value
@Builder
public class RoutineAnnotations {
    @NonNull
    RoutineHeader header;
    @NonNull
    Designation designation;
    @NonNull
    SortedMap<String, String> placeholders;
    @NonNull
    Map<String, ExtendedParameter> extendedParameters;
}
