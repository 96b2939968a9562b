package com.routine.loader.parser;

import com.routine.loader.model.RoutineKind;

import lombok.Value;

/**
 * The {@code create procedure|function <name>} header of a stored routine.
 */
@Value
public class RoutineHeader {
    RoutineKind kind;
    String name;
    // line on which the header starts
    int lineIndex;
}
