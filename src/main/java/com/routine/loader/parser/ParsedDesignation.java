package com.routine.loader.parser;

import com.routine.loader.model.Designation;

import lombok.Value;

/**
 * A designation together with the positions of its comment line and the {@code begin} line.
 */
@Value
public class ParsedDesignation {
    Designation designation;
    int lineIndex;
    int beginLineIndex;
}
