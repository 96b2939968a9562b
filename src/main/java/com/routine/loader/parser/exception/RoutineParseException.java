package com.routine.loader.parser.exception;

import com.routine.loader.compiler.RoutineCompileException;

/**
 * The source of a stored routine violates the annotation syntax.
 */
public class RoutineParseException extends RoutineCompileException {

    private static final long serialVersionUID = 1L;

    public RoutineParseException(String format, Object... args) {
        super(format, args);
    }
}
