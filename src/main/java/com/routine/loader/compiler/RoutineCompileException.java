package com.routine.loader.compiler;

/**
 * A condition that stops the loading of one stored routine. Other routines are not affected.
 */
public class RoutineCompileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RoutineCompileException(String format, Object... args) {
        super(String.format(format, args));
    }
}
