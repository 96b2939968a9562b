package com.routine.loader.compiler.catalog.exception;

import com.routine.loader.compiler.RoutineCompileException;

/**
 * The annotations of a stored routine do not agree with what the database catalog reports.
 */
public class RoutineReconciliationException extends RoutineCompileException {

    private static final long serialVersionUID = 1L;

    public RoutineReconciliationException(String format, Object... args) {
        super(format, args);
    }
}
