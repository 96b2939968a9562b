package com.routine.loader.compiler.mapper;

import com.routine.loader.compiler.RoutineCompileException;

/**
 * A catalog type has no {@link WrapperType}.
 */
public class UnsupportedColumnTypeException extends RoutineCompileException {

    private static final long serialVersionUID = 1L;
    private final String columnType;

    public UnsupportedColumnTypeException(String columnType, String parameterName) {
        super("Unsupported column type '%s' of parameter '%s'.", columnType, parameterName);
        this.columnType = columnType;
    }

    public String getColumnType() {
        return columnType;
    }
}
