package com.routine.loader.compiler.mapper;

/**
 * Abstract type of a routine parameter as seen by generated wrapper code.
 */
public enum WrapperType {
    INTEGER,
    FLOAT,
    TEXT,

    /**
     * Either a delimited string or a list of integers, for {@code list_of_int} extended parameters.
     */
    TEXT_OR_INTEGER_LIST
}
