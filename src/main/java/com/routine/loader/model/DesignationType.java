package com.routine.loader.model;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Calling convention of a stored routine, as declared by the {@code -- type:} comment.
 */
public enum DesignationType {
    BULK_INSERT("bulk_insert", Arguments.TABLE_AND_COLUMNS),
    FUNCTION("function", Arguments.NONE),
    HIDDEN("hidden", Arguments.NONE),
    LOG("log", Arguments.NONE),
    MAP("map", Arguments.NONE),
    NONE("none", Arguments.NONE),
    ROW0("row0", Arguments.NONE),
    ROW1("row1", Arguments.NONE),
    ROWS("rows", Arguments.NONE),
    ROWS_WITH_INDEX("rows_with_index", Arguments.COLUMNS),
    ROWS_WITH_KEY("rows_with_key", Arguments.COLUMNS),
    SINGLETON0("singleton0", Arguments.NONE),
    SINGLETON1("singleton1", Arguments.NONE),
    TABLE("table", Arguments.NONE);

    /**
     * Shape of the text following the designation name.
     */
    public enum Arguments {
        /**
         * Nothing may follow the designation name.
         */
        NONE,

        /**
         * A comma separated list of column names.
         */
        COLUMNS,

        /**
         * A table name followed by a comma separated list of column names.
         */
        TABLE_AND_COLUMNS
    }

    private final String sqlName;
    private final Arguments arguments;

    DesignationType(String sqlName, Arguments arguments) {
        this.sqlName = sqlName;
        this.arguments = arguments;
    }

    @JsonValue
    public String getSqlName() {
        return sqlName;
    }

    public Arguments getArguments() {
        return arguments;
    }

    /**
     * Looks up a designation by its exact lower case name.
     */
    public static Optional<DesignationType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(t -> t.sqlName.equals(trimmed))
                .findFirst();
    }

    @JsonCreator
    public static DesignationType fromJson(String name) {
        return fromName(name).orElseThrow(() -> new IllegalArgumentException("Unknown designation type: " + name));
    }
}
