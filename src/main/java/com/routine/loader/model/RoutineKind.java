package com.routine.loader.model;

import java.util.Locale;

/**
 * Kind of a stored routine.
 */
public enum RoutineKind {
    PROCEDURE,
    FUNCTION;

    public String sqlKeyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RoutineKind fromSql(String keyword) {
        return valueOf(keyword.trim().toUpperCase(Locale.ROOT));
    }
}
