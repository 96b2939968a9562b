package com.routine.loader.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Designation of a stored routine: its type plus the table and columns the type carries.
 * Only {@code bulk_insert} has a table; only {@code bulk_insert}, {@code rows_with_key} and
 * {@code rows_with_index} have columns.
 */
@Value
public class Designation {
    @NonNull
    DesignationType type;
    String tableName;
    @NonNull
    List<String> columns;

    public static Designation of(DesignationType type) {
        return new Designation(type, null, List.of());
    }

    public static Designation withColumns(DesignationType type, List<String> columns) {
        return new Designation(type, null, List.copyOf(columns));
    }

    public static Designation bulkInsert(String tableName, List<String> columns) {
        return new Designation(DesignationType.BULK_INSERT, tableName, List.copyOf(columns));
    }

    public boolean isBulkInsert() {
        return type == DesignationType.BULK_INSERT;
    }
}
