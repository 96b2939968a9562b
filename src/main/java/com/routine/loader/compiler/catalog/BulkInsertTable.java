package com.routine.loader.compiler.catalog;

import java.util.List;

import lombok.Value;

/**
 * Columns of the table a bulk insert routine inserts into.
 */
@Value
public class BulkInsertTable {
    String tableName;
    List<String> fields;
    List<String> columnTypes;
}
