package com.routine.loader.database;

import java.util.List;
import java.util.Map;

/**
 * Statement execution against the database the routines are loaded into.
 *
 * Row maps are keyed case-insensitively by column label. Every method reports failure with a
 * {@link DataLayerException}; a lost connection is reported with a {@link DatabaseUnavailableException}.
 */
public interface DataLayer extends AutoCloseable {

    /**
     * Executes a statement that returns no rows.
     */
    void executeNone(String sql);

    /**
     * Executes a query and returns all rows.
     */
    List<Map<String, Object>> executeRows(String sql);

    /**
     * Executes a query that selects zero or one row with a single column.
     *
     * @return the value of the column, or {@code null} if no row was selected
     */
    Object executeSingleton0(String sql);

    /**
     * Escapes special characters in a string for use in an SQL string literal.
     */
    String realEscapeString(String value);

    /**
     * Returns the value as a quoted SQL string literal, or {@code null} as the SQL null literal.
     */
    default String quoteString(String value) {
        if (value == null) {
            return "null";
        }
        return "'" + realEscapeString(value) + "'";
    }

    @Override
    void close();
}
