package com.routine.loader.database;

/**
 * A statement or query failed. Fatal for the routine being loaded, never retried.
 */
public class DataLayerException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String sql;

    public DataLayerException(String message, String sql, Throwable cause) {
        super(message + System.lineSeparator() + "Query: " + sql.trim(), cause);
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }
}
