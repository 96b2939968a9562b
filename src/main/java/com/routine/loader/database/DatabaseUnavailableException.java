package com.routine.loader.database;

/**
 * The connection to the database is gone. Aborts the whole batch.
 */
public class DatabaseUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
