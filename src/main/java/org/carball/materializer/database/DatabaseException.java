package org.carball.materializer.database;

/**
 * Failure talking to the analytical database outside of backfill chunks.
 */
public class DatabaseException extends Exception {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
