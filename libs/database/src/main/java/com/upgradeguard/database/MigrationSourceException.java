package com.upgradeguard.database;

/** Thrown when the live database cannot be queried for its engine version or migration history. */
public class MigrationSourceException extends RuntimeException {

    public MigrationSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
