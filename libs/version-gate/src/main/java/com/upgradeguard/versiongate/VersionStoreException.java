package com.upgradeguard.versiongate;

/** Thrown when the configured-version store cannot be read or written. */
public class VersionStoreException extends RuntimeException {

    public VersionStoreException(String message) {
        super(message);
    }

    public VersionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
