package com.upgradeguard.versiongate;

/**
 * Base class for the fatal outcomes of the database engine version gate. Both require an operator
 * to act; neither is retried.
 */
public abstract class EngineVersionException extends RuntimeException {

    private final int observedMajorVersion;

    protected EngineVersionException(String message, int observedMajorVersion) {
        super(message);
        this.observedMajorVersion = observedMajorVersion;
    }

    /** Major version reported by the live database engine. */
    public int observedMajorVersion() {
        return observedMajorVersion;
    }
}
