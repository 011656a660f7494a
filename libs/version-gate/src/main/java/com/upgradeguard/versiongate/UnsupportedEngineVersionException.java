package com.upgradeguard.versiongate;

/** Thrown when the live database engine is older than the minimum supported major version. */
public class UnsupportedEngineVersionException extends EngineVersionException {

    private final int minimumMajorVersion;

    public UnsupportedEngineVersionException(int observedMajorVersion, int minimumMajorVersion) {
        super(
                ("Unsupported database engine version %d: upgrade the database to version %d"
                                + " or newer.")
                        .formatted(observedMajorVersion, minimumMajorVersion),
                observedMajorVersion);
        this.minimumMajorVersion = minimumMajorVersion;
    }

    public int minimumMajorVersion() {
        return minimumMajorVersion;
    }
}
