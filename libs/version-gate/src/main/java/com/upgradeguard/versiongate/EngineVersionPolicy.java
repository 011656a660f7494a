package com.upgradeguard.versiongate;

/**
 * Explicit configuration for {@link DatabaseVersionGate}.
 *
 * @param minimumMajorVersion lowest database engine major version that is supported
 */
public record EngineVersionPolicy(int minimumMajorVersion) {

    /** PostgreSQL 12 is the oldest supported engine. */
    public static final int DEFAULT_MINIMUM_MAJOR_VERSION = 12;

    public EngineVersionPolicy {
        if (minimumMajorVersion <= 0) {
            throw new IllegalArgumentException("minimumMajorVersion must be positive");
        }
    }

    public static EngineVersionPolicy defaults() {
        return new EngineVersionPolicy(DEFAULT_MINIMUM_MAJOR_VERSION);
    }

    public boolean supports(int observedMajorVersion) {
        return observedMajorVersion >= minimumMajorVersion;
    }
}
