package com.upgradeguard.versiongate;

/**
 * Thrown when the configured engine major version differs from the one the live database reports.
 *
 * <p>Never corrected automatically: rewriting the configured value would hide an accidental
 * connection to the wrong database cluster.
 */
public class ConfigurationMismatchException extends EngineVersionException {

    private final int configuredMajorVersion;

    public ConfigurationMismatchException(int configuredMajorVersion, int observedMajorVersion) {
        super(
                ("Database engine version mismatch: configured major version is %d but the"
                                + " database reports %d. Update the configured version manually"
                                + " if the database was upgraded on purpose.")
                        .formatted(configuredMajorVersion, observedMajorVersion),
                observedMajorVersion);
        this.configuredMajorVersion = configuredMajorVersion;
    }

    public int configuredMajorVersion() {
        return configuredMajorVersion;
    }
}
