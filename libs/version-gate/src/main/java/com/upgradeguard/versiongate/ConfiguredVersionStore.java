package com.upgradeguard.versiongate;

import java.util.OptionalInt;

/**
 * Where the deployment records which database engine major version it was set up against.
 *
 * <p>Implementations must make {@link #persistMajorVersion(int)} atomic with respect to concurrent
 * invocations of the gate (two upgrade attempts racing on a fresh configuration). The gate itself
 * takes no locks.
 */
public interface ConfiguredVersionStore {

    /**
     * Returns the configured major version, or empty when none is configured. A stored value of
     * {@code 0} means unset.
     *
     * @throws VersionStoreException if the store exists but cannot be read or holds a non-integer
     */
    OptionalInt readConfiguredMajorVersion();

    /**
     * Records {@code majorVersion} as the configured value.
     *
     * @throws VersionStoreException if the value cannot be written
     */
    void persistMajorVersion(int majorVersion);
}
