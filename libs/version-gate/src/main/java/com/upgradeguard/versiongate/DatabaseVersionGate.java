package com.upgradeguard.versiongate;

import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the live database engine's major version against the deployment's configured value and
 * the minimum supported version.
 *
 * <ol>
 *   <li>No configured value: the observed version is persisted and becomes the configured one.
 *   <li>Configured value differs from the observed one: {@link ConfigurationMismatchException}.
 *   <li>Observed version below the policy minimum: {@link UnsupportedEngineVersionException}.
 * </ol>
 *
 * <p>The minimum-version check always runs after configuration has been reconciled and always
 * uses the observed version. A fresh deployment on an unsupported engine therefore persists the
 * observed value and then fails.
 *
 * <p>WHY a mismatch is fatal rather than auto-corrected: the configured value drives other
 * tooling (backups, tuning, package pins). If the engine was upgraded underneath it, an operator
 * has to update that tooling before any release is activated against the new engine.
 */
public class DatabaseVersionGate {

    private static final Logger log = LoggerFactory.getLogger(DatabaseVersionGate.class);

    private final EngineVersionPolicy policy;
    private final ConfiguredVersionStore store;

    public DatabaseVersionGate(EngineVersionPolicy policy, ConfiguredVersionStore store) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Runs the gate for the version the live database reports.
     *
     * @param observedMajorVersion major version reported by the database engine
     * @return how the configured value was reconciled
     * @throws ConfigurationMismatchException if a different version is configured
     * @throws UnsupportedEngineVersionException if the observed version is too old
     * @throws VersionStoreException if the configured value cannot be read or persisted
     */
    public GateDecision check(int observedMajorVersion) {
        GateDecision decision =
                reconcileConfiguration(observedMajorVersion, store.readConfiguredMajorVersion());

        if (!policy.supports(observedMajorVersion)) {
            throw new UnsupportedEngineVersionException(
                    observedMajorVersion, policy.minimumMajorVersion());
        }
        return decision;
    }

    private GateDecision reconcileConfiguration(int observed, OptionalInt configured) {
        if (configured.isEmpty() || configured.getAsInt() == 0) {
            log.debug(
                    "No database engine version configured; recording observed version {}",
                    observed);
            store.persistMajorVersion(observed);
            return GateDecision.PERSISTED;
        }
        if (configured.getAsInt() != observed) {
            throw new ConfigurationMismatchException(configured.getAsInt(), observed);
        }
        log.debug("Configured database engine version {} matches the database", observed);
        return GateDecision.MATCH;
    }

    public EngineVersionPolicy policy() {
        return policy;
    }
}
