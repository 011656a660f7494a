package com.upgradeguard.versiongate;

/** Passing outcomes of {@link DatabaseVersionGate#check(int)}. */
public enum GateDecision {

    /** No version was configured; the observed version was persisted as the configured one. */
    PERSISTED,

    /** The configured version equals the observed one. */
    MATCH
}
