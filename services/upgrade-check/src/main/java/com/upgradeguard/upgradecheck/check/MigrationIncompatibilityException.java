package com.upgradeguard.upgradecheck.check;

/**
 * Thrown when the live database has applied migrations the target release does not account for.
 * Usually a downgrade, or a switch to a branch that never had those migrations.
 */
public class MigrationIncompatibilityException extends RuntimeException {

    private final IncompatibilityReport report;

    public MigrationIncompatibilityException(IncompatibilityReport report) {
        super(report.summary());
        this.report = report;
    }

    public IncompatibilityReport report() {
        return report;
    }
}
