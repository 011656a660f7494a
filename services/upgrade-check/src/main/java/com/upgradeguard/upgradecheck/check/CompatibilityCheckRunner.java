package com.upgradeguard.upgradecheck.check;

import com.upgradeguard.database.MigrationSourceException;
import com.upgradeguard.reconciliation.MigrationId;
import com.upgradeguard.reconciliation.catalog.ManifestFormatException;
import com.upgradeguard.versiongate.ConfigurationMismatchException;
import com.upgradeguard.versiongate.UnsupportedEngineVersionException;
import com.upgradeguard.versiongate.VersionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Runs the upgrade check once at startup and turns its outcome into the process exit status.
 *
 * <p>Success is silent. Every failure is logged at error level and yields exit status {@link
 * #EXIT_FAILURE}; none is retried, since each reflects durable state that re-running cannot change.
 */
public class CompatibilityCheckRunner implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    private static final Logger log = LoggerFactory.getLogger(CompatibilityCheckRunner.class);

    private final UpgradeCompatibilityChecker checker;
    private int exitCode = EXIT_SUCCESS;

    public CompatibilityCheckRunner(UpgradeCompatibilityChecker checker) {
        this.checker = checker;
    }

    @Override
    public void run(String... args) {
        try {
            checker.check();
            exitCode = EXIT_SUCCESS;
        } catch (ConfigurationMismatchException e) {
            log.error(
                    "Configured database engine version {} does not match the database version {}",
                    e.configuredMajorVersion(),
                    e.observedMajorVersion());
            log.error(e.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (UnsupportedEngineVersionException e) {
            log.error(
                    "Database engine version {} is not supported (minimum {})",
                    e.observedMajorVersion(),
                    e.minimumMajorVersion());
            log.error(e.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (MigrationIncompatibilityException e) {
            report(e.report());
            exitCode = EXIT_FAILURE;
        } catch (ManifestFormatException | MigrationSourceException | VersionStoreException e) {
            log.error("Upgrade check could not be completed: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    private void report(IncompatibilityReport report) {
        log.error(IncompatibilityReport.HEADER);
        for (MigrationId id : report.missing()) {
            log.error("  {} {}", id.namespace(), id.name());
        }
        log.error(report.summary());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
