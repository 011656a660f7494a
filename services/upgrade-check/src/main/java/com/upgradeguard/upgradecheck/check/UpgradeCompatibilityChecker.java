package com.upgradeguard.upgradecheck.check;

import com.upgradeguard.database.AppliedMigrationReader;
import com.upgradeguard.database.EngineVersionReader;
import com.upgradeguard.reconciliation.LegacyExceptionSet;
import com.upgradeguard.reconciliation.MigrationId;
import com.upgradeguard.reconciliation.MigrationReconciler;
import com.upgradeguard.reconciliation.ReconciliationResult;
import com.upgradeguard.reconciliation.catalog.TargetManifest;
import com.upgradeguard.versiongate.DatabaseVersionGate;
import com.upgradeguard.versiongate.GateDecision;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the two gates of the upgrade check, top to bottom. The first failing gate throws and
 * nothing after it runs.
 *
 * <ol>
 *   <li>{@link DatabaseVersionGate} against the engine major version the database reports.
 *   <li>{@link MigrationReconciler} over the applied migrations, the target manifest's graph and
 *       the legacy exception catalogs.
 * </ol>
 *
 * <p>WHY the engine gate goes first: reading migration history from an engine this release does
 * not support can fail in confusing ways, and a mismatch needs operator attention whatever the
 * history says.
 */
public class UpgradeCompatibilityChecker {

    private static final Logger log = LoggerFactory.getLogger(UpgradeCompatibilityChecker.class);

    private final EngineVersionReader engineVersionReader;
    private final DatabaseVersionGate versionGate;
    private final AppliedMigrationReader appliedMigrationReader;
    private final TargetMigrationDataLoader targetData;
    private final DeploymentVersionReader deploymentVersionReader;

    public UpgradeCompatibilityChecker(
            EngineVersionReader engineVersionReader,
            DatabaseVersionGate versionGate,
            AppliedMigrationReader appliedMigrationReader,
            TargetMigrationDataLoader targetData,
            DeploymentVersionReader deploymentVersionReader) {
        this.engineVersionReader = engineVersionReader;
        this.versionGate = versionGate;
        this.appliedMigrationReader = appliedMigrationReader;
        this.targetData = targetData;
        this.deploymentVersionReader = deploymentVersionReader;
    }

    /**
     * Runs both gates.
     *
     * @return the (compatible) reconciliation result
     * @throws com.upgradeguard.versiongate.EngineVersionException if the version gate fails
     * @throws MigrationIncompatibilityException if applied migrations are unaccounted for
     */
    public ReconciliationResult check() {
        int observed = engineVersionReader.readMajorVersion();
        GateDecision decision = versionGate.check(observed);
        log.debug("Database engine version gate passed ({}, version {})", decision, observed);

        Set<MigrationId> applied = appliedMigrationReader.readApplied();
        TargetManifest manifest = targetData.loadManifest();
        LegacyExceptionSet exceptions = targetData.loadLegacyExceptions();

        ReconciliationResult result =
                MigrationReconciler.reconcile(applied, manifest.graph(), exceptions);
        if (!result.compatible()) {
            throw new MigrationIncompatibilityException(
                    new IncompatibilityReport(
                            result.missing(),
                            deploymentVersionReader.readDeployedVersion(),
                            manifest.version()));
        }
        log.debug(
                "All {} applied migrations are accounted for by target version {}",
                applied.size(),
                manifest.version());
        return result;
    }
}
