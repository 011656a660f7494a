package com.upgradeguard.upgradecheck.config;

import com.upgradeguard.database.AppliedMigrationReader;
import com.upgradeguard.database.DatabaseSourceConfig;
import com.upgradeguard.database.EngineVersionReader;
import com.upgradeguard.upgradecheck.check.CompatibilityCheckRunner;
import com.upgradeguard.upgradecheck.check.DeploymentVersionReader;
import com.upgradeguard.upgradecheck.check.TargetMigrationDataLoader;
import com.upgradeguard.upgradecheck.check.UpgradeCompatibilityChecker;
import com.upgradeguard.versiongate.ConfiguredVersionStore;
import com.upgradeguard.versiongate.DatabaseVersionGate;
import com.upgradeguard.versiongate.EngineVersionPolicy;
import com.upgradeguard.versiongate.PropertiesFileVersionStore;
import java.nio.file.Path;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the version gate, the live-database readers and the reconciliation engine into an {@link
 * UpgradeCompatibilityChecker}. Every collaborator is built from {@link UpgradeCheckProperties};
 * nothing reads the environment directly.
 */
@Configuration
@Import(DatabaseSourceConfig.class)
public class UpgradeCheckConfig {

    @Bean
    @ConditionalOnMissingBean
    public ConfiguredVersionStore configuredVersionStore(UpgradeCheckProperties properties) {
        return new PropertiesFileVersionStore(
                Path.of(properties.configFile()), properties.configKey());
    }

    @Bean
    public DatabaseVersionGate databaseVersionGate(
            UpgradeCheckProperties properties, ConfiguredVersionStore store) {
        return new DatabaseVersionGate(
                new EngineVersionPolicy(properties.minimumEngineVersion()), store);
    }

    @Bean
    public TargetMigrationDataLoader targetMigrationDataLoader(
            ResourceLoader resourceLoader, UpgradeCheckProperties properties) {
        return new TargetMigrationDataLoader(
                resourceLoader, properties.targetManifest(), properties.legacyExceptions());
    }

    @Bean
    public DeploymentVersionReader deploymentVersionReader(UpgradeCheckProperties properties) {
        String file = properties.deployedVersionFile();
        return new DeploymentVersionReader(
                file == null || file.isBlank() ? null : Path.of(file),
                properties.deployedVersion());
    }

    @Bean
    public UpgradeCompatibilityChecker upgradeCompatibilityChecker(
            EngineVersionReader engineVersionReader,
            DatabaseVersionGate databaseVersionGate,
            AppliedMigrationReader appliedMigrationReader,
            TargetMigrationDataLoader targetMigrationDataLoader,
            DeploymentVersionReader deploymentVersionReader) {
        return new UpgradeCompatibilityChecker(
                engineVersionReader,
                databaseVersionGate,
                appliedMigrationReader,
                targetMigrationDataLoader,
                deploymentVersionReader);
    }

    @Bean
    @ConditionalOnProperty(
            prefix = "upgradeguard.check",
            name = "enabled",
            havingValue = "true",
            matchIfMissing = true)
    public CompatibilityCheckRunner compatibilityCheckRunner(UpgradeCompatibilityChecker checker) {
        return new CompatibilityCheckRunner(checker);
    }
}
