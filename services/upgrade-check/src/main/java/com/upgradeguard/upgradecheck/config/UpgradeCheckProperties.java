package com.upgradeguard.upgradecheck.config;

import com.upgradeguard.versiongate.EngineVersionPolicy;
import com.upgradeguard.versiongate.PropertiesFileVersionStore;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the upgrade check.
 *
 * <p>Bound from the {@code upgradeguard.check.*} prefix:
 *
 * <pre>
 * upgradeguard:
 *   check:
 *     config-file: /etc/zulip/upgrade-guard.properties
 *     config-key: postgresql.version
 *     minimum-engine-version: 12
 *     target-manifest: file:/home/zulip/deployments/next/migrations.json
 *     legacy-exceptions:
 *       - file:/home/zulip/deployments/next/legacy-migrations.json
 *     deployed-version-file: /home/zulip/deployments/current/version.txt
 * </pre>
 *
 * @param enabled run the check on startup (disabled in tests that only load the context)
 * @param configFile properties file holding the configured engine major version
 * @param configKey key of the engine major version inside {@code configFile}
 * @param minimumEngineVersion oldest supported engine major version
 * @param targetManifest Spring resource location of the target release's migration manifest
 * @param legacyExceptions Spring resource locations of legacy exception catalogs, merged in order
 * @param deployedVersionFile file holding the running deployment's version (optional)
 * @param deployedVersion running deployment's version when no file is configured (optional)
 */
@ConfigurationProperties(prefix = "upgradeguard.check")
@Validated
public record UpgradeCheckProperties(
        Boolean enabled,
        @NotBlank String configFile,
        @NotBlank String configKey,
        @Min(1) int minimumEngineVersion,
        @NotBlank String targetManifest,
        List<String> legacyExceptions,
        String deployedVersionFile,
        String deployedVersion) {

    /**
     * Compact constructor, applies defaults for optional fields. Runs before Bean Validation, so
     * defaults satisfy constraints.
     */
    public UpgradeCheckProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (configFile == null || configFile.isBlank()) {
            configFile = "/etc/upgrade-guard/upgrade-guard.properties";
        }
        if (configKey == null || configKey.isBlank()) {
            configKey = PropertiesFileVersionStore.DEFAULT_KEY;
        }
        if (minimumEngineVersion <= 0) {
            minimumEngineVersion = EngineVersionPolicy.DEFAULT_MINIMUM_MAJOR_VERSION;
        }
        legacyExceptions = legacyExceptions == null ? List.of() : List.copyOf(legacyExceptions);
    }
}
