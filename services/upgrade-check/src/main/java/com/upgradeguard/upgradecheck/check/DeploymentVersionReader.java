package com.upgradeguard.upgradecheck.check;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines the version string of the currently running deployment, for diagnostics only.
 *
 * <p>Sources, in order: the first non-blank line of the version file; the explicitly configured
 * version; {@code "unknown"}. A version file that cannot be read is logged and skipped, since the
 * value never affects the outcome of the check.
 */
public class DeploymentVersionReader {

    static final String UNKNOWN = "unknown";

    private static final Logger log = LoggerFactory.getLogger(DeploymentVersionReader.class);

    private final Path versionFile;
    private final String configuredVersion;

    /**
     * @param versionFile file holding the deployed version, or null
     * @param configuredVersion fallback version, or null
     */
    public DeploymentVersionReader(Path versionFile, String configuredVersion) {
        this.versionFile = versionFile;
        this.configuredVersion = configuredVersion;
    }

    public String readDeployedVersion() {
        if (versionFile != null) {
            if (Files.isReadable(versionFile)) {
                try {
                    List<String> lines = Files.readAllLines(versionFile);
                    for (String line : lines) {
                        if (!line.isBlank()) {
                            return line.trim();
                        }
                    }
                    log.warn("Version file {} is empty", versionFile);
                } catch (IOException e) {
                    log.warn("Failed to read version file {}: {}", versionFile, e.getMessage());
                }
            } else {
                log.warn("Version file {} is not readable", versionFile);
            }
        }
        if (configuredVersion != null && !configuredVersion.isBlank()) {
            return configuredVersion.trim();
        }
        return UNKNOWN;
    }
}
