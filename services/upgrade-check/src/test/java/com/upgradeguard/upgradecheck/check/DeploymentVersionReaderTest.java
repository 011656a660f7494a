package com.upgradeguard.upgradecheck.check;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DeploymentVersionReader")
class DeploymentVersionReaderTest {

    @TempDir Path dir;

    @Test
    @DisplayName("reads the first non-blank line of the version file")
    void readsVersionFile() throws IOException {
        Path file = dir.resolve("version.txt");
        Files.writeString(file, "\n  9.2-5-gabc1234 \nignored\n");

        assertThat(new DeploymentVersionReader(file, "fallback").readDeployedVersion())
                .isEqualTo("9.2-5-gabc1234");
    }

    @Test
    @DisplayName("falls back to the configured version when the file is missing")
    void fallsBackToConfigured() {
        var reader = new DeploymentVersionReader(dir.resolve("absent.txt"), " 9.1 ");

        assertThat(reader.readDeployedVersion()).isEqualTo("9.1");
    }

    @Test
    @DisplayName("falls back to the configured version when the file is empty")
    void emptyFile() throws IOException {
        Path file = dir.resolve("version.txt");
        Files.writeString(file, "\n\n");

        assertThat(new DeploymentVersionReader(file, "9.1").readDeployedVersion())
                .isEqualTo("9.1");
    }

    @Test
    @DisplayName("is 'unknown' with no source")
    void unknownWithoutSource() {
        assertThat(new DeploymentVersionReader(null, null).readDeployedVersion())
                .isEqualTo(DeploymentVersionReader.UNKNOWN);
    }
}
