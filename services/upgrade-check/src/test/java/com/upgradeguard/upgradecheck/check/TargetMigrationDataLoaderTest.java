package com.upgradeguard.upgradecheck.check;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.upgradeguard.reconciliation.MigrationId;
import com.upgradeguard.reconciliation.catalog.ManifestFormatException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

@DisplayName("TargetMigrationDataLoader")
class TargetMigrationDataLoaderTest {

    private final DefaultResourceLoader resourceLoader = new DefaultResourceLoader();

    @Test
    @DisplayName("loads the manifest from the classpath")
    void loadsManifest() {
        var loader =
                new TargetMigrationDataLoader(
                        resourceLoader, "classpath:fixtures/target-manifest.json", List.of());

        var manifest = loader.loadManifest();

        assertThat(manifest.version()).isEqualTo("9.0");
        assertThat(manifest.graph().contains(MigrationId.of("analytics", "0001_initial"))).isTrue();
    }

    @Test
    @DisplayName("merges every configured exception catalog")
    void mergesCatalogs() {
        var loader =
                new TargetMigrationDataLoader(
                        resourceLoader,
                        "classpath:fixtures/target-manifest.json",
                        List.of(
                                "classpath:fixtures/legacy-exceptions.json",
                                "classpath:fixtures/removed-apps.json"));

        var exceptions = loader.loadLegacyExceptions();

        assertThat(exceptions.ids())
                .containsExactlyInAnyOrder(
                        MigrationId.of("zerver", "0005_auto_20150920_1340"),
                        MigrationId.of("social_django", "0001_initial"));
    }

    @Test
    @DisplayName("the bundled catalog loads and exempts removed apps")
    void bundledCatalog() {
        var loader =
                new TargetMigrationDataLoader(
                        resourceLoader,
                        "classpath:fixtures/target-manifest.json",
                        List.of("classpath:catalog/legacy-migrations.json"));

        var exceptions = loader.loadLegacyExceptions();

        assertThat(exceptions.contains(MigrationId.of("zerver", "0005_auto_20150920_1340")))
                .isTrue();
        assertThat(exceptions.contains(MigrationId.of("social_django", "0001_initial"))).isTrue();
        assertThat(exceptions.groups()).hasSize(3);
    }

    @Test
    @DisplayName("no catalogs means no exceptions")
    void noCatalogs() {
        var loader =
                new TargetMigrationDataLoader(
                        resourceLoader, "classpath:fixtures/target-manifest.json", List.of());

        assertThat(loader.loadLegacyExceptions().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("loads file: locations")
    void loadsFileLocation(@TempDir Path dir) throws IOException {
        Path manifest = dir.resolve("migrations.json");
        Files.writeString(
                manifest,
                "{\"version\":\"10.0\",\"migrations\":[{\"namespace\":\"a\",\"name\":\"0001\"}]}");
        var loader =
                new TargetMigrationDataLoader(
                        resourceLoader, manifest.toUri().toString(), List.of());

        assertThat(loader.loadManifest().version()).isEqualTo("10.0");
    }

    @Test
    @DisplayName("a missing catalog is reported with its location")
    void missingCatalog() {
        var loader =
                new TargetMigrationDataLoader(
                        resourceLoader,
                        "classpath:fixtures/target-manifest.json",
                        List.of("classpath:fixtures/nope.json"));

        assertThatThrownBy(loader::loadLegacyExceptions)
                .isInstanceOf(ManifestFormatException.class)
                .hasMessageContaining("classpath:fixtures/nope.json")
                .hasMessageContaining("does not exist");
    }
}
