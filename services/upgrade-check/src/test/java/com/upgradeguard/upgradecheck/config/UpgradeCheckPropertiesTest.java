package com.upgradeguard.upgradecheck.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("UpgradeCheckProperties")
class UpgradeCheckPropertiesTest {

    @Test
    @DisplayName("applies defaults for unset fields")
    void defaults() {
        var properties =
                new UpgradeCheckProperties(
                        null, null, null, 0, "file:migrations.json", null, null, null);

        assertThat(properties.enabled()).isTrue();
        assertThat(properties.configFile())
                .isEqualTo("/etc/upgrade-guard/upgrade-guard.properties");
        assertThat(properties.configKey()).isEqualTo("postgresql.version");
        assertThat(properties.minimumEngineVersion()).isEqualTo(12);
        assertThat(properties.legacyExceptions()).isEmpty();
    }

    @Test
    @DisplayName("keeps explicit values")
    void explicitValues() {
        var locations = new ArrayList<>(List.of("classpath:a.json", "classpath:b.json"));
        var properties =
                new UpgradeCheckProperties(
                        false,
                        "/tmp/guard.properties",
                        "engine.version",
                        14,
                        "file:migrations.json",
                        locations,
                        "/srv/version.txt",
                        "9.0");
        locations.clear();

        assertThat(properties.enabled()).isFalse();
        assertThat(properties.configKey()).isEqualTo("engine.version");
        assertThat(properties.minimumEngineVersion()).isEqualTo(14);
        assertThat(properties.legacyExceptions())
                .containsExactly("classpath:a.json", "classpath:b.json");
    }
}
