package com.upgradeguard.reconciliation.catalog;

import com.upgradeguard.reconciliation.MigrationGraph;
import java.util.Objects;

/**
 * A target release's migration graph together with the release's version string.
 *
 * @param version version of the target release, used in diagnostics only
 * @param graph every migration the target release defines
 */
public record TargetManifest(String version, MigrationGraph graph) {

    public TargetManifest {
        Objects.requireNonNull(graph, "graph must not be null");
        if (version == null || version.isBlank()) {
            version = "unknown";
        }
    }
}
