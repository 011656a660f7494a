package com.upgradeguard.database;

import com.upgradeguard.reconciliation.MigrationId;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.MigrationInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads applied migrations from Flyway's schema history.
 *
 * <p>Flyway has no namespaces, so every migration is placed in the namespace configured for the
 * database. Versioned migrations are named by their version ({@code V3_1__add_index.sql} becomes
 * {@code 3.1}); repeatable migrations by their description. Failed attempts and Flyway's own
 * synthetic rows (schema creation, baseline markers) are not counted as applied.
 */
public class FlywayAppliedMigrationReader implements AppliedMigrationReader {

    private static final Logger log = LoggerFactory.getLogger(FlywayAppliedMigrationReader.class);

    private final Flyway flyway;
    private final String namespace;

    public FlywayAppliedMigrationReader(Flyway flyway, String namespace) {
        this.flyway = Objects.requireNonNull(flyway, "flyway must not be null");
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be null or blank");
        }
        this.namespace = namespace;
    }

    @Override
    public Set<MigrationId> readApplied() {
        MigrationInfo[] history;
        try {
            history = flyway.info().applied();
        } catch (FlywayException e) {
            throw new MigrationSourceException("Failed to read Flyway schema history", e);
        }
        Set<MigrationId> applied = new HashSet<>();
        for (MigrationInfo info : history) {
            if (!info.getState().isApplied()
                    || info.getState().isFailed()
                    || info.getType().isSynthetic()) {
                continue;
            }
            applied.add(new MigrationId(namespace, nameOf(info)));
        }
        log.debug("Read {} applied Flyway migrations for namespace {}", applied.size(), namespace);
        return applied;
    }

    private static String nameOf(MigrationInfo info) {
        return info.getVersion() != null ? info.getVersion().getVersion() : info.getDescription();
    }
}
