package com.upgradeguard.reconciliation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A named batch of historical migrations in one namespace that may be ignored during
 * reconciliation, for example every migration of a component that has since been removed.
 *
 * @param reason operator-facing explanation of why these migrations are safe to ignore
 * @param namespace namespace shared by every migration in the group
 * @param names migration names within {@code namespace}
 */
public record LegacyExceptionGroup(String reason, String namespace, List<String> names) {

    public LegacyExceptionGroup {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be null or blank");
        }
        reason = reason == null ? "" : reason;
        names = names == null ? List.of() : List.copyOf(names);
        for (String name : names) {
            if (name.isBlank()) {
                throw new IllegalArgumentException("names must not contain blank entries");
            }
        }
    }

    /** Expands the group into individual migration ids. */
    public Set<MigrationId> ids() {
        Set<MigrationId> ids = new LinkedHashSet<>();
        for (String name : names) {
            ids.add(new MigrationId(namespace, name));
        }
        return ids;
    }
}
