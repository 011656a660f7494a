package com.upgradeguard.reconciliation;

import java.util.Collection;
import java.util.List;

/**
 * Outcome of reconciling an applied-migration set against a target graph.
 *
 * <p>Either compatible (empty {@code missing}) or incompatible, in which case {@code missing} holds
 * every applied migration the target cannot account for, sorted by namespace then name. An
 * incompatible result with an empty list cannot be constructed.
 *
 * @param compatible true if every applied migration is accounted for
 * @param missing unaccounted applied migrations, sorted (empty when compatible)
 */
public record ReconciliationResult(boolean compatible, List<MigrationId> missing) {

    private static final ReconciliationResult COMPATIBLE =
            new ReconciliationResult(true, List.of());

    public ReconciliationResult {
        missing = missing == null ? List.of() : List.copyOf(missing);
        if (compatible && !missing.isEmpty()) {
            throw new IllegalArgumentException(
                    "a compatible result cannot report missing migrations");
        }
        if (!compatible && missing.isEmpty()) {
            throw new IllegalArgumentException(
                    "an incompatible result must report missing migrations");
        }
    }

    /** The compatible result. */
    public static ReconciliationResult ok() {
        return COMPATIBLE;
    }

    /** An incompatible result; {@code missing} is copied and sorted. */
    public static ReconciliationResult incompatible(Collection<MigrationId> missing) {
        return new ReconciliationResult(false, missing.stream().sorted().toList());
    }

    public int missingCount() {
        return missing.size();
    }
}
