package com.upgradeguard.reconciliation;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether the migrations recorded as applied in a live database are all accounted for by a
 * target codebase.
 *
 * <p>An applied migration is accounted for if it is
 *
 * <ul>
 *   <li>a key of the target graph,
 *   <li>listed in the {@code replaces} of some graph entry (it was squashed into that entry), or
 *   <li>a legacy exception.
 * </ul>
 *
 * <p>WHY the {@code replaces} lists count: applied migrations are never retracted from a
 * database's bookkeeping, so squashed and exempted history must count as present. Checking key
 * membership alone would report every squash as a downgrade.
 *
 * <p>Pure and total: the inputs are never modified, iteration order never affects the outcome,
 * and overlapping {@code replaces} lists or exception entries are harmless.
 */
public final class MigrationReconciler {

    private MigrationReconciler() {
        // utility class
    }

    /**
     * Reconciles {@code applied} against a target graph and known exceptions.
     *
     * @param applied migrations recorded as applied in the live database
     * @param graph target migrations keyed by id
     * @param legacyExceptions migrations that may be ignored
     * @return {@link ReconciliationResult#ok()} or an incompatible result listing the missing ids
     */
    public static ReconciliationResult reconcile(
            Set<MigrationId> applied,
            Map<MigrationId, MigrationGraphEntry> graph,
            Set<MigrationId> legacyExceptions) {
        Objects.requireNonNull(applied, "applied must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(legacyExceptions, "legacyExceptions must not be null");

        Set<MigrationId> missing = new HashSet<>(applied);
        missing.removeAll(legacyExceptions);
        for (Map.Entry<MigrationId, MigrationGraphEntry> node : graph.entrySet()) {
            if (missing.isEmpty()) {
                break;
            }
            missing.remove(node.getKey());
            node.getValue().replaces().forEach(missing::remove);
        }

        return missing.isEmpty()
                ? ReconciliationResult.ok()
                : ReconciliationResult.incompatible(missing);
    }

    /** Reconciles against a {@link MigrationGraph} and a {@link LegacyExceptionSet}. */
    public static ReconciliationResult reconcile(
            Set<MigrationId> applied, MigrationGraph graph, LegacyExceptionSet legacyExceptions) {
        return reconcile(applied, graph.asMap(), legacyExceptions.ids());
    }
}
