package com.upgradeguard.reconciliation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Migrations that are known to be safe to ignore even though no entry of the target graph
 * accounts for them: components that were removed or renamed, or history whose squash metadata was
 * itself incomplete.
 *
 * <p>This is data about the target system, not logic. Instances are built from declarative
 * catalogs (see {@code LegacyExceptionCatalogLoader}) and passed into {@link MigrationReconciler}.
 * Duplicates across groups collapse into a single id.
 */
public final class LegacyExceptionSet {

    private static final LegacyExceptionSet EMPTY = new LegacyExceptionSet(List.of(), Set.of());

    private final List<LegacyExceptionGroup> groups;
    private final Set<MigrationId> ids;

    private LegacyExceptionSet(List<LegacyExceptionGroup> groups, Set<MigrationId> ids) {
        this.groups = List.copyOf(groups);
        this.ids = Set.copyOf(ids);
    }

    public static LegacyExceptionSet empty() {
        return EMPTY;
    }

    /** Builds a set from grouped exception data. */
    public static LegacyExceptionSet fromGroups(Collection<LegacyExceptionGroup> groups) {
        Set<MigrationId> ids = new LinkedHashSet<>();
        for (LegacyExceptionGroup group : groups) {
            ids.addAll(group.ids());
        }
        return new LegacyExceptionSet(new ArrayList<>(groups), ids);
    }

    /** Builds an ungrouped set from individual ids. */
    public static LegacyExceptionSet of(MigrationId... ids) {
        return new LegacyExceptionSet(List.of(), new LinkedHashSet<>(List.of(ids)));
    }

    /** Returns a set containing the groups and ids of both this set and {@code other}. */
    public LegacyExceptionSet merge(LegacyExceptionSet other) {
        List<LegacyExceptionGroup> mergedGroups = new ArrayList<>(groups);
        mergedGroups.addAll(other.groups);
        Set<MigrationId> mergedIds = new LinkedHashSet<>(ids);
        mergedIds.addAll(other.ids);
        return new LegacyExceptionSet(mergedGroups, mergedIds);
    }

    public boolean contains(MigrationId id) {
        return ids.contains(id);
    }

    /** Every exempted id, flattened across groups. */
    public Set<MigrationId> ids() {
        return ids;
    }

    public List<LegacyExceptionGroup> groups() {
        return groups;
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }
}
