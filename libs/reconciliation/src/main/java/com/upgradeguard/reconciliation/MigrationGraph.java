package com.upgradeguard.reconciliation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The target codebase's known migrations, keyed by {@link MigrationId}.
 *
 * <p>A key appears at most once. {@link Builder#add(MigrationGraphEntry)} rejects a second entry
 * for an id that is already present, since a well-formed target never declares the same migration
 * twice. {@code replaces} lists of different entries may overlap.
 */
public final class MigrationGraph {

    private static final MigrationGraph EMPTY = new MigrationGraph(Map.of());

    private final Map<MigrationId, MigrationGraphEntry> entries;

    private MigrationGraph(Map<MigrationId, MigrationGraphEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /** Returns a graph with no migrations. */
    public static MigrationGraph empty() {
        return EMPTY;
    }

    /** Builds a graph from the given entries, rejecting duplicate keys. */
    public static MigrationGraph of(MigrationGraphEntry... entries) {
        Builder builder = builder();
        for (MigrationGraphEntry entry : entries) {
            builder.add(entry);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Read-only map view, keyed by migration id. */
    public Map<MigrationId, MigrationGraphEntry> asMap() {
        return entries;
    }

    public Set<MigrationId> keys() {
        return entries.keySet();
    }

    public Collection<MigrationGraphEntry> entries() {
        return entries.values();
    }

    public boolean contains(MigrationId id) {
        return entries.containsKey(id);
    }

    public int size() {
        return entries.size();
    }

    /** Accumulates entries in insertion order. Not thread-safe. */
    public static final class Builder {

        private final Map<MigrationId, MigrationGraphEntry> entries = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Adds an entry.
         *
         * @throws IllegalArgumentException if an entry with the same id was already added
         */
        public Builder add(MigrationGraphEntry entry) {
            Objects.requireNonNull(entry, "entry must not be null");
            MigrationGraphEntry previous = entries.putIfAbsent(entry.id(), entry);
            if (previous != null) {
                throw new IllegalArgumentException(
                        "Duplicate migration in target graph: " + entry.id());
            }
            return this;
        }

        public MigrationGraph build() {
            return new MigrationGraph(new LinkedHashMap<>(entries));
        }
    }
}
