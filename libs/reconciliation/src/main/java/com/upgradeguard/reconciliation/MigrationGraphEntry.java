package com.upgradeguard.reconciliation;

import java.util.List;
import java.util.Objects;

/**
 * One migration known to the target codebase.
 *
 * <p>{@code replaces} lists the historical migrations this entry supersedes, typically because they
 * were squashed into it. An applied migration that appears in some entry's {@code replaces} list is
 * still accounted for, even though it no longer exists on its own.
 *
 * @param id key of this entry in the target graph
 * @param replaces superseded migrations in declaration order (never null, may be empty)
 */
public record MigrationGraphEntry(MigrationId id, List<MigrationId> replaces) {

    public MigrationGraphEntry {
        Objects.requireNonNull(id, "id must not be null");
        replaces = replaces == null ? List.of() : List.copyOf(replaces);
    }

    /** Creates an entry that replaces nothing. */
    public static MigrationGraphEntry of(MigrationId id) {
        return new MigrationGraphEntry(id, List.of());
    }

    /** Creates an entry that supersedes the given migrations. */
    public static MigrationGraphEntry squashing(MigrationId id, MigrationId... replaces) {
        return new MigrationGraphEntry(id, List.of(replaces));
    }

    /** Returns true if this entry was produced by squashing or folding in older migrations. */
    public boolean isReplacement() {
        return !replaces.isEmpty();
    }
}
