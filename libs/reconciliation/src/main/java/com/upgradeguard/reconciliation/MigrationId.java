package com.upgradeguard.reconciliation;

import java.util.Comparator;

/**
 * Identity of a single migration: the owning component ({@code namespace}) plus a name that is
 * unique within that component.
 *
 * <p>Identity is the exact pair. Two ids with the same name in different namespaces are different
 * migrations, and no normalisation (case folding, prefix matching) is applied.
 *
 * <p>The natural order sorts by namespace, then name. It is only used to make diagnostics stable;
 * reconciliation itself never depends on order.
 *
 * @param namespace logical component the migration belongs to (e.g. {@code "zerver"})
 * @param name migration name within the namespace (e.g. {@code "0005_auto_20150920_1340"})
 */
public record MigrationId(String namespace, String name) implements Comparable<MigrationId> {

    private static final Comparator<MigrationId> ORDER =
            Comparator.comparing(MigrationId::namespace).thenComparing(MigrationId::name);

    public MigrationId {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }

    /** Shorthand factory, mostly for readable test and catalog code. */
    public static MigrationId of(String namespace, String name) {
        return new MigrationId(namespace, name);
    }

    @Override
    public int compareTo(MigrationId other) {
        return ORDER.compare(this, other);
    }

    /** Renders as {@code namespace name}, the format used in operator diagnostics. */
    @Override
    public String toString() {
        return namespace + " " + name;
    }
}
