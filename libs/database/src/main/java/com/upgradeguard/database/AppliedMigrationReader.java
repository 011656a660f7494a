package com.upgradeguard.database;

import com.upgradeguard.reconciliation.MigrationId;
import java.util.Set;

/** Reads the set of migrations the live database records as applied. */
@FunctionalInterface
public interface AppliedMigrationReader {

    /**
     * @return every applied migration; empty for a database that has never been migrated
     * @throws MigrationSourceException if the bookkeeping cannot be read
     */
    Set<MigrationId> readApplied();
}
