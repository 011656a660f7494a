package com.upgradeguard.upgradecheck.check;

import com.upgradeguard.reconciliation.MigrationId;
import java.util.List;

/**
 * Everything the operator needs to judge an incompatible upgrade: the applied migrations the
 * target cannot account for, and the two versions involved.
 *
 * @param missing unaccounted applied migrations, sorted by namespace then name
 * @param deployedVersion version of the currently running deployment
 * @param targetVersion version of the release being activated
 */
public record IncompatibilityReport(
        List<MigrationId> missing, String deployedVersion, String targetVersion) {

    /** First line of the diagnostic, followed by one line per missing migration. */
    public static final String HEADER =
            "Migrations which are currently applied, but missing in the new version:";

    public IncompatibilityReport {
        missing = List.copyOf(missing);
    }

    public int missingCount() {
        return missing.size();
    }

    /** The closing error line. */
    public String summary() {
        return ("This is not an upgrade -- the current deployment (version %s) contains %d database"
                        + " migrations which the target (version %s) does not.")
                .formatted(deployedVersion, missingCount(), targetVersion);
    }
}
