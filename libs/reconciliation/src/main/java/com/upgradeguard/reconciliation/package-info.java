/**
 * Migration-history reconciliation.
 *
 * <p>{@link com.upgradeguard.reconciliation.MigrationReconciler} answers one question: is every
 * migration recorded as applied in a live database still accounted for by the target release,
 * either directly, through a squash ({@code replaces}), or as a known legacy exception? The
 * package has no I/O. Graphs and exception sets are plain values; the {@code catalog}
 * subpackage builds them from JSON.
 */
package com.upgradeguard.reconciliation;
