package com.upgradeguard.reconciliation.catalog;

import com.upgradeguard.reconciliation.MigrationGraph;
import com.upgradeguard.reconciliation.MigrationGraphEntry;
import com.upgradeguard.reconciliation.MigrationId;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the migration graph a target release declares, from a JSON manifest shipped with it.
 *
 * <h2>Format</h2>
 *
 * <pre>{@code
 * {
 *   "version": "9.0",
 *   "migrations": [
 *     { "namespace": "zerver", "name": "0001_initial" },
 *     {
 *       "namespace": "zerver",
 *       "name": "0001_squashed_0569",
 *       "replaces": [
 *         { "namespace": "zerver", "name": "0002_django_1_8" },
 *         { "namespace": "zerver", "name": "0003_custom_indexes" }
 *       ]
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p>A manifest that lists the same {@code (namespace, name)} twice is rejected.
 */
public final class MigrationManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationManifestLoader.class);

    private MigrationManifestLoader() {
        // utility class
    }

    /**
     * Reads a manifest from a stream. The stream is closed.
     *
     * @param in manifest content, or null if the caller could not locate it
     * @param source location used in error messages
     * @throws ManifestFormatException if the document is missing, malformed, or has duplicates
     */
    public static TargetManifest load(InputStream in, String source) {
        return toManifest(CatalogMapper.read(in, source, ManifestDocument.class), source);
    }

    /** Reads a manifest from a file. */
    public static TargetManifest load(Path path) {
        return toManifest(CatalogMapper.read(path, ManifestDocument.class), path.toString());
    }

    private static TargetManifest toManifest(ManifestDocument document, String source) {
        if (document.migrations() == null) {
            throw new ManifestFormatException(source, "'migrations' is required");
        }
        MigrationGraph.Builder graph = MigrationGraph.builder();
        int replaced = 0;
        for (int i = 0; i < document.migrations().size(); i++) {
            EntryDocument entry = document.migrations().get(i);
            String where = "migrations[%d]".formatted(i);
            if (entry == null) {
                throw new ManifestFormatException(source, where + " is null");
            }
            try {
                MigrationGraphEntry parsed =
                        new MigrationGraphEntry(
                                new MigrationId(entry.namespace(), entry.name()),
                                toIds(entry.replaces()));
                graph.add(parsed);
                replaced += parsed.replaces().size();
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ManifestFormatException(source, where + ": " + e.getMessage(), e);
            }
        }
        TargetManifest manifest = new TargetManifest(document.version(), graph.build());
        log.debug(
                "Loaded target manifest {} (version {}): {} migrations, {} replaced",
                source,
                manifest.version(),
                manifest.graph().size(),
                replaced);
        return manifest;
    }

    private static List<MigrationId> toIds(List<IdDocument> documents) {
        if (documents == null) {
            return List.of();
        }
        List<MigrationId> ids = new ArrayList<>(documents.size());
        for (IdDocument document : documents) {
            if (document == null) {
                throw new IllegalArgumentException("replaces must not contain null entries");
            }
            ids.add(new MigrationId(document.namespace(), document.name()));
        }
        return ids;
    }

    record ManifestDocument(String version, List<EntryDocument> migrations) {}

    record EntryDocument(String namespace, String name, List<IdDocument> replaces) {}

    record IdDocument(String namespace, String name) {}
}
