package com.upgradeguard.reconciliation.catalog;

import com.upgradeguard.reconciliation.LegacyExceptionGroup;
import com.upgradeguard.reconciliation.LegacyExceptionSet;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads legacy exception catalogs: JSON documents listing historical migrations that a target
 * release knows to be safe to ignore.
 *
 * <h2>Format</h2>
 *
 * <pre>{@code
 * {
 *   "description": "Migrations removed from the server over time",
 *   "groups": [
 *     {
 *       "reason": "social_django was removed in 5.0",
 *       "namespace": "social_django",
 *       "names": ["0001_initial", "0002_add_related_name"]
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p>{@code description} and {@code reason} are optional. An empty {@code groups} array is valid
 * and yields an empty set.
 */
public final class LegacyExceptionCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(LegacyExceptionCatalogLoader.class);

    private LegacyExceptionCatalogLoader() {
        // utility class
    }

    /**
     * Reads a catalog from a stream. The stream is closed.
     *
     * @param in catalog content, or null if the caller could not locate it
     * @param source location used in error messages
     * @throws ManifestFormatException if the document is missing or malformed
     */
    public static LegacyExceptionSet load(InputStream in, String source) {
        return toExceptionSet(CatalogMapper.read(in, source, CatalogDocument.class), source);
    }

    /** Reads a catalog from a file. */
    public static LegacyExceptionSet load(Path path) {
        return toExceptionSet(CatalogMapper.read(path, CatalogDocument.class), path.toString());
    }

    /** Reads a catalog from the classpath of this library's class loader. */
    public static LegacyExceptionSet loadResource(String resource) {
        InputStream in =
                LegacyExceptionCatalogLoader.class.getClassLoader().getResourceAsStream(resource);
        return load(in, "classpath:" + resource);
    }

    private static LegacyExceptionSet toExceptionSet(CatalogDocument document, String source) {
        if (document.groups() == null) {
            throw new ManifestFormatException(source, "'groups' is required");
        }
        List<LegacyExceptionGroup> groups = new ArrayList<>();
        for (int i = 0; i < document.groups().size(); i++) {
            GroupDocument group = document.groups().get(i);
            if (group == null) {
                throw new ManifestFormatException(source, "groups[%d] is null".formatted(i));
            }
            try {
                groups.add(
                        new LegacyExceptionGroup(group.reason(), group.namespace(), group.names()));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ManifestFormatException(
                        source, "groups[%d]: %s".formatted(i, e.getMessage()), e);
            }
        }
        LegacyExceptionSet exceptions = LegacyExceptionSet.fromGroups(groups);
        log.debug(
                "Loaded {} legacy migration exceptions in {} groups from {}",
                exceptions.size(),
                exceptions.groups().size(),
                source);
        return exceptions;
    }

    record CatalogDocument(String description, List<GroupDocument> groups) {}

    record GroupDocument(String reason, String namespace, List<String> names) {}
}
