package com.upgradeguard.upgradecheck.check;

import com.upgradeguard.reconciliation.LegacyExceptionSet;
import com.upgradeguard.reconciliation.catalog.LegacyExceptionCatalogLoader;
import com.upgradeguard.reconciliation.catalog.ManifestFormatException;
import com.upgradeguard.reconciliation.catalog.MigrationManifestLoader;
import com.upgradeguard.reconciliation.catalog.TargetManifest;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads the target release's migration data from Spring resource locations ({@code file:},
 * {@code classpath:}, ...). Nothing is read until the check asks for it, so the version gate can
 * halt the process before any target data is touched.
 *
 * <p>WHY resource locations instead of paths: the manifest normally sits in the unpacked target
 * release ({@code file:}), while the bundled exception catalog ships inside this application
 * ({@code classpath:catalog/legacy-migrations.json}). One property type covers both.
 */
public class TargetMigrationDataLoader {

    private final ResourceLoader resourceLoader;
    private final String manifestLocation;
    private final List<String> exceptionLocations;

    public TargetMigrationDataLoader(
            ResourceLoader resourceLoader,
            String manifestLocation,
            List<String> exceptionLocations) {
        this.resourceLoader = resourceLoader;
        this.manifestLocation = manifestLocation;
        this.exceptionLocations = List.copyOf(exceptionLocations);
    }

    /**
     * @throws ManifestFormatException if the manifest is missing or malformed
     */
    public TargetManifest loadManifest() {
        return MigrationManifestLoader.load(open(manifestLocation), manifestLocation);
    }

    /**
     * Loads and merges every configured catalog. No catalogs means no exceptions.
     *
     * @throws ManifestFormatException if a catalog is missing or malformed
     */
    public LegacyExceptionSet loadLegacyExceptions() {
        LegacyExceptionSet exceptions = LegacyExceptionSet.empty();
        for (String location : exceptionLocations) {
            exceptions =
                    exceptions.merge(LegacyExceptionCatalogLoader.load(open(location), location));
        }
        return exceptions;
    }

    private InputStream open(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ManifestFormatException(location, "resource does not exist");
        }
        try {
            return resource.getInputStream();
        } catch (IOException e) {
            throw new ManifestFormatException(location, "cannot be opened", e);
        }
    }
}
