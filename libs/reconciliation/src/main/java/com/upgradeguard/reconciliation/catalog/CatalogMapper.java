package com.upgradeguard.reconciliation.catalog;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/** Shared Jackson setup for the JSON documents in this package. */
final class CatalogMapper {

    private static final ObjectMapper MAPPER = createMapper();

    private CatalogMapper() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    static <T> T read(InputStream in, String source, Class<T> type) {
        if (in == null) {
            throw new ManifestFormatException(source, "document not found");
        }
        T document;
        try (InputStream stream = in) {
            document = MAPPER.readValue(stream, type);
        } catch (JsonProcessingException e) {
            throw new ManifestFormatException(source, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ManifestFormatException(source, "cannot be read: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new ManifestFormatException(source, "document is empty");
        }
        return document;
    }

    static <T> T read(Path path, Class<T> type) {
        InputStream in;
        try {
            in = Files.newInputStream(path);
        } catch (NoSuchFileException e) {
            throw new ManifestFormatException(path.toString(), "file does not exist", e);
        } catch (IOException e) {
            throw new ManifestFormatException(path.toString(), "cannot be opened", e);
        }
        return read(in, path.toString(), type);
    }
}
