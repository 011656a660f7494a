package com.upgradeguard.versiongate;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConfiguredVersionStore} backed by a key-value properties file, e.g.
 *
 * <pre>
 * postgresql.version=14
 * </pre>
 *
 * <p>A missing file, a missing key, a blank value and {@code 0} all mean "unset".
 *
 * <p>WHY line edits instead of {@link Properties#store}: the file is maintained by operators and
 * usually carries comments and other settings. Writing only touches the line for the configured
 * key; everything else is copied as it was. The result goes to a temporary sibling file that is
 * then moved over the original atomically, so a concurrent reader sees either the old or the new
 * file, never a partial one.
 */
public class PropertiesFileVersionStore implements ConfiguredVersionStore {

    /** Key used when none is configured. */
    public static final String DEFAULT_KEY = "postgresql.version";

    private static final Logger log = LoggerFactory.getLogger(PropertiesFileVersionStore.class);

    private final Path file;
    private final String key;

    public PropertiesFileVersionStore(Path file) {
        this(file, DEFAULT_KEY);
    }

    public PropertiesFileVersionStore(Path file, String key) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        this.key = key;
    }

    @Override
    public OptionalInt readConfiguredMajorVersion() {
        if (!Files.exists(file)) {
            return OptionalInt.empty();
        }
        String value = load().getProperty(key);
        if (value == null || value.isBlank()) {
            return OptionalInt.empty();
        }
        int version;
        try {
            version = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new VersionStoreException(
                    "Configured value of '%s' in %s is not an integer: '%s'"
                            .formatted(key, file, value),
                    e);
        }
        return version == 0 ? OptionalInt.empty() : OptionalInt.of(version);
    }

    @Override
    public void persistMajorVersion(int majorVersion) {
        List<String> lines = Files.exists(file) ? readLines() : List.of();
        List<String> updated = withValue(lines, Integer.toString(majorVersion));

        Path directory = file.toAbsolutePath().getParent();
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, updated, StandardCharsets.UTF_8);
                move(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new VersionStoreException("Failed to write " + key + " to " + file, e);
        }
        log.debug("Persisted {}={} to {}", key, majorVersion, file);
    }

    /**
     * Replaces every entry for the configured key with {@code key=value}, or appends one if there
     * is none. Comments, blank lines and other entries are copied unchanged, in order.
     */
    private List<String> withValue(List<String> lines, String value) {
        List<String> updated = new ArrayList<>(lines.size() + 1);
        boolean replaced = false;
        boolean continuation = false;
        boolean dropping = false;
        for (String line : lines) {
            if (continuation) {
                continuation = continues(line);
                if (!dropping) {
                    updated.add(line);
                }
                continue;
            }
            String lineKey = keyOf(line);
            continuation = lineKey != null && continues(line);
            dropping = key.equals(lineKey);
            if (!dropping) {
                updated.add(line);
            } else if (!replaced) {
                updated.add(key + "=" + value);
                replaced = true;
            }
        }
        if (!replaced) {
            updated.add(key + "=" + value);
        }
        return updated;
    }

    /** Key of a properties entry line, or null for comments and blank lines. */
    private static String keyOf(String line) {
        String trimmed = line.stripLeading();
        if (trimmed.isEmpty() || trimmed.charAt(0) == '#' || trimmed.charAt(0) == '!') {
            return null;
        }
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '\\' && i + 1 < trimmed.length()) {
                key.append(trimmed.charAt(++i));
            } else if (c == '=' || c == ':' || Character.isWhitespace(c)) {
                break;
            } else {
                key.append(c);
            }
        }
        return key.toString();
    }

    // An odd number of trailing backslashes continues the entry on the next line.
    private static boolean continues(String line) {
        int backslashes = 0;
        for (int i = line.length() - 1; i >= 0 && line.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(
                    temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}; falling back to replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Properties load() {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new VersionStoreException("Failed to read " + file, e);
        }
        return properties;
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new VersionStoreException("Failed to read " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    public String key() {
        return key;
    }
}
