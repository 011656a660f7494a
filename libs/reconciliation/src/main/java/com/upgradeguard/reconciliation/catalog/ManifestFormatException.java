package com.upgradeguard.reconciliation.catalog;

/**
 * Thrown when a target manifest or a legacy exception catalog cannot be read or does not describe
 * a valid migration graph.
 *
 * <p>Unchecked: a malformed data file is a packaging error of the target release, and the check
 * must stop rather than reconcile against partial data.
 */
public class ManifestFormatException extends RuntimeException {

    private final String source;

    public ManifestFormatException(String source, String message) {
        super("Invalid migration data in '%s': %s".formatted(source, message));
        this.source = source;
    }

    public ManifestFormatException(String source, String message, Throwable cause) {
        super("Invalid migration data in '%s': %s".formatted(source, message), cause);
        this.source = source;
    }

    /** Location of the offending document (file path or classpath resource). */
    public String source() {
        return source;
    }
}
