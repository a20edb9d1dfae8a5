package de.mirkosertic.jsonschema;

import org.jspecify.annotations.Nullable;

/**
 * Base class of all reflection failures. Carries the dotted property path at which the failure
 * happened, the empty string denotes the root value.
 */
public class SchemaException extends Exception {

    private final String path;

    public SchemaException(final String path, final String message) {
        this(path, message, null);
    }

    public SchemaException(final String path, final String message, @Nullable final Throwable cause) {
        super(format(path, message), cause);
        this.path = path;
    }

    protected SchemaException(final String path, final String message, final boolean writableStackTrace) {
        super(format(path, message), null, false, writableStackTrace);
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    private static String format(final String path, final String message) {
        return path.isEmpty() ? message : path + ": " + message;
    }
}
