package de.mirkosertic.jsonschema;

/**
 * Wraps a failure raised by an interceptor or by a capability implemented by a reflected value.
 */
public class HookException extends SchemaException {

    public HookException(final String path, final String stage, final Throwable cause) {
        super(path, stage + " failed: " + cause.getMessage(), cause);
    }
}
