package de.mirkosertic.jsonschema;

/**
 * Thrown by property interceptors (or raised internally for unsupported types when configured) to omit
 * the current property. It never escapes {@link Reflector#reflect(Object, ReflectOption...)}.
 */
public class SkipPropertyException extends SchemaException {

    public SkipPropertyException() {
        super("", "property skipped", false);
    }
}
