package de.mirkosertic.jsonschema;

import java.lang.reflect.Type;

/**
 * Thrown when a type has no JSON Schema representation, for example functions, streams or threads.
 */
public class UnsupportedTypeException extends SchemaException {

    private final String typeName;

    public UnsupportedTypeException(final String path, final Type type) {
        this(path, type, "type is not supported");
    }

    public UnsupportedTypeException(final String path, final Type type, final String reason) {
        super(path, reason + ": " + type.getTypeName());
        this.typeName = type.getTypeName();
    }

    public String getTypeName() {
        return typeName;
    }
}
